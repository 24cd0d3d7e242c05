package io.github.yok.band.core.projection;

import com.google.common.base.Preconditions;
import io.github.yok.band.core.error.ConfigurationException;
import io.github.yok.band.core.structure.OrbitalGroup;
import io.github.yok.band.core.structure.OrbitalTable;
import io.github.yok.band.core.structure.StructureInfo;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/**
 * 射影重みを軌道・原子・元素・s/p/d(/f) 区分で集計するクラスです。
 *
 * <p>
 * 入力の {@link ProjectionTensor} は二乗済みの非負値です。集計は選択した部分集合の単純な和で、 重複する選択子を指定した場合はチャネルが重複するだけで、1
 * チャネル内で二重に数えることはありません。 チャネルの並びは常に選択子の指定順です。
 * </p>
 */
public final class ProjectionAggregator {

    /**
     * 軌道区分の対応表です。
     */
    private final OrbitalTable orbitalTable;

    /**
     * 構造情報です（元素から原子への対応に使います）。
     */
    private final StructureInfo structure;

    /**
     * 集計器を生成します。
     *
     * @param orbitalTable 軌道区分の対応表です
     * @param structure 構造情報です
     */
    public ProjectionAggregator(OrbitalTable orbitalTable, StructureInfo structure) {
        this.orbitalTable = Preconditions.checkNotNull(orbitalTable, "orbitalTable は null 不可です");
        this.structure = Preconditions.checkNotNull(structure, "structure は null 不可です");
    }

    /**
     * 原子と軌道の組です。
     */
    @Value
    public static class AtomOrbital {

        int atom;

        int orbital;
    }

    /**
     * 原子と軌道区分の組です。
     */
    @Value
    public static class AtomGroup {

        int atom;

        OrbitalGroup group;
    }

    /**
     * 元素と軌道の組です。
     */
    @Value
    public static class ElementOrbital {

        String element;

        int orbital;
    }

    /**
     * 元素と軌道区分の組です。
     */
    @Value
    public static class ElementGroup {

        String element;

        OrbitalGroup group;
    }

    /**
     * 指定した軌道ごとに、全原子で和を取ります。
     *
     * @param tensor 射影重みです
     * @param orbitals 軌道インデックスです
     * @return 軌道ごとのチャネルです
     * @throws ConfigurationException 範囲外の軌道を含む場合に発生します
     */
    public ProjectionChannels byOrbitals(ProjectionTensor tensor, int[] orbitals) {
        checkTensor(tensor);
        int[] allAtoms = allAtoms(tensor);
        List<int[]> atomSets = new ArrayList<>();
        List<int[]> orbitalSets = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (int orbital : nonEmpty(orbitals, "軌道")) {
            atomSets.add(allAtoms);
            orbitalSets.add(new int[] {orbitalTable.checkOrbital(orbital)});
            labels.add(orbitalTable.label(orbital));
        }
        return sum(tensor, atomSets, orbitalSets, labels);
    }

    /**
     * 指定した軌道区分ごとに、全原子で和を取ります。
     *
     * @param tensor 射影重みです
     * @param groups 軌道区分です
     * @return 区分ごとのチャネルです
     * @throws ConfigurationException f 軌道のない構造で F を指定した場合に発生します
     */
    public ProjectionChannels bySpd(ProjectionTensor tensor, List<OrbitalGroup> groups) {
        checkTensor(tensor);
        int[] allAtoms = allAtoms(tensor);
        List<int[]> atomSets = new ArrayList<>();
        List<int[]> orbitalSets = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (OrbitalGroup group : nonEmpty(groups, "軌道区分")) {
            atomSets.add(allAtoms);
            orbitalSets.add(orbitalTable.indicesOf(group));
            labels.add(group.label());
        }
        return sum(tensor, atomSets, orbitalSets, labels);
    }

    /**
     * 指定した原子ごとに、全軌道で和を取ります。
     *
     * @param tensor 射影重みです
     * @param atoms 原子インデックス（0 始まり）です
     * @return 原子ごとのチャネルです
     * @throws ConfigurationException 範囲外の原子を含む場合に発生します
     */
    public ProjectionChannels byAtoms(ProjectionTensor tensor, int[] atoms) {
        checkTensor(tensor);
        int[] allOrbitals = allOrbitals();
        List<int[]> atomSets = new ArrayList<>();
        List<int[]> orbitalSets = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (int atom : nonEmpty(atoms, "原子")) {
            atomSets.add(new int[] {checkAtom(atom)});
            orbitalSets.add(allOrbitals);
            labels.add(atomLabel(atom));
        }
        return sum(tensor, atomSets, orbitalSets, labels);
    }

    /**
     * 原子と軌道の組ごとに重みを取り出します。
     *
     * @param tensor 射影重みです
     * @param pairs 原子と軌道の組です
     * @return 組ごとのチャネルです
     * @throws ConfigurationException 範囲外の原子・軌道を含む場合に発生します
     */
    public ProjectionChannels byAtomOrbitals(ProjectionTensor tensor, List<AtomOrbital> pairs) {
        checkTensor(tensor);
        List<int[]> atomSets = new ArrayList<>();
        List<int[]> orbitalSets = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (AtomOrbital pair : nonEmpty(pairs, "原子と軌道の組")) {
            atomSets.add(new int[] {checkAtom(pair.getAtom())});
            orbitalSets.add(new int[] {orbitalTable.checkOrbital(pair.getOrbital())});
            labels.add(atomLabel(pair.getAtom()) + "(" + orbitalTable.label(pair.getOrbital())
                    + ")");
        }
        return sum(tensor, atomSets, orbitalSets, labels);
    }

    /**
     * 原子と軌道区分の組ごとに和を取ります。
     *
     * @param tensor 射影重みです
     * @param pairs 原子と軌道区分の組です
     * @return 組ごとのチャネルです
     * @throws ConfigurationException 範囲外の原子、または存在しない区分を含む場合に発生します
     */
    public ProjectionChannels byAtomSpd(ProjectionTensor tensor, List<AtomGroup> pairs) {
        checkTensor(tensor);
        List<int[]> atomSets = new ArrayList<>();
        List<int[]> orbitalSets = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (AtomGroup pair : nonEmpty(pairs, "原子と軌道区分の組")) {
            atomSets.add(new int[] {checkAtom(pair.getAtom())});
            orbitalSets.add(orbitalTable.indicesOf(pair.getGroup()));
            labels.add(atomLabel(pair.getAtom()) + "(" + pair.getGroup().label() + ")");
        }
        return sum(tensor, atomSets, orbitalSets, labels);
    }

    /**
     * 指定した元素ごとに、その元素の全原子・全軌道で和を取ります。
     *
     * @param tensor 射影重みです
     * @param elements 元素記号です
     * @return 元素ごとのチャネルです
     * @throws ConfigurationException 構造に存在しない元素を含む場合に発生します
     */
    public ProjectionChannels byElements(ProjectionTensor tensor, List<String> elements) {
        checkTensor(tensor);
        int[] allOrbitals = allOrbitals();
        List<int[]> atomSets = new ArrayList<>();
        List<int[]> orbitalSets = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (String element : nonEmpty(elements, "元素")) {
            atomSets.add(atomsOf(element));
            orbitalSets.add(allOrbitals);
            labels.add(element);
        }
        return sum(tensor, atomSets, orbitalSets, labels);
    }

    /**
     * 元素と軌道の組ごとに、その元素の全原子で和を取ります。
     *
     * @param tensor 射影重みです
     * @param pairs 元素と軌道の組です
     * @return 組ごとのチャネルです
     * @throws ConfigurationException 存在しない元素、または範囲外の軌道を含む場合に発生します
     */
    public ProjectionChannels byElementOrbitals(ProjectionTensor tensor,
            List<ElementOrbital> pairs) {
        checkTensor(tensor);
        List<int[]> atomSets = new ArrayList<>();
        List<int[]> orbitalSets = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (ElementOrbital pair : nonEmpty(pairs, "元素と軌道の組")) {
            atomSets.add(atomsOf(pair.getElement()));
            orbitalSets.add(new int[] {orbitalTable.checkOrbital(pair.getOrbital())});
            labels.add(pair.getElement() + "(" + orbitalTable.label(pair.getOrbital()) + ")");
        }
        return sum(tensor, atomSets, orbitalSets, labels);
    }

    /**
     * 元素と軌道区分の組ごとに、その元素の全原子で和を取ります。
     *
     * @param tensor 射影重みです
     * @param pairs 元素と軌道区分の組です
     * @return 組ごとのチャネルです
     * @throws ConfigurationException 存在しない元素、または存在しない区分を含む場合に発生します
     */
    public ProjectionChannels byElementSpd(ProjectionTensor tensor, List<ElementGroup> pairs) {
        checkTensor(tensor);
        List<int[]> atomSets = new ArrayList<>();
        List<int[]> orbitalSets = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (ElementGroup pair : nonEmpty(pairs, "元素と軌道区分の組")) {
            atomSets.add(atomsOf(pair.getElement()));
            orbitalSets.add(orbitalTable.indicesOf(pair.getGroup()));
            labels.add(pair.getElement() + "(" + pair.getGroup().label() + ")");
        }
        return sum(tensor, atomSets, orbitalSets, labels);
    }

    /**
     * チャネルごとに（原子集合 × 軌道集合）の和を取ります。
     */
    private static ProjectionChannels sum(ProjectionTensor tensor, List<int[]> atomSets,
            List<int[]> orbitalSets, List<String> labels) {
        int bands = tensor.bandCount();
        int kpoints = tensor.kpointCount();
        int channels = labels.size();
        double[][][] out = new double[bands][kpoints][channels];
        for (int b = 0; b < bands; b++) {
            for (int k = 0; k < kpoints; k++) {
                for (int c = 0; c < channels; c++) {
                    double s = 0.0;
                    for (int atom : atomSets.get(c)) {
                        for (int orbital : orbitalSets.get(c)) {
                            s += tensor.weight(b, k, atom, orbital);
                        }
                    }
                    out[b][k][c] = s;
                }
            }
        }
        return new ProjectionChannels(out, labels);
    }

    private void checkTensor(ProjectionTensor tensor) {
        Preconditions.checkNotNull(tensor, "tensor は null 不可です");
        Preconditions.checkArgument(tensor.atomCount() == structure.totalAtoms(),
                "射影重みの原子数が構造と一致しません: %s vs %s", tensor.atomCount(), structure.totalAtoms());
        Preconditions.checkArgument(tensor.orbitalCount() == orbitalTable.orbitalCount(),
                "射影重みの軌道数が対応表と一致しません: %s vs %s", tensor.orbitalCount(),
                orbitalTable.orbitalCount());
    }

    private int checkAtom(int atom) {
        if (atom < 0 || atom >= structure.totalAtoms()) {
            throw new ConfigurationException("原子インデックスが範囲外です: " + atom + "（有効範囲 0-"
                    + (structure.totalAtoms() - 1) + "）");
        }
        return atom;
    }

    private int[] atomsOf(String element) {
        int[] atoms = structure.atomIndicesOf(element);
        if (atoms.length == 0) {
            throw new ConfigurationException(
                    "構造に存在しない元素です: " + element + "（構造の元素 " + structure.getSiteSymbols() + "）");
        }
        return atoms;
    }

    private String atomLabel(int atom) {
        return structure.elementOfEachAtom().get(atom) + atom;
    }

    private static int[] allAtoms(ProjectionTensor tensor) {
        int[] out = new int[tensor.atomCount()];
        for (int i = 0; i < out.length; i++) {
            out[i] = i;
        }
        return out;
    }

    private int[] allOrbitals() {
        int[] out = new int[orbitalTable.orbitalCount()];
        for (int i = 0; i < out.length; i++) {
            out[i] = i;
        }
        return out;
    }

    private static int[] nonEmpty(int[] selectors, String what) {
        if (selectors == null || selectors.length == 0) {
            throw new ConfigurationException(what + "の選択が空です");
        }
        return selectors;
    }

    private static <T> List<T> nonEmpty(List<T> selectors, String what) {
        if (selectors == null || selectors.isEmpty()) {
            throw new ConfigurationException(what + "の選択が空です");
        }
        return selectors;
    }
}
