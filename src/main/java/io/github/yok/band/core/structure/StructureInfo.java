package io.github.yok.band.core.structure;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * 結晶構造のメタ情報（元素記号、元素ごとの原子数、格子行列）を保持するクラスです。
 *
 * <p>
 * 原子は構造ファイルで宣言された元素ブロックの順に並んでいる前提です。 例えば {@code [In, As]} と {@code [2, 3]} なら、原子 0-1 が In、原子 2-4 が As
 * です。
 * </p>
 */
@Getter
public final class StructureInfo {

    /**
     * f 軌道を持つ元素（ランタノイド・アクチノイド）の参照集合です。
     */
    private static final ImmutableSet<String> F_BLOCK_ELEMENTS = ImmutableSet.of("La", "Ac", "Ce",
            "Tb", "Th", "Pr", "Dy", "Pa", "Nd", "Ho", "U", "Pm", "Er", "Np", "Sm", "Tm", "Pu", "Eu",
            "Yb", "Am", "Gd", "Lu");

    /**
     * 元素記号（宣言順）です。
     */
    private final ImmutableList<String> siteSymbols;

    /**
     * 元素ごとの原子数（siteSymbols と同じ順）です。
     */
    private final ImmutableList<Integer> atomCounts;

    /**
     * 実空間の格子行列です（行が格子ベクトル）。
     */
    @Getter(AccessLevel.NONE)
    private final double[][] latticeMatrix;

    /**
     * 構造情報を生成します。
     *
     * @param siteSymbols 元素記号です（空不可）
     * @param atomCounts 元素ごとの原子数です（siteSymbols と同じ長さ、各 1 以上）
     * @param latticeMatrix 3×3 の格子行列です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public StructureInfo(List<String> siteSymbols, List<Integer> atomCounts,
            double[][] latticeMatrix) {
        Preconditions.checkNotNull(siteSymbols, "siteSymbols は null 不可です");
        Preconditions.checkNotNull(atomCounts, "atomCounts は null 不可です");
        Preconditions.checkNotNull(latticeMatrix, "latticeMatrix は null 不可です");
        Preconditions.checkArgument(!siteSymbols.isEmpty(), "siteSymbols は 1 件以上が必要です");
        Preconditions.checkArgument(siteSymbols.size() == atomCounts.size(),
                "siteSymbols と atomCounts の長さが一致しません: %s vs %s", siteSymbols.size(),
                atomCounts.size());
        for (Integer count : atomCounts) {
            Preconditions.checkArgument(count != null && count > 0, "原子数は 1 以上が必要です: %s",
                    atomCounts);
        }
        Preconditions.checkArgument(latticeMatrix.length == 3, "格子行列は 3 行が必要です");
        double[][] copy = new double[3][];
        for (int i = 0; i < 3; i++) {
            Preconditions.checkArgument(latticeMatrix[i] != null && latticeMatrix[i].length == 3,
                    "格子行列は 3×3 が必要です");
            copy[i] = latticeMatrix[i].clone();
        }
        this.siteSymbols = ImmutableList.copyOf(siteSymbols);
        this.atomCounts = ImmutableList.copyOf(atomCounts);
        this.latticeMatrix = copy;
    }

    /**
     * 格子行列のコピーを返します。
     *
     * @return 3×3 の格子行列です
     */
    public double[][] getLatticeMatrix() {
        double[][] copy = new double[3][];
        for (int i = 0; i < 3; i++) {
            copy[i] = latticeMatrix[i].clone();
        }
        return copy;
    }

    /**
     * 総原子数を返します。
     *
     * @return 総原子数です
     */
    public int totalAtoms() {
        int total = 0;
        for (int count : atomCounts) {
            total += count;
        }
        return total;
    }

    /**
     * 原子インデックス順の元素記号一覧を返します。
     *
     * @return 原子ごとの元素記号です
     */
    public ImmutableList<String> elementOfEachAtom() {
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (int i = 0; i < siteSymbols.size(); i++) {
            for (int j = 0; j < atomCounts.get(i); j++) {
                builder.add(siteSymbols.get(i));
            }
        }
        return builder.build();
    }

    /**
     * 指定元素に属する原子インデックスを昇順で返します。
     *
     * <p>
     * 同じ元素記号が複数のブロックで宣言されている場合は、全ブロックの原子を含めます。
     * </p>
     *
     * @param symbol 元素記号です
     * @return 原子インデックスです（該当なしの場合は空配列）
     */
    public int[] atomIndicesOf(String symbol) {
        List<String> perAtom = elementOfEachAtom();
        int count = 0;
        for (String s : perAtom) {
            if (s.equals(symbol)) {
                count++;
            }
        }
        int[] out = new int[count];
        int next = 0;
        for (int i = 0; i < perAtom.size(); i++) {
            if (perAtom.get(i).equals(symbol)) {
                out[next++] = i;
            }
        }
        return out;
    }

    /**
     * 構造に f ブロック元素が含まれるかを返します。
     *
     * @return f 軌道を持つ元素が含まれる場合は true です
     */
    public boolean hasFOrbitals() {
        for (String symbol : siteSymbols) {
            if (F_BLOCK_ELEMENTS.contains(symbol)) {
                return true;
            }
        }
        return false;
    }
}
