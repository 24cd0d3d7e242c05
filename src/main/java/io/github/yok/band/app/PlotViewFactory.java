package io.github.yok.band.app;

import io.github.yok.band.core.dataset.Dataset;
import io.github.yok.band.core.error.ConfigurationException;
import io.github.yok.band.core.projection.ProjectionAggregator;
import io.github.yok.band.core.projection.ProjectionAggregator.AtomGroup;
import io.github.yok.band.core.projection.ProjectionAggregator.AtomOrbital;
import io.github.yok.band.core.projection.ProjectionAggregator.ElementGroup;
import io.github.yok.band.core.projection.ProjectionAggregator.ElementOrbital;
import io.github.yok.band.core.projection.ProjectionChannels;
import io.github.yok.band.core.projection.ProjectionTensor;
import io.github.yok.band.core.structure.OrbitalGroup;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 表示の設定から射影チャネルを組み立てるクラスです。
 *
 * <p>
 * 選択子の書式は次のとおりです。
 * </p>
 *
 * <ul>
 * <li>原子と軌道の組: {@code "0:3"}</li>
 * <li>原子と軌道区分の組: {@code "0:spd"}（区分ごとに 1 チャネル）</li>
 * <li>元素と軌道の組: {@code "In:3"}</li>
 * <li>元素と軌道区分の組: {@code "As:spd"}（区分ごとに 1 チャネル）</li>
 * </ul>
 */
public final class PlotViewFactory {

    /**
     * 表示の種類です。
     */
    public enum ViewKind {
        PLAIN, SPD, ORBITALS, ATOMS, ATOM_ORBITALS, ATOM_SPD, ELEMENTS, ELEMENT_ORBITALS,
        ELEMENT_SPD;

        /**
         * 射影重みが必要かどうかを返します。
         *
         * @return PLAIN 以外は true です
         */
        public boolean needsProjections() {
            return this != PLAIN;
        }

        /**
         * 出力ファイル名に使う表示名を返します。
         *
         * @return 小文字の表示名です（例: element_spd）
         */
        public String viewName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * データを読む前に、選択子の書式だけを検証します。
     *
     * @param view 表示の設定です
     * @param projected 射影重みを読み込む設定かどうかです
     * @throws ConfigurationException 書式が不正な場合、または射影重みを読み込まない設定で射影表示を指定した場合に発生します
     */
    public void validate(BandProperties.View view, boolean projected) {
        if (view.getKind().needsProjections() && !projected) {
            throw new ConfigurationException(
                    "射影表示には band.projected=true が必要です: " + view.getKind());
        }
        switch (view.getKind()) {
            case SPD:
                OrbitalGroup.parseAll(view.getSpd());
                break;
            case ORBITALS:
                requireNonEmpty(view.getOrbitals(), "view.orbitals");
                break;
            case ATOMS:
                requireNonEmpty(view.getAtoms(), "view.atoms");
                break;
            case ATOM_ORBITALS:
                parseAtomOrbitals(view.getAtomOrbitals());
                break;
            case ATOM_SPD:
                parseAtomSpd(view.getAtomSpd());
                break;
            case ELEMENTS:
                requireNonEmpty(view.getElements(), "view.elements");
                break;
            case ELEMENT_ORBITALS:
                parseElementOrbitals(view.getElementOrbitals());
                break;
            case ELEMENT_SPD:
                parseElementSpd(view.getElementSpd());
                break;
            default:
                break;
        }
    }

    /**
     * 表示の設定に従って射影チャネルを組み立てます。
     *
     * @param dataset データセットです
     * @param view 表示の設定です
     * @return 射影チャネルです（PLAIN の場合は null）
     * @throws ConfigurationException 選択子が不正な場合、またはデータセットに存在しない原子・元素・軌道を指定した場合に発生します
     */
    public ProjectionChannels channels(Dataset dataset, BandProperties.View view) {
        if (!view.getKind().needsProjections()) {
            return null;
        }
        ProjectionTensor tensor = dataset.projections();
        ProjectionAggregator aggregator =
                new ProjectionAggregator(dataset.getOrbitalTable(), dataset.getStructure());
        switch (view.getKind()) {
            case SPD:
                return aggregator.bySpd(tensor, OrbitalGroup.parseAll(view.getSpd()));
            case ORBITALS:
                return aggregator.byOrbitals(tensor,
                        toArray(requireNonEmpty(view.getOrbitals(), "view.orbitals")));
            case ATOMS:
                return aggregator.byAtoms(tensor,
                        toArray(requireNonEmpty(view.getAtoms(), "view.atoms")));
            case ATOM_ORBITALS:
                return aggregator.byAtomOrbitals(tensor, parseAtomOrbitals(view.getAtomOrbitals()));
            case ATOM_SPD:
                return aggregator.byAtomSpd(tensor, parseAtomSpd(view.getAtomSpd()));
            case ELEMENTS:
                return aggregator.byElements(tensor,
                        requireNonEmpty(view.getElements(), "view.elements"));
            case ELEMENT_ORBITALS:
                return aggregator.byElementOrbitals(tensor,
                        parseElementOrbitals(view.getElementOrbitals()));
            case ELEMENT_SPD:
                return aggregator.byElementSpd(tensor, parseElementSpd(view.getElementSpd()));
            default:
                throw new IllegalStateException("未知の表示の種類です: " + view.getKind());
        }
    }

    static List<AtomOrbital> parseAtomOrbitals(List<String> selectors) {
        List<AtomOrbital> out = new ArrayList<>();
        for (String selector : requireNonEmpty(selectors, "view.atom-orbitals")) {
            String[] parts = split(selector);
            out.add(new AtomOrbital(parseIndex(parts[0], selector), parseIndex(parts[1], selector)));
        }
        return out;
    }

    static List<AtomGroup> parseAtomSpd(List<String> selectors) {
        List<AtomGroup> out = new ArrayList<>();
        for (String selector : requireNonEmpty(selectors, "view.atom-spd")) {
            String[] parts = split(selector);
            int atom = parseIndex(parts[0], selector);
            for (OrbitalGroup group : OrbitalGroup.parseAll(parts[1])) {
                out.add(new AtomGroup(atom, group));
            }
        }
        return out;
    }

    static List<ElementOrbital> parseElementOrbitals(List<String> selectors) {
        List<ElementOrbital> out = new ArrayList<>();
        for (String selector : requireNonEmpty(selectors, "view.element-orbitals")) {
            String[] parts = split(selector);
            out.add(new ElementOrbital(parts[0], parseIndex(parts[1], selector)));
        }
        return out;
    }

    static List<ElementGroup> parseElementSpd(List<String> selectors) {
        List<ElementGroup> out = new ArrayList<>();
        for (String selector : requireNonEmpty(selectors, "view.element-spd")) {
            String[] parts = split(selector);
            for (OrbitalGroup group : OrbitalGroup.parseAll(parts[1])) {
                out.add(new ElementGroup(parts[0], group));
            }
        }
        return out;
    }

    private static String[] split(String selector) {
        String[] parts = selector == null ? new String[0] : selector.trim().split(":");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new ConfigurationException("選択子は \"左:右\" 形式で指定してください: " + selector);
        }
        return new String[] {parts[0].trim(), parts[1].trim()};
    }

    private static int parseIndex(String text, String selector) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("選択子のインデックスが整数ではありません: " + selector, e);
        }
    }

    private static <T> List<T> requireNonEmpty(List<T> values, String key) {
        if (values == null || values.isEmpty()) {
            throw new ConfigurationException(key + " を 1 件以上指定してください");
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                throw new ConfigurationException(key + " の " + i + " 番目が空です");
            }
        }
        return values;
    }

    private static int[] toArray(List<Integer> values) {
        int[] out = new int[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }
}
