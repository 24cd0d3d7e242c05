package io.github.yok.band.core.path;

/**
 * 高対称点ラベルの整形です。
 */
public final class KPointLabels {

    private KPointLabels() {}

    /**
     * ラベルを表示用に整形します。前後の空白を除き、{@code G} は {@code \Gamma} に置き換えます。
     *
     * @param raw ラベルです（null は空文字列として扱います）
     * @return 表示用ラベルです
     */
    public static String format(String raw) {
        String label = raw == null ? "" : raw.trim();
        return "G".equals(label) ? "\\Gamma" : label;
    }

    /**
     * 区間境界で隣り合う 2 つのラベルをまとめます。同じなら 1 つに、異なれば {@code A|B} にします。
     *
     * @param end 前の区間の終点ラベル（整形済み）です
     * @param start 次の区間の始点ラベル（整形済み）です
     * @return まとめたラベルです
     */
    public static String merge(String end, String start) {
        return end.equals(start) ? end : end + "|" + start;
    }
}
