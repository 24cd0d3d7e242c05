package io.github.yok.band.core.structure;

import com.google.common.collect.ImmutableList;
import io.github.yok.band.core.error.ConfigurationException;
import java.util.EnumMap;
import java.util.Map;

/**
 * 軌道インデックスと s/p/d/f 区分の対応表です。
 *
 * <p>
 * 軌道軸は s:[0], p:[1..3], d:[4..8], f:[9..15] の連続ブロックです。 f 軌道の有無は構造から一度だけ判定し、以後は不変の表として扱います。
 * </p>
 */
public final class OrbitalTable {

    /**
     * 軌道ごとの表示ラベルです（インデックス順）。
     */
    private static final ImmutableList<String> LABELS = ImmutableList.of("s", "p_{y}", "p_{z}",
            "p_{x}", "d_{xy}", "d_{yz}", "d_{z^{2}}", "d_{xz}", "d_{x^{2}-y^{2}}", "f_{y^{3}x^{2}}",
            "f_{xyz}", "f_{yz^{2}}", "f_{z^{3}}", "f_{xz^{2}}", "f_{zx^{3}}", "f_{x^{3}}");

    /**
     * f 軌道を含まない表です（9 軌道）。
     */
    public static final OrbitalTable WITHOUT_F = new OrbitalTable(false);

    /**
     * f 軌道を含む表です（16 軌道）。
     */
    public static final OrbitalTable WITH_F = new OrbitalTable(true);

    private final boolean hasF;

    private final Map<OrbitalGroup, int[]> blocks = new EnumMap<>(OrbitalGroup.class);

    private OrbitalTable(boolean hasF) {
        this.hasF = hasF;
        blocks.put(OrbitalGroup.S, range(0, 1));
        blocks.put(OrbitalGroup.P, range(1, 4));
        blocks.put(OrbitalGroup.D, range(4, 9));
        if (hasF) {
            blocks.put(OrbitalGroup.F, range(9, 16));
        }
    }

    /**
     * 構造に応じた表を返します。
     *
     * @param structure 構造情報です
     * @return 対応表です
     */
    public static OrbitalTable forStructure(StructureInfo structure) {
        return structure.hasFOrbitals() ? WITH_F : WITHOUT_F;
    }

    private static int[] range(int from, int to) {
        int[] out = new int[to - from];
        for (int i = 0; i < out.length; i++) {
            out[i] = from + i;
        }
        return out;
    }

    /**
     * f 軌道を含むかを返します。
     *
     * @return f 軌道を含む場合は true です
     */
    public boolean hasF() {
        return hasF;
    }

    /**
     * 軌道数（9 または 16）を返します。
     *
     * @return 軌道数です
     */
    public int orbitalCount() {
        return hasF ? 16 : 9;
    }

    /**
     * 利用可能な区分を宣言順で返します。
     *
     * @return 区分リストです
     */
    public ImmutableList<OrbitalGroup> groups() {
        return ImmutableList.copyOf(blocks.keySet());
    }

    /**
     * 区分に属する軌道インデックスを返します。
     *
     * @param group 区分です
     * @return 軌道インデックスです
     * @throws ConfigurationException f 軌道を含まない表で F を指定した場合に発生します
     */
    public int[] indicesOf(OrbitalGroup group) {
        int[] indices = blocks.get(group);
        if (indices == null) {
            throw new ConfigurationException("この構造には f 軌道がありません: " + group.label());
        }
        return indices.clone();
    }

    /**
     * 軌道インデックスを検証します。
     *
     * @param orbital 軌道インデックスです
     * @return 同じ軌道インデックスです
     * @throws ConfigurationException 範囲外の場合に発生します
     */
    public int checkOrbital(int orbital) {
        if (orbital < 0 || orbital >= orbitalCount()) {
            throw new ConfigurationException(
                    "軌道インデックスが範囲外です: " + orbital + "（有効範囲 0-" + (orbitalCount() - 1) + "）");
        }
        return orbital;
    }

    /**
     * 軌道の表示ラベルを返します。
     *
     * @param orbital 軌道インデックスです
     * @return ラベルです
     */
    public String label(int orbital) {
        return LABELS.get(checkOrbital(orbital));
    }
}
