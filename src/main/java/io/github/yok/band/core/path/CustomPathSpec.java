package io.github.yok.band.core.path;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.band.core.error.ConfigurationException;
import java.util.List;

/**
 * 区間の選択と並べ替えの指定です。
 *
 * <p>
 * 1 始まりの符号付き区間番号の並びで、負の番号はその区間を逆向きにたどることを表します。 例えば {@code [2, -1]} は「区間 2 を順方向、続けて区間 1
 * を逆方向」です。
 * </p>
 */
public final class CustomPathSpec {

    private final ImmutableList<Integer> indices;

    private CustomPathSpec(List<Integer> indices) {
        this.indices = ImmutableList.copyOf(indices);
    }

    /**
     * 指定を生成します。
     *
     * @param indices 1 始まりの符号付き区間番号です
     * @return 指定です
     * @throws ConfigurationException 空の場合、または 0 を含む場合に発生します
     */
    public static CustomPathSpec of(List<Integer> indices) {
        Preconditions.checkNotNull(indices, "indices は null 不可です");
        if (indices.isEmpty()) {
            throw new ConfigurationException("custom-kpath が空です");
        }
        for (Integer index : indices) {
            if (index == null || index == 0) {
                throw new ConfigurationException(
                        "custom-kpath の区間番号は 0 以外の 1 始まりの整数で指定してください: " + indices);
            }
        }
        return new CustomPathSpec(indices);
    }

    /**
     * 指定を生成します。
     *
     * @param indices 1 始まりの符号付き区間番号です
     * @return 指定です
     */
    public static CustomPathSpec of(int... indices) {
        ImmutableList.Builder<Integer> builder = ImmutableList.builder();
        for (int index : indices) {
            builder.add(index);
        }
        return of(builder.build());
    }

    public ImmutableList<Integer> indices() {
        return indices;
    }

    public int size() {
        return indices.size();
    }

    /**
     * i 番目の指定が参照する区間番号（0 始まり）を返します。
     *
     * @param i 指定の位置です
     * @return 区間番号です
     */
    public int segmentId(int i) {
        return Math.abs(indices.get(i)) - 1;
    }

    /**
     * i 番目の指定が逆向きかを返します。
     *
     * @param i 指定の位置です
     * @return 逆向きの場合は true です
     */
    public boolean flipped(int i) {
        return indices.get(i) < 0;
    }

    /**
     * すべての区間番号が自然な区間分割の範囲内かを検査します。
     *
     * @param segmentCount 自然な区間数です
     * @throws ConfigurationException 範囲外の区間番号を含む場合に発生します
     */
    public void validate(int segmentCount) {
        for (int index : indices) {
            if (Math.abs(index) > segmentCount) {
                throw new ConfigurationException("custom-kpath の区間番号 " + index + " は範囲外です（有効範囲 1-"
                        + segmentCount + "、負の値で逆向き）");
            }
        }
    }

    @Override
    public String toString() {
        return indices.toString();
    }
}
