package io.github.yok.band.core.path;

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * k パスの 1 区間です。
 *
 * <p>
 * データセットの k 点配列上の半開区間 {@code [start, end)} を参照します。配列はコピーしません。 ラベルは自然な向き（start 側 → end
 * 側）で保持し、{@link #firstLabel()} と {@link #lastLabel()} が進行方向のラベルを返します。
 * </p>
 */
@Value
public class PathSegment {

    /**
     * 自然な区間分割での区間番号（0 始まり）です。
     */
    int segmentId;

    /**
     * 開始インデックス（含む）です。
     */
    int start;

    /**
     * 終了インデックス（含まない）です。
     */
    int end;

    /**
     * start 側の高対称点ラベルです。
     */
    String startLabel;

    /**
     * end 側の高対称点ラベルです。
     */
    String endLabel;

    /**
     * 逆向きにたどるかどうかです。
     */
    boolean reversed;

    /**
     * 区間を生成します。
     *
     * @param segmentId 区間番号です
     * @param start 開始インデックスです
     * @param end 終了インデックスです（start より大きい値）
     * @param startLabel start 側のラベルです
     * @param endLabel end 側のラベルです
     * @param reversed 逆向きにたどる場合は true です
     */
    public PathSegment(int segmentId, int start, int end, String startLabel, String endLabel,
            boolean reversed) {
        Preconditions.checkArgument(segmentId >= 0, "segmentId は 0 以上が必要です: %s", segmentId);
        Preconditions.checkArgument(start >= 0 && end > start, "区間が不正です: [%s, %s)", start, end);
        this.segmentId = segmentId;
        this.start = start;
        this.end = end;
        this.startLabel = startLabel;
        this.endLabel = endLabel;
        this.reversed = reversed;
    }

    /**
     * 区間の点数を返します。
     *
     * @return 点数です
     */
    public int length() {
        return end - start;
    }

    /**
     * 進行方向に並べた k 点インデックスを返します。
     *
     * @return インデックスです
     */
    public int[] indices() {
        int[] out = new int[length()];
        for (int i = 0; i < out.length; i++) {
            out[i] = reversed ? end - 1 - i : start + i;
        }
        return out;
    }

    /**
     * 進行方向で最初の点のラベルを返します。
     *
     * @return ラベルです
     */
    public String firstLabel() {
        return reversed ? endLabel : startLabel;
    }

    /**
     * 進行方向で最後の点のラベルを返します。
     *
     * @return ラベルです
     */
    public String lastLabel() {
        return reversed ? startLabel : endLabel;
    }

    /**
     * 向きを指定した同じ区間を返します。
     *
     * @param flip 逆向きにする場合は true です（自然な向きに対して）
     * @return 区間です
     */
    public PathSegment withReversed(boolean flip) {
        return new PathSegment(segmentId, start, end, startLabel, endLabel, flip);
    }
}
