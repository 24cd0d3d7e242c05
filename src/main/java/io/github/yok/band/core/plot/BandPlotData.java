package io.github.yok.band.core.plot;

import com.google.common.collect.ImmutableList;
import io.github.yok.band.core.path.TickMark;
import java.util.List;
import lombok.Value;

/**
 * 描画側へ渡すバンド構造のプロット用データです。
 */
@Value
public class BandPlotData {

    /**
     * 区間ごとのデータ（k パスの順）です。
     */
    ImmutableList<SegmentPlotData> segments;

    /**
     * 高対称点の目盛りです。
     */
    ImmutableList<TickMark> ticks;

    /**
     * 表示対象のバンド番号（元のデータセットでの番号）です。
     */
    int[] bandIndices;

    /**
     * 射影チャネルのラベルです（射影を使わない場合は空）。
     */
    ImmutableList<String> channelLabels;

    /**
     * プロット用データを生成します。
     *
     * @param segments 区間ごとのデータです
     * @param ticks 目盛りです
     * @param bandIndices 表示対象のバンド番号です
     * @param channelLabels 射影チャネルのラベルです
     */
    public BandPlotData(List<SegmentPlotData> segments, List<TickMark> ticks, int[] bandIndices,
            List<String> channelLabels) {
        this.segments = ImmutableList.copyOf(segments);
        this.ticks = ImmutableList.copyOf(ticks);
        this.bandIndices = bandIndices.clone();
        this.channelLabels = ImmutableList.copyOf(channelLabels);
    }

    /**
     * 全区間の距離を連結して返します。
     *
     * @return 距離です
     */
    public double[] concatenatedDistances() {
        int total = 0;
        for (SegmentPlotData s : segments) {
            total += s.pointCount();
        }
        double[] out = new double[total];
        int next = 0;
        for (SegmentPlotData s : segments) {
            System.arraycopy(s.getDistances(), 0, out, next, s.pointCount());
            next += s.pointCount();
        }
        return out;
    }

    /**
     * 全区間の固有値をバンドごとに連結して返します。
     *
     * @return 固有値 {@code [band][point]} です
     */
    public double[][] concatenatedEnergies() {
        int total = 0;
        for (SegmentPlotData s : segments) {
            total += s.pointCount();
        }
        double[][] out = new double[bandIndices.length][total];
        int next = 0;
        for (SegmentPlotData s : segments) {
            for (int b = 0; b < bandIndices.length; b++) {
                System.arraycopy(s.getEnergies()[b], 0, out[b], next, s.pointCount());
            }
            next += s.pointCount();
        }
        return out;
    }
}
