package io.github.yok.band.core.plot;

import java.util.List;
import lombok.Value;

/**
 * k パスの 1 区間分のプロット用データです。
 *
 * <p>
 * 値はすべて進行方向に並べてあり、補間した場合は補間後の点です。 バンドの並びは {@link BandPlotData#getBandIndices()} の順です。
 * </p>
 */
@Value
public class SegmentPlotData {

    /**
     * 自然な区間分割での区間番号（0 始まり）です。
     */
    int segmentId;

    /**
     * 逆向きにたどったかどうかです。
     */
    boolean reversed;

    /**
     * 横軸の距離です。
     */
    double[] distances;

    /**
     * 固有値 {@code [band][point]} です。
     */
    double[][] energies;

    /**
     * スペクトル重み {@code [band][point]} です（展開していない場合は null）。
     */
    double[][] spectralWeights;

    /**
     * スピン軸射影 {@code [band][point]} です（SOC 軸を指定していない場合は null）。
     */
    double[][] spinProjections;

    /**
     * 射影チャネルごとの重み {@code [band][point]} です（射影を使わない場合は空）。
     */
    List<double[][]> channels;

    /**
     * 点数を返します。
     *
     * @return 点数です
     */
    public int pointCount() {
        return distances.length;
    }
}
