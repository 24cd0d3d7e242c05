package io.github.yok.band.core.reader;

import java.util.List;
import lombok.Value;

/**
 * Reader が返す生の固有値と k 点です。
 *
 * <p>
 * スピンチャネルごとに {@code [k][band]} の配列を持ちます。非分極計算では 1 チャネル、分極計算では up, down の順に 2 チャネルです。
 * </p>
 */
@Value
public class RawEigenvalues {

    /**
     * チャネルごとのエネルギー {@code [k][band]} です（フェルミ準位は未補正）。
     */
    List<double[][]> energies;

    /**
     * チャネルごとの占有数 {@code [k][band]} です。
     */
    List<double[][]> occupations;

    /**
     * k 点の分数座標 {@code [k][3]} です。
     */
    double[][] kpoints;

    /**
     * k 点の重みです。
     */
    double[] kpointWeights;

    /**
     * チャネル数を返します。
     *
     * @return チャネル数です
     */
    public int channelCount() {
        return energies.size();
    }

    /**
     * k 点数を返します。
     *
     * @return k 点数です
     */
    public int kpointCount() {
        return kpoints.length;
    }

    /**
     * バンド数を返します。
     *
     * @return バンド数です
     */
    public int bandCount() {
        return energies.isEmpty() || energies.get(0).length == 0 ? 0 : energies.get(0)[0].length;
    }
}
