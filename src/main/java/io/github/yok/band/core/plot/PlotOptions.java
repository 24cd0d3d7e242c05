package io.github.yok.band.core.plot;

import io.github.yok.band.core.path.CustomPathSpec;
import lombok.Builder;
import lombok.Value;

/**
 * プロット用データを組み立てる条件です。
 */
@Value
@Builder
public class PlotOptions {

    /**
     * 区間の選択・並べ替えです（null の場合は自然な順序）。
     */
    CustomPathSpec customPath;

    /**
     * 区間ごとに補間するかどうかです。
     */
    @Builder.Default
    boolean interpolate = true;

    /**
     * 区間あたりの補間点数です。
     */
    @Builder.Default
    int newN = 200;

    /**
     * 表示するエネルギー範囲の下限（eV）です。
     */
    @Builder.Default
    double energyMin = -6.0;

    /**
     * 表示するエネルギー範囲の上限（eV）です。
     */
    @Builder.Default
    double energyMax = 6.0;
}
