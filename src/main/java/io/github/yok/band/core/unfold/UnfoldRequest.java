package io.github.yok.band.core.unfold;

import java.util.List;
import lombok.Value;

/**
 * 展開計算の依頼内容です。
 */
@Value
public class UnfoldRequest {

    /**
     * スーパーセルから基本セルへの変換行列（3×3）です。
     */
    double[][] transform;

    /**
     * 基本セルのブリルアンゾーンにおける高対称点（分数座標）です。
     */
    List<double[]> highSymmetryPoints;

    /**
     * 区間あたりの k 点数です。
     */
    int pointsPerLeg;

    /**
     * 展開を評価する k パス（{@link UnfoldedKPath#build} の結果）です。
     */
    List<double[]> kpath;

    /**
     * スピン軌道計算かどうかです。
     */
    boolean spinOrbit;
}
