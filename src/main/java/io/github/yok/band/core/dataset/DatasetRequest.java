package io.github.yok.band.core.dataset;

import java.nio.file.Path;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * データセットの読み込み条件です。
 *
 * <p>
 * (folder, spin, unfold, socAxis) の組ごとに 1 つの {@link Dataset} を構築します。
 * </p>
 */
@Value
@Builder
public class DatasetRequest {

    /**
     * バンド計算のフォルダです。
     */
    Path folder;

    /**
     * フェルミエネルギーを読むフォルダです（null の場合は folder と同じ）。
     */
    Path efermiFolder;

    /**
     * フェルミエネルギーに加えるずらし量（eV）です。
     */
    double shiftEfermi;

    /**
     * スピン方向です。
     */
    @Builder.Default
    Spin spin = Spin.UP;

    /**
     * 展開計算のデータとして読み込むかどうかです。
     */
    boolean unfold;

    /**
     * 展開 k パスの区間ラベル（区間ごとに始点・終点の 2 要素）です。
     */
    @Builder.Default
    List<List<String>> unfoldLegs = List.of();

    /**
     * 展開 k パスの高対称点（基本セルの分数座標、区間数 + 1 点）です。
     */
    @Builder.Default
    List<double[]> highSymmetryPoints = List.of();

    /**
     * 展開 k パスの区間あたりの点数です。
     */
    int pointsPerLeg;

    /**
     * スーパーセルから基本セルへの変換行列です（キャッシュがない場合のみ必要）。
     */
    double[][] transform;

    /**
     * スピン軌道計算で擬スピンを定義するスピン軸です（null の場合は使いません）。
     */
    SocAxis socAxis;

    /**
     * 射影重みを読み込むかどうかです。
     */
    boolean projected;

    /**
     * 固有値に掛ける倍率です。
     */
    @Builder.Default
    double stretchFactor = 1.0;

    /**
     * フェルミエネルギーを読むフォルダを返します。
     *
     * @return efermiFolder が未指定なら folder です
     */
    public Path resolveEfermiFolder() {
        return efermiFolder != null ? efermiFolder : folder;
    }
}
