package io.github.yok.band.core.dataset;

/**
 * k 点のサンプリング方式です。
 */
public enum SamplingScheme {

    /**
     * ライン形式の一様サンプリングです。
     */
    REGULAR,

    /**
     * ハイブリッド汎関数計算の疎なサンプリングです（重み 0 の k 点のみ）。
     */
    HYBRID,

    /**
     * スーパーセルを基本セルへ展開したサンプリングです。
     */
    UNFOLDED
}
