package io.github.yok.band.core.path;

import lombok.Value;

/**
 * 高対称点の目盛り（縦線の位置とラベル）です。
 */
@Value
public class TickMark {

    /**
     * 区間境界を 1 点として数えた、連結後の k パス上の点番号です。
     */
    int index;

    /**
     * 横軸上の距離です。
     */
    double position;

    /**
     * 表示ラベルです（例: {@code \Gamma}、{@code X|K}）。
     */
    String label;
}
