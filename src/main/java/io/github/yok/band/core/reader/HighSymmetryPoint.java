package io.github.yok.band.core.reader;

import lombok.Value;

/**
 * ラベル付きの高対称点（分数座標）です。
 */
@Value
public class HighSymmetryPoint {

    /**
     * ラベルです（例: G, X, M）。
     */
    String label;

    /**
     * 逆格子の分数座標（長さ 3）です。
     */
    double[] coordinates;
}
