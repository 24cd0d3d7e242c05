package io.github.yok.band.core.projection;

import io.github.yok.band.core.dataset.Spin;

/**
 * スピン軌道計算の符号付きスピン軸成分を、非負の擬スピン up / down に分離するユーティリティです。
 *
 * <p>
 * 正の値は up、負の値の絶対値は down に割り当て、{@code up - down} で元の符号付き値に戻ります。 分離は二乗や和を取る前に行う必要があります。
 * </p>
 */
public final class PseudoSpinSeparator {

    private PseudoSpinSeparator() {}

    /**
     * up 成分（正の部分）を返します。
     *
     * @param signed 符号付きの値です
     * @return 0 以上の値です
     */
    public static double up(double signed) {
        return signed > 0.0 ? signed : 0.0;
    }

    /**
     * down 成分（負の部分の絶対値）を返します。
     *
     * @param signed 符号付きの値です
     * @return 0 以上の値です
     */
    public static double down(double signed) {
        return signed < 0.0 ? -signed : 0.0;
    }

    /**
     * 指定スピンに対応する成分を返します。
     *
     * @param signed 符号付きの値です
     * @param spin 擬スピンです
     * @return 0 以上の値です
     */
    public static double select(double signed, Spin spin) {
        return spin == Spin.UP ? up(signed) : down(signed);
    }

    /**
     * 配列を up / down に分離します。
     *
     * @param signed 符号付きの値です
     * @return {@code [0]} が up、{@code [1]} が down の配列です
     */
    public static double[][] separate(double[] signed) {
        double[][] out = new double[2][signed.length];
        for (int i = 0; i < signed.length; i++) {
            out[0][i] = up(signed[i]);
            out[1][i] = down(signed[i]);
        }
        return out;
    }
}
