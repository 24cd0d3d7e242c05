package io.github.yok.band.core.interpolation;

/**
 * 補間の方式です。
 */
public enum InterpolationMode {

    /**
     * 3 次スプライン補間です。符号付きの量（固有値）に使います。
     */
    CUBIC_SIGNED,

    /**
     * 線形補間のあと負値を 0 に切り詰めます。非負の量（重み）に使います。
     */
    LINEAR_NON_NEGATIVE
}
