package io.github.yok.band.core.dataset;

/**
 * スピン軌道計算で擬スピンの分離に使うスピン軸です。
 */
public enum SocAxis {

    X(1), Y(2), Z(3);

    private final int component;

    SocAxis(int component) {
        this.component = component;
    }

    /**
     * 射影配列の成分番号（total=0 に続く x=1, y=2, z=3）を返します。
     *
     * @return 成分番号です
     */
    public int component() {
        return component;
    }
}
