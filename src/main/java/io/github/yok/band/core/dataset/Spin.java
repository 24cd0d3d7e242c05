package io.github.yok.band.core.dataset;

/**
 * スピン方向の選択です。
 *
 * <p>
 * スピン軌道計算で SOC 軸を指定した場合は、軸成分の正負で定義する擬スピンを表します。
 * </p>
 */
public enum Spin {

    UP(0), DOWN(1);

    private final int index;

    Spin(int index) {
        this.index = index;
    }

    /**
     * チャネル番号（up=0, down=1）を返します。
     *
     * @return チャネル番号です
     */
    public int index() {
        return index;
    }
}
