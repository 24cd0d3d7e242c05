package io.github.yok.band.out;

import io.github.yok.band.core.plot.BandPlotData;

/**
 * プロット用データを描画側へ渡す処理のインタフェースです。
 *
 * <p>
 * 描画そのもの（図の体裁、色、凡例）は実装側の責務です。ここでは組み立て済みのデータと、 出力の命名に使う表示名だけを受け取ります。
 * </p>
 */
public interface PlotDataWriter {

    /**
     * プロット用データを出力します。
     *
     * @param data プロット用データです
     * @param viewName 表示の種類を表す名前です（ファイル名に使います）
     */
    void write(BandPlotData data, String viewName);
}
