package io.github.yok.band.app;

import io.github.yok.band.core.dataset.Dataset;
import io.github.yok.band.core.dataset.DatasetLoader;
import io.github.yok.band.core.path.TickMark;
import io.github.yok.band.core.plot.BandPlotAssembler;
import io.github.yok.band.core.plot.BandPlotData;
import io.github.yok.band.core.plot.PlotOptions;
import io.github.yok.band.core.projection.ProjectionChannels;
import io.github.yok.band.out.PlotDataWriter;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI でバンド構造の再構成を実行するクラスです。
 *
 * <p>
 * データセットを読み込み、k パスを解決して、設定された表示のプロット用データを出力します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class BandCliRunner implements CommandLineRunner {

    /**
     * band-structure の設定値（band.*）です。
     */
    private final BandProperties properties;

    /**
     * データセットのローダです。
     */
    private final DatasetLoader datasetLoader;

    /**
     * 射影チャネルの組み立てロジックです。
     */
    private final PlotViewFactory plotViewFactory;

    /**
     * プロット用データの組み立てロジックです。
     */
    private final BandPlotAssembler bandPlotAssembler;

    /**
     * 結果出力ロジックです。
     */
    private final PlotDataWriter plotDataWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== band-structure start: reconstruct band structure ===");
        System.out.print(properties.toMultilineString());

        // データを読む前に設定だけで判定できる誤りを検出します
        BandProperties.View view = properties.getView();
        plotViewFactory.validate(view, properties.isProjected());
        PlotOptions options = properties.toPlotOptions();

        Dataset dataset = datasetLoader.load(properties.toDatasetRequest());
        System.out.println("=== データセット ===");
        System.out.println("方式=" + dataset.getScheme() + ", バンド数=" + dataset.bandCount()
                + ", k 点数=" + dataset.kpointCount() + ", efermi=" + fmt5(dataset.getEfermi())
                + ", spin=" + dataset.getSpin());

        ProjectionChannels channels = plotViewFactory.channels(dataset, view);
        BandPlotData data = bandPlotAssembler.assemble(dataset, options, channels);

        plotDataWriter.write(data, view.getKind().viewName());

        System.out.println("=== 結果 ===");
        System.out.println("区間数=" + data.getSegments().size() + ", 表示バンド数="
                + data.getBandIndices().length + ", チャネル=" + data.getChannelLabels());
        StringBuilder ticks = new StringBuilder();
        for (TickMark tick : data.getTicks()) {
            if (ticks.length() > 0) {
                ticks.append(", ");
            }
            ticks.append(tick.getLabel()).append('@').append(fmt5(tick.getPosition()));
        }
        System.out.println("目盛り: " + ticks);
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
