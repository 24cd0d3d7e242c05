package io.github.yok.band.app;

import io.github.yok.band.core.cache.DerivedDataCache;
import io.github.yok.band.core.cache.NpyDerivedDataCache;
import io.github.yok.band.core.dataset.DatasetLoader;
import io.github.yok.band.core.path.KPathResolver;
import io.github.yok.band.core.plot.BandPlotAssembler;
import io.github.yok.band.core.reader.BandDataReader;
import io.github.yok.band.core.reader.CsvBandDataReader;
import io.github.yok.band.core.unfold.Unfolder;
import io.github.yok.band.out.CsvPlotDataWriter;
import io.github.yok.band.out.PlotDataWriter;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * CSV 交換形式の Reader + npy キャッシュ + CSV 出力の Bean 定義を行う設定クラスです。
 *
 * <p>
 * 展開計算のコンポーネント（{@link Unfolder}）は外部から Bean として提供された場合だけ使用します。
 * 提供されない場合、展開計算は展開結果のキャッシュがあるときに限り動作します。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class BandStructureConfiguration {

    /**
     * band-structure の設定値（band.*）です。
     */
    private final BandProperties p;

    /**
     * Reader を生成します。
     *
     * @return Reader です
     */
    @Bean
    public BandDataReader bandDataReader() {
        return new CsvBandDataReader();
    }

    /**
     * 派生配列キャッシュを生成します。
     *
     * @return 派生配列キャッシュです
     */
    @Bean
    public DerivedDataCache derivedDataCache() {
        return new NpyDerivedDataCache();
    }

    /**
     * データセットのローダを生成します。
     *
     * @param reader Reader です
     * @param cache 派生配列キャッシュです
     * @param unfolder 展開計算のコンポーネントです（任意）
     * @return ローダです
     */
    @Bean
    public DatasetLoader datasetLoader(BandDataReader reader, DerivedDataCache cache,
            ObjectProvider<Unfolder> unfolder) {
        return new DatasetLoader(reader, cache, Optional.ofNullable(unfolder.getIfAvailable()));
    }

    /**
     * k パスのリゾルバを生成します。
     *
     * @return リゾルバです
     */
    @Bean
    public KPathResolver kPathResolver() {
        return new KPathResolver();
    }

    /**
     * プロット用データの組み立てロジックを生成します。
     *
     * @param resolver リゾルバです
     * @return 組み立てロジックです
     */
    @Bean
    public BandPlotAssembler bandPlotAssembler(KPathResolver resolver) {
        return new BandPlotAssembler(resolver);
    }

    /**
     * 表示の設定から射影チャネルを組み立てるロジックを生成します。
     *
     * @return 組み立てロジックです
     */
    @Bean
    public PlotViewFactory plotViewFactory() {
        return new PlotViewFactory();
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public PlotDataWriter plotDataWriter() {
        return new CsvPlotDataWriter(p.getOutput().getDir());
    }
}
