package io.github.yok.band.core.plot;

import com.google.common.base.Preconditions;
import io.github.yok.band.core.dataset.Dataset;
import io.github.yok.band.core.geometry.DistanceCalculator;
import io.github.yok.band.core.interpolation.InterpolationMode;
import io.github.yok.band.core.interpolation.Interpolator;
import io.github.yok.band.core.path.KPathResolver;
import io.github.yok.band.core.path.PathSegment;
import io.github.yok.band.core.path.ResolvedPath;
import io.github.yok.band.core.path.TickMark;
import io.github.yok.band.core.projection.ProjectionChannels;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * データセットから描画側へ渡すプロット用データを組み立てるクラスです。
 *
 * <p>
 * 処理の流れは、区間の解決 → 距離の計算 → 目盛りの計算 → エネルギー範囲によるバンドの絞り込み → 区間ごとの取り出し（逆向きの区間は反転）→
 * 区間ごとの補間、です。固有値は 3 次スプライン、重みは線形補間で補間します。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class BandPlotAssembler {

    /**
     * 区間の解決に使うリゾルバです。
     */
    private final KPathResolver resolver;

    /**
     * プレーンなバンド構造のプロット用データを組み立てます。
     *
     * @param dataset データセットです
     * @param options 組み立て条件です
     * @return プロット用データです
     */
    public BandPlotData assemble(Dataset dataset, PlotOptions options) {
        return assemble(dataset, options, null);
    }

    /**
     * 射影チャネル付きのプロット用データを組み立てます。
     *
     * @param dataset データセットです
     * @param options 組み立て条件です
     * @param channels 集計済みの射影チャネルです（null の場合はプレーン）
     * @return プロット用データです
     * @throws io.github.yok.band.core.error.ConfigurationException 区間の指定が不正な場合に発生します
     * @throws io.github.yok.band.core.error.DataIntegrityException k 点数がサンプリング方式と矛盾する場合に発生します
     */
    public BandPlotData assemble(Dataset dataset, PlotOptions options,
            ProjectionChannels channels) {
        Preconditions.checkNotNull(dataset, "dataset は null 不可です");
        Preconditions.checkNotNull(options, "options は null 不可です");
        if (channels != null) {
            Preconditions.checkArgument(
                    channels.bandCount() == dataset.bandCount()
                            && channels.kpointCount() == dataset.kpointCount(),
                    "射影チャネルの形状がデータセットと一致しません");
        }

        // 1) 区間の解決
        List<PathSegment> natural = resolver.naturalSegments(dataset);
        ResolvedPath path = resolver.resolve(natural, options.getCustomPath());

        // 2) 距離と目盛り
        DistanceCalculator calculator =
                new DistanceCalculator(dataset.getStructure().getLatticeMatrix());
        List<double[]> distances = calculator.distances(path, dataset.getKpoints());
        List<TickMark> ticks = resolver.ticks(path, distances);

        // 3) 表示するバンドの絞り込み
        int[] bands = bandsInWindow(dataset, options.getEnergyMin(), options.getEnergyMax());

        double[][] eigenvalues = dataset.getEigenvalues();
        double[][] spinProjections =
                dataset.hasSpinProjections() ? dataset.spinProjections() : null;
        List<double[][]> channelRows = new ArrayList<>();
        if (channels != null) {
            for (int c = 0; c < channels.channelCount(); c++) {
                channelRows.add(channels.channel(c));
            }
        }

        Interpolator interpolator =
                options.isInterpolate() ? new Interpolator(options.getNewN()) : null;

        // 4) 区間ごとの取り出しと補間
        List<SegmentPlotData> segments = new ArrayList<>();
        for (int i = 0; i < path.size(); i++) {
            PathSegment segment = path.segment(i);
            double[] d = distances.get(i);

            double[][] energies = slice(path, i, eigenvalues, bands);
            double[][] weights = null;
            if (dataset.hasSpectralWeights()) {
                weights = new double[bands.length][];
                for (int b = 0; b < bands.length; b++) {
                    double[] row = new double[dataset.kpointCount()];
                    for (int k = 0; k < row.length; k++) {
                        row[k] = dataset.spectralWeight(bands[b], k);
                    }
                    weights[b] = path.slice(row, i);
                }
            }
            double[][] spins = spinProjections == null ? null : slice(path, i, spinProjections, bands);
            List<double[][]> channelSlices = new ArrayList<>();
            for (double[][] rows : channelRows) {
                channelSlices.add(slice(path, i, rows, bands));
            }

            double[] segmentDistances = d;
            if (interpolator != null) {
                segmentDistances = interpolator.grid(d);
                energies = interpolator.resample(d, energies, InterpolationMode.CUBIC_SIGNED)
                        .getValues();
                if (weights != null) {
                    weights = interpolator
                            .resample(d, weights, InterpolationMode.LINEAR_NON_NEGATIVE)
                            .getValues();
                }
                if (spins != null) {
                    spins = interpolator.resample(d, spins, InterpolationMode.LINEAR_NON_NEGATIVE)
                            .getValues();
                }
                List<double[][]> resampled = new ArrayList<>();
                for (double[][] rows : channelSlices) {
                    resampled.add(interpolator
                            .resample(d, rows, InterpolationMode.LINEAR_NON_NEGATIVE).getValues());
                }
                channelSlices = resampled;
            }
            segments.add(new SegmentPlotData(segment.getSegmentId(), segment.isReversed(),
                    segmentDistances, energies, weights, spins, channelSlices));
            log.debug("区間 {} を組み立てました。区間番号={}、逆向き={}、点数={}", i, segment.getSegmentId() + 1,
                    segment.isReversed(), segmentDistances.length);
        }

        log.info("プロット用データを組み立てました。区間数={}、バンド数={}/{}、目盛り数={}", segments.size(),
                bands.length, dataset.bandCount(), ticks.size());
        return new BandPlotData(segments, ticks, bands,
                channels == null ? List.of() : channels.labels());
    }

    /**
     * エネルギー範囲（両側に 1 eV の余裕を持たせる）に 1 点でも入るバンドの番号を返します。
     *
     * @param dataset データセットです
     * @param energyMin 範囲の下限です
     * @param energyMax 範囲の上限です
     * @return バンド番号（昇順）です
     */
    public int[] bandsInWindow(Dataset dataset, double energyMin, double energyMax) {
        double lo = Math.min(energyMin, energyMax) - 1.0;
        double hi = Math.max(energyMin, energyMax) + 1.0;
        List<Integer> kept = new ArrayList<>();
        for (int b = 0; b < dataset.bandCount(); b++) {
            for (int k = 0; k < dataset.kpointCount(); k++) {
                double e = dataset.eigenvalue(b, k);
                if (e >= lo && e <= hi) {
                    kept.add(b);
                    break;
                }
            }
        }
        int[] out = new int[kept.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = kept.get(i);
        }
        return out;
    }

    private static double[][] slice(ResolvedPath path, int segment, double[][] rows, int[] bands) {
        double[][] out = new double[bands.length][];
        for (int b = 0; b < bands.length; b++) {
            out[b] = path.slice(rows[bands[b]], segment);
        }
        return out;
    }
}
