package io.github.yok.band.core.dataset;

import com.google.common.base.Preconditions;
import io.github.yok.band.core.array.NdArray;
import io.github.yok.band.core.cache.DerivedDataCache;
import io.github.yok.band.core.cache.DerivedKind;
import io.github.yok.band.core.error.ConfigurationException;
import io.github.yok.band.core.error.DataIntegrityException;
import io.github.yok.band.core.projection.ProjectionTensor;
import io.github.yok.band.core.reader.BandDataReader;
import io.github.yok.band.core.reader.BandMetadata;
import io.github.yok.band.core.reader.RawEigenvalues;
import io.github.yok.band.core.structure.OrbitalTable;
import io.github.yok.band.core.unfold.UnfoldRequest;
import io.github.yok.band.core.unfold.UnfoldedKPath;
import io.github.yok.band.core.unfold.Unfolder;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Reader、派生配列キャッシュ、{@link RawDataAdapter} をつないで {@link Dataset} を構築するクラスです。
 *
 * <p>
 * 処理の流れは Reader → キャッシュ（ライトスルー）→ スピン・軸の選択です。 キャッシュには選択前の配列だけを保存し、ヒットした配列は正として扱います。
 * </p>
 */
@Slf4j
public final class DatasetLoader {

    /**
     * スピン軌道計算の射影成分数（total, x, y, z）です。
     */
    private static final int SOC_COMPONENTS = 4;

    private final BandDataReader reader;

    private final DerivedDataCache cache;

    /**
     * 展開計算を行うコンポーネントです（展開キャッシュのみで動かす場合は空）。
     */
    private final Optional<Unfolder> unfolder;

    private final RawDataAdapter adapter = new RawDataAdapter();

    /**
     * ローダを生成します。
     *
     * @param reader Reader です
     * @param cache 派生配列キャッシュです
     * @param unfolder 展開計算のコンポーネントです（未提供の場合は空）
     */
    public DatasetLoader(BandDataReader reader, DerivedDataCache cache,
            Optional<Unfolder> unfolder) {
        this.reader = Preconditions.checkNotNull(reader, "reader は null 不可です");
        this.cache = Preconditions.checkNotNull(cache, "cache は null 不可です");
        this.unfolder = Preconditions.checkNotNull(unfolder, "unfolder は null 不可です");
    }

    /**
     * データセットを構築します。
     *
     * @param request 読み込み条件です
     * @return データセットです
     * @throws ConfigurationException 読み込み条件がデータセットと矛盾する場合に発生します
     * @throws DataIntegrityException 入力やキャッシュが形状・順序の契約を満たさない場合に発生します
     */
    public Dataset load(DatasetRequest request) {
        Preconditions.checkNotNull(request, "request は null 不可です");
        Preconditions.checkNotNull(request.getFolder(), "folder は null 不可です");
        Path folder = request.getFolder();

        BandMetadata metadata = reader.readMetadata(folder);
        checkRequest(request, metadata);

        double efermi = reader.readFermiEnergy(request.resolveEfermiFolder())
                + request.getShiftEfermi();
        if (!Double.isFinite(efermi)) {
            throw new DataIntegrityException("フェルミエネルギーが有限値ではありません: " + efermi);
        }
        // 展開計算ではハイブリッド汎関数の k 点フィルタを使いません
        boolean hybrid = metadata.isHybridFunctional() && !request.isUnfold();

        log.info("データセットを読み込みます。folder={}、efermi={}、spin={}、unfold={}、socAxis={}、projected={}",
                folder, fmt5(efermi), request.getSpin(), request.isUnfold(), request.getSocAxis(),
                request.isProjected());

        Dataset.DatasetBuilder builder = Dataset.builder().structure(metadata.getStructure())
                .spin(request.getSpin()).socAxis(request.getSocAxis())
                .spinPolarized(metadata.isSpinPolarized()).spinOrbit(metadata.isSpinOrbit())
                .hybridFunctional(hybrid).unfolded(request.isUnfold())
                .projected(request.isProjected()).efermi(efermi).lineMode(metadata.getLineMode())
                .symmetryPoints(metadata.getSymmetryPoints()).unfoldLegs(request.getUnfoldLegs());

        double[][] eigenvalues;
        int bandCount;
        int sourceKpointCount;
        int[] originKIndices = null;
        if (request.isUnfold()) {
            UnfoldedData unfolded = loadUnfolded(request, metadata, efermi);
            eigenvalues = unfolded.getSelection().getEigenvalues();
            originKIndices = unfolded.getSelection().getOriginKIndices().length == 0 ? new int[0]
                    : unfolded.getSelection().getOriginKIndices()[0];
            bandCount = eigenvalues.length;
            sourceKpointCount = -1;
            builder.scheme(SamplingScheme.UNFOLDED).kpoints(unfolded.getKpoints())
                    .spectralWeights(unfolded.getSelection().getSpectralWeights())
                    .originKIndices(originKIndices);
        } else {
            NdArray merged = loadMerged(folder, hybrid);
            int channels = adapter.mergedChannelCount(merged);
            int expected = metadata.isSpinPolarized() && !metadata.isSpinOrbit() ? 2 : 1;
            if (channels != expected) {
                throw new DataIntegrityException("キャッシュのスピンチャネル数が計算条件と一致しません: " + channels
                        + " vs " + expected + "（" + folder + "）");
            }
            int channel = channels == 2 ? request.getSpin().index() : 0;
            eigenvalues = adapter.selectEigenvalues(merged, channel, efermi);
            double[][] kpoints = adapter.kpointsOf(merged);
            bandCount = merged.dim(0);
            sourceKpointCount = merged.dim(1);
            SamplingScheme scheme = hybrid ? SamplingScheme.HYBRID : SamplingScheme.REGULAR;
            if (scheme == SamplingScheme.REGULAR && metadata.getLineMode() == null) {
                throw new DataIntegrityException("通常計算にはライン形式の高対称点が必要です: " + folder);
            }
            builder.scheme(scheme).kpoints(kpoints);
        }

        adapter.stretch(eigenvalues, request.getStretchFactor());
        builder.eigenvalues(eigenvalues);

        int[] pathMapping = originKIndices;
        if (request.isProjected()) {
            builder.projections(() -> loadProjections(request, metadata, hybrid, bandCount,
                    sourceKpointCount, pathMapping));
        }
        if (request.getSocAxis() != null) {
            builder.spinProjections(() -> loadSpinProjections(request, hybrid, bandCount,
                    sourceKpointCount, pathMapping));
        }

        Dataset dataset = builder.build();
        log.info("データセットを構築しました。方式={}、バンド数={}、k点数={}", dataset.getScheme(),
                dataset.bandCount(), dataset.kpointCount());
        return dataset;
    }

    /**
     * 読み込み条件とメタ情報の整合を検査します。
     */
    private static void checkRequest(DatasetRequest request, BandMetadata metadata) {
        Preconditions.checkNotNull(request.getSpin(), "spin は null 不可です");
        if (request.getSocAxis() != null && !metadata.isSpinOrbit()) {
            throw new ConfigurationException("スピン軌道計算ではないデータセットに soc-axis="
                    + request.getSocAxis().name().toLowerCase(Locale.ROOT)
                    + " が指定されました。soc-axis は指定しないでください");
        }
        if (request.getSpin() == Spin.DOWN && !metadata.isSpinPolarized()
                && !metadata.isSpinOrbit()) {
            throw new ConfigurationException("スピン分極していないデータセットでは spin=DOWN は使えません");
        }
        if (request.isUnfold()) {
            List<List<String>> legs = request.getUnfoldLegs();
            if (legs == null || legs.isEmpty()) {
                throw new ConfigurationException("展開計算には k パスの区間（unfold-settings.kpath）が必要です");
            }
            for (List<String> leg : legs) {
                if (leg.size() != 2) {
                    throw new ConfigurationException("k パスの区間は始点と終点の 2 点で指定してください: " + leg);
                }
            }
            if (request.getPointsPerLeg() < 1) {
                throw new ConfigurationException(
                        "unfold-settings.n は 1 以上が必要です: " + request.getPointsPerLeg());
            }
            if (request.getHighSymmetryPoints().size() != legs.size() + 1) {
                throw new ConfigurationException("高対称点の数は区間数 + 1 が必要です: "
                        + request.getHighSymmetryPoints().size() + " vs " + (legs.size() + 1));
            }
        }
    }

    /**
     * マージ済み固有値をキャッシュから読み込み、なければ Reader から作って保存します。
     *
     * <p>
     * キャッシュにはフェルミ補正前のエネルギーを保存するため、shift-efermi を変えてもキャッシュをそのまま使えます。
     * </p>
     */
    private NdArray loadMerged(Path folder, boolean hybrid) {
        Optional<NdArray> cached = cache.load(folder, DerivedKind.MERGED_RAW);
        if (cached.isPresent()) {
            return cached.get();
        }
        RawEigenvalues raw = reader.readEigenvalues(folder);
        NdArray merged = adapter.merge(raw, hybrid);
        cache.store(folder, DerivedKind.MERGED_RAW, merged);
        return merged;
    }

    /**
     * 展開結果をキャッシュから読み込み、なければ {@link Unfolder} で計算して保存します。
     */
    private UnfoldedData loadUnfolded(DatasetRequest request, BandMetadata metadata,
            double efermi) {
        Path folder = request.getFolder();
        int legCount = request.getUnfoldLegs().size();
        int n = request.getPointsPerLeg();
        List<double[]> kpath = UnfoldedKPath.build(request.getHighSymmetryPoints(), n);

        Optional<NdArray> cached = cache.load(folder, DerivedKind.UNFOLDED_RAW);
        NdArray raw;
        if (cached.isPresent()) {
            raw = cached.get();
        } else {
            Unfolder engine = unfolder.orElseThrow(() -> new ConfigurationException(
                    "展開結果のキャッシュがなく、展開計算のコンポーネントも提供されていません: " + folder));
            if (request.getTransform() == null) {
                throw new ConfigurationException("展開計算には変換行列（unfold-settings.transform）が必要です");
            }
            log.info("展開計算を実行します。区間数={}、n={}、k点数={}", legCount, n, kpath.size());
            raw = engine.unfold(folder, new UnfoldRequest(request.getTransform(),
                    request.getHighSymmetryPoints(), n, kpath, metadata.isSpinOrbit()));
            if (raw == null || raw.rank() != DerivedKind.UNFOLDED_RAW.rank()) {
                throw new DataIntegrityException("展開結果の形状が不正です: " + raw);
            }
            cache.store(folder, DerivedKind.UNFOLDED_RAW, raw);
        }

        if (raw.dim(1) != 3 || raw.dim(3) != kpath.size()) {
            throw new DataIntegrityException("展開結果の形状が k パスと一致しません: " + raw + "、k パスの点数="
                    + kpath.size());
        }
        // スピン軌道計算ではチャネルは 1 つだけです
        int channel = request.getSpin() == Spin.DOWN && !metadata.isSpinOrbit() ? 1 : 0;
        if (channel >= raw.dim(0)) {
            throw new DataIntegrityException("展開結果に spin=" + request.getSpin() + " のチャネルがありません: "
                    + raw);
        }

        int[] pathIndices = UnfoldedKPath.boundaryDuplicatedIndices(legCount, n);
        RawDataAdapter.UnfoldedSelection selection =
                adapter.selectUnfolded(raw, channel, efermi, pathIndices);
        double[][] kpoints = new double[pathIndices.length][];
        for (int j = 0; j < pathIndices.length; j++) {
            kpoints[j] = kpath.get(pathIndices[j]).clone();
        }
        return new UnfoldedData(selection, kpoints);
    }

    /**
     * 射影重みを読み込み、成分の選択と二乗を行います。
     */
    private ProjectionTensor loadProjections(DatasetRequest request, BandMetadata metadata,
            boolean hybrid, int bandCount, int kpointCount, int[] pathMapping) {
        Path folder = request.getFolder();
        NdArray raw = loadOrRead(folder, DerivedKind.PROJECTED_RAW, hybrid,
                () -> reader.readProjections(folder));

        int atoms = metadata.getStructure().totalAtoms();
        int orbitals = OrbitalTable.forStructure(metadata.getStructure()).orbitalCount();
        checkLeadingAxes(raw, bandCount, kpointCount, DerivedKind.PROJECTED_RAW);
        if (raw.dim(3) != atoms || raw.dim(4) != orbitals) {
            throw new DataIntegrityException("射影重みの原子数・軌道数が構造と一致しません: " + raw + "、原子数=" + atoms
                    + "、軌道数=" + orbitals);
        }

        int component;
        Spin pseudoSpin = null;
        if (metadata.isSpinOrbit()) {
            component = request.getSocAxis() == null ? 0 : request.getSocAxis().component();
            pseudoSpin = request.getSocAxis() == null ? null : request.getSpin();
        } else {
            component = metadata.isSpinPolarized() ? request.getSpin().index() : 0;
        }
        if (component >= raw.dim(2)) {
            throw new DataIntegrityException("射影重みに成分 " + component + " がありません: " + raw);
        }

        ProjectionTensor tensor = adapter.selectProjections(raw, component, pseudoSpin);
        if (pathMapping != null) {
            tensor = tensor.takeKpoints(checkMapping(pathMapping, tensor.kpointCount()));
        }
        log.info("射影重みを読み込みました。成分={}、形状={}", component, raw);
        return tensor;
    }

    /**
     * スピン軸射影を読み込み、擬スピンに分離して正規化します。
     */
    private double[][] loadSpinProjections(DatasetRequest request, boolean hybrid, int bandCount,
            int kpointCount, int[] pathMapping) {
        Path folder = request.getFolder();
        NdArray raw = loadOrRead(folder, DerivedKind.SPIN_AXIS_RAW, hybrid,
                () -> reader.readSpinAxisProjections(folder));
        checkLeadingAxes(raw, bandCount, kpointCount, DerivedKind.SPIN_AXIS_RAW);
        if (raw.dim(2) < SOC_COMPONENTS) {
            throw new DataIntegrityException("スピン軸射影の成分数が不足しています: " + raw);
        }

        double[][] values = adapter.selectSpinAxis(raw, request.getSocAxis(), request.getSpin());
        if (pathMapping == null) {
            return values;
        }
        int[] mapping = checkMapping(pathMapping, raw.dim(1));
        double[][] mapped = new double[values.length][mapping.length];
        for (int b = 0; b < values.length; b++) {
            for (int j = 0; j < mapping.length; j++) {
                mapped[b][j] = values[b][mapping[j]];
            }
        }
        return mapped;
    }

    /**
     * キャッシュから読み込み、なければ Reader から読んでハイブリッド汎関数のフィルタを掛けて保存します。
     */
    private NdArray loadOrRead(Path folder, DerivedKind kind, boolean hybrid,
            Supplier<NdArray> source) {
        Optional<NdArray> cached = cache.load(folder, kind);
        if (cached.isPresent()) {
            return cached.get();
        }
        NdArray raw = source.get();
        if (raw == null || raw.rank() != kind.rank()) {
            throw new DataIntegrityException(kind + " の形状が不正です: " + raw);
        }
        if (hybrid) {
            int[] keep = adapter.zeroWeightIndices(reader.readEigenvalues(folder).getKpointWeights());
            raw = adapter.filterKpoints(raw, keep);
        }
        cache.store(folder, kind, raw);
        return raw;
    }

    private static void checkLeadingAxes(NdArray raw, int bandCount, int kpointCount,
            DerivedKind kind) {
        if (raw.dim(0) != bandCount) {
            throw new DataIntegrityException(
                    kind + " のバンド数が固有値と一致しません: " + raw + "、バンド数=" + bandCount);
        }
        // 展開したデータセットでは k 点数はスーパーセル側のため照合しません
        if (kpointCount >= 0 && raw.dim(1) != kpointCount) {
            throw new DataIntegrityException(
                    kind + " の k 点数が固有値と一致しません: " + raw + "、k点数=" + kpointCount);
        }
    }

    private static int[] checkMapping(int[] mapping, int kpointCount) {
        for (int k : mapping) {
            if (k >= kpointCount) {
                throw new DataIntegrityException("元の k インデックスが範囲外です: " + k + "（k点数 " + kpointCount
                        + "）: " + Arrays.toString(mapping));
            }
        }
        return mapping;
    }

    private static String fmt5(double x) {
        return String.format(Locale.ROOT, "%.5f", x);
    }

    /**
     * 展開結果の選択と、区間境界を複製した k パスです。
     */
    @Value
    private static class UnfoldedData {

        RawDataAdapter.UnfoldedSelection selection;

        double[][] kpoints;
    }
}
