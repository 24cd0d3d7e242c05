package io.github.yok.band.core.dataset;

import com.google.common.base.Preconditions;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import io.github.yok.band.core.error.ConfigurationException;
import io.github.yok.band.core.projection.ProjectionTensor;
import io.github.yok.band.core.reader.HighSymmetryPoint;
import io.github.yok.band.core.reader.LineModeKPoints;
import io.github.yok.band.core.structure.OrbitalTable;
import io.github.yok.band.core.structure.StructureInfo;
import java.util.List;
import java.util.function.Supplier;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

/**
 * 正規化済みのバンドデータです。
 *
 * <p>
 * 固有値 {@code [band][k]} はフェルミ補正済みで、倍率も適用済みです。構築後に固有値と k 点は変更しません。 射影重みとスピン軸射影は、最初に要求された時点で一度だけ読み込みます。
 * </p>
 */
@Getter
public final class Dataset {

    private final StructureInfo structure;

    private final OrbitalTable orbitalTable;

    private final SamplingScheme scheme;

    private final Spin spin;

    /**
     * 擬スピンの軸です（指定がない場合は null）。
     */
    private final SocAxis socAxis;

    private final boolean spinPolarized;

    private final boolean spinOrbit;

    private final boolean hybridFunctional;

    private final boolean unfolded;

    private final boolean projected;

    /**
     * 補正に使ったフェルミエネルギー（ずらし量を含む）です。
     */
    private final double efermi;

    /**
     * ライン形式の k 点指定です（通常計算のみ）。
     */
    private final LineModeKPoints lineMode;

    /**
     * ハイブリッド汎関数計算の高対称点です。
     */
    private final ImmutableList<HighSymmetryPoint> symmetryPoints;

    /**
     * 展開 k パスの区間ラベルです。
     */
    private final ImmutableList<List<String>> unfoldLegs;

    @Getter(AccessLevel.NONE)
    private final double[][] eigenvalues;

    @Getter(AccessLevel.NONE)
    private final double[][] kpoints;

    @Getter(AccessLevel.NONE)
    private final double[][] spectralWeights;

    @Getter(AccessLevel.NONE)
    private final int[] originKIndices;

    @Getter(AccessLevel.NONE)
    private final Supplier<ProjectionTensor> projectionSupplier;

    @Getter(AccessLevel.NONE)
    private final Supplier<double[][]> spinProjectionSupplier;

    /**
     * データセットを生成します。
     *
     * @throws IllegalArgumentException 固有値と k 点の数が一致しない場合など、引数が不正な場合に発生します
     */
    @Builder
    private Dataset(StructureInfo structure, SamplingScheme scheme, Spin spin, SocAxis socAxis,
            boolean spinPolarized, boolean spinOrbit, boolean hybridFunctional, boolean unfolded,
            boolean projected, double efermi, LineModeKPoints lineMode,
            List<HighSymmetryPoint> symmetryPoints, List<List<String>> unfoldLegs,
            double[][] eigenvalues, double[][] kpoints, double[][] spectralWeights,
            int[] originKIndices, Supplier<ProjectionTensor> projections,
            Supplier<double[][]> spinProjections) {
        Preconditions.checkNotNull(structure, "structure は null 不可です");
        Preconditions.checkNotNull(scheme, "scheme は null 不可です");
        Preconditions.checkNotNull(spin, "spin は null 不可です");
        Preconditions.checkNotNull(eigenvalues, "eigenvalues は null 不可です");
        Preconditions.checkNotNull(kpoints, "kpoints は null 不可です");
        for (double[] band : eigenvalues) {
            Preconditions.checkArgument(band.length == kpoints.length,
                    "固有値の k 点数と k 点の数が一致しません: %s vs %s", band.length, kpoints.length);
        }
        if (spectralWeights != null) {
            Preconditions.checkArgument(spectralWeights.length == eigenvalues.length,
                    "スペクトル重みのバンド数が一致しません");
            for (double[] band : spectralWeights) {
                Preconditions.checkArgument(band.length == kpoints.length,
                        "スペクトル重みの k 点数が一致しません");
            }
        }
        this.structure = structure;
        this.orbitalTable = OrbitalTable.forStructure(structure);
        this.scheme = scheme;
        this.spin = spin;
        this.socAxis = socAxis;
        this.spinPolarized = spinPolarized;
        this.spinOrbit = spinOrbit;
        this.hybridFunctional = hybridFunctional;
        this.unfolded = unfolded;
        this.projected = projected;
        this.efermi = efermi;
        this.lineMode = lineMode;
        this.symmetryPoints =
                symmetryPoints == null ? ImmutableList.of() : ImmutableList.copyOf(symmetryPoints);
        this.unfoldLegs =
                unfoldLegs == null ? ImmutableList.of() : ImmutableList.copyOf(unfoldLegs);
        this.eigenvalues = eigenvalues;
        this.kpoints = kpoints;
        this.spectralWeights = spectralWeights;
        this.originKIndices = originKIndices;
        this.projectionSupplier = projections == null ? null : Suppliers.memoize(projections::get);
        this.spinProjectionSupplier =
                spinProjections == null ? null : Suppliers.memoize(spinProjections::get);
    }

    public int bandCount() {
        return eigenvalues.length;
    }

    public int kpointCount() {
        return kpoints.length;
    }

    /**
     * 固有値を返します。
     *
     * @param band バンドです
     * @param k k 点です
     * @return フェルミ準位を 0 とした固有値（eV）です
     */
    public double eigenvalue(int band, int k) {
        return eigenvalues[band][k];
    }

    /**
     * 固有値のコピーを返します。
     *
     * @return {@code [band][k]} の固有値です
     */
    public double[][] getEigenvalues() {
        return deepCopy(eigenvalues);
    }

    /**
     * k 点座標のコピーを返します。
     *
     * @return {@code [k][3]} の分数座標です
     */
    public double[][] getKpoints() {
        return deepCopy(kpoints);
    }

    /**
     * スペクトル重みを持つか（展開したデータセットか）を返します。
     *
     * @return スペクトル重みを持つ場合は true です
     */
    public boolean hasSpectralWeights() {
        return spectralWeights != null;
    }

    /**
     * スペクトル重みを返します。
     *
     * @param band バンドです
     * @param k k 点です
     * @return スペクトル重みです
     * @throws IllegalStateException 展開したデータセットでない場合に発生します
     */
    public double spectralWeight(int band, int k) {
        Preconditions.checkState(spectralWeights != null, "スペクトル重みは展開したデータセットにのみあります");
        return spectralWeights[band][k];
    }

    /**
     * 展開 k パスの各点に対応するスーパーセルの k インデックス（第 1 バンド）を返します。
     *
     * @return インデックスのコピー、展開していない場合は null です
     */
    public int[] getOriginKIndices() {
        return originKIndices == null ? null : originKIndices.clone();
    }

    /**
     * 射影重みを返します。
     *
     * @return 射影重みです（k 点はこのデータセットの k 点に揃えてあります）
     * @throws ConfigurationException 射影重みを読み込む設定でない場合に発生します
     */
    public ProjectionTensor projections() {
        if (!projected || projectionSupplier == null) {
            throw new ConfigurationException("射影重みを使うには projected を有効にしてください");
        }
        return projectionSupplier.get();
    }

    /**
     * スピン軸射影を持つかを返します。
     *
     * @return SOC 軸を指定している場合は true です
     */
    public boolean hasSpinProjections() {
        return socAxis != null && spinProjectionSupplier != null;
    }

    /**
     * スピン軸射影（擬スピンの大きさ、最大値で正規化）を返します。
     *
     * @return {@code [band][k]} の値のコピーです
     * @throws ConfigurationException SOC 軸を指定していない場合に発生します
     */
    public double[][] spinProjections() {
        if (!hasSpinProjections()) {
            throw new ConfigurationException("スピン軸射影を使うには soc-axis を指定してください");
        }
        return deepCopy(spinProjectionSupplier.get());
    }

    private static double[][] deepCopy(double[][] src) {
        double[][] out = new double[src.length][];
        for (int i = 0; i < src.length; i++) {
            out[i] = src[i].clone();
        }
        return out;
    }
}
