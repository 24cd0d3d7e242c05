package io.github.yok.band.core.dataset;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.band.core.array.NdArray;
import io.github.yok.band.core.cache.DerivedKind;
import io.github.yok.band.core.error.ConfigurationException;
import io.github.yok.band.core.error.DataIntegrityException;
import io.github.yok.band.core.projection.ProjectionTensor;
import io.github.yok.band.core.reader.BandMetadata;
import io.github.yok.band.core.reader.RawEigenvalues;
import io.github.yok.band.core.unfold.UnfoldRequest;
import io.github.yok.band.core.unfold.Unfolder;
import io.github.yok.band.testing.BandFixtures;
import io.github.yok.band.testing.BandFixtures.FakeReader;
import io.github.yok.band.testing.BandFixtures.MapCache;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DatasetLoaderTest {

    private static final Path FOLDER = Paths.get("bands");

    private FakeReader reader;

    private MapCache cache;

    private DatasetLoader loader;

    @BeforeEach
    void setUp() {
        reader = new FakeReader();
        cache = new MapCache();
        loader = new DatasetLoader(reader, cache, Optional.empty());
    }

    private static DatasetRequest.DatasetRequestBuilder request() {
        return DatasetRequest.builder().folder(FOLDER);
    }

    @Nested
    @DisplayName("通常計算")
    class Regular {

        @Test
        @DisplayName("フェルミ補正した固有値と k 点でデータセットを作り、マージ済み配列を保存する")
        void coldLoad() {
            Dataset dataset = loader.load(request().build());

            assertEquals(SamplingScheme.REGULAR, dataset.getScheme());
            assertEquals(2, dataset.bandCount());
            assertEquals(22, dataset.kpointCount());
            assertArrayEquals(BandFixtures.twoBands()[0], dataset.getEigenvalues()[0], 1e-12);
            assertEquals(List.of(DerivedKind.MERGED_RAW), cache.stored);
            assertEquals(1, reader.eigenvalueReads);
        }

        @Test
        @DisplayName("キャッシュがあれば Reader から固有値を読まず、同じ結果になる")
        void warmLoad() {
            Dataset cold = loader.load(request().build());
            Dataset warm = loader.load(request().build());

            assertEquals(1, reader.eigenvalueReads);
            for (int b = 0; b < cold.bandCount(); b++) {
                assertArrayEquals(cold.getEigenvalues()[b], warm.getEigenvalues()[b], 0.0);
            }
        }

        @Test
        @DisplayName("フェルミエネルギーのずらし量を差し引く")
        void shiftEfermi() {
            Dataset dataset = loader.load(request().shiftEfermi(0.5).build());

            assertEquals(5.5, dataset.getEfermi(), 1e-12);
            assertEquals(BandFixtures.twoBands()[0][0] - 0.5, dataset.eigenvalue(0, 0), 1e-12);
        }

        @Test
        @DisplayName("倍率とフェルミ補正はキャッシュの後段で行う")
        void stretchIsNotCached() {
            Dataset dataset = loader.load(request().stretchFactor(2.0).build());

            assertEquals(2.0 * BandFixtures.twoBands()[0][0], dataset.eigenvalue(0, 0), 1e-12);
            NdArray merged = cache.entries.get(DerivedKind.MERGED_RAW);
            assertEquals(BandFixtures.twoBands()[0][0] + 5.0, merged.get(0, 0, 0), 1e-12);
        }

        @Test
        @DisplayName("キャッシュ作成後にずらし量を変えても新しいずらし量で補正する")
        void shiftEfermiAfterCacheWarm() {
            Dataset first = loader.load(request().shiftEfermi(0.0).build());
            Dataset second = loader.load(request().shiftEfermi(0.5).build());

            assertEquals(1, reader.eigenvalueReads);
            assertEquals(-1.0, first.eigenvalue(0, 0), 1e-12);
            assertEquals(-1.5, second.eigenvalue(0, 0), 1e-12);
        }

        @Test
        @DisplayName("スピン分極した計算では指定したチャネルを選ぶ")
        void spinDown() {
            double[][][] channels = new double[2][22][2];
            double[][] occ = new double[22][2];
            for (int k = 0; k < 22; k++) {
                channels[0][k][0] = 5.0;
                channels[1][k][0] = 4.0;
            }
            reader.metadata = new BandMetadata(BandFixtures.inAs(), true, false, false,
                    BandFixtures.gammaXGamma(), List.of());
            reader.eigenvalues = new RawEigenvalues(
                    List.of(channels[0], channels[1]), List.of(occ, occ),
                    BandFixtures.gammaXGammaKpoints(), new double[22]);

            Dataset dataset = loader.load(request().spin(Spin.DOWN).build());

            assertEquals(-1.0, dataset.eigenvalue(0, 3), 1e-12);
        }

        @Test
        @DisplayName("同じキャッシュで UP の後に DOWN を読んでも、キャッシュなしの DOWN と一致する")
        void upThenDownSharesCache() {
            double[][] up = new double[22][2];
            double[][] down = new double[22][2];
            double[][] occ = new double[22][2];
            for (int k = 0; k < 22; k++) {
                up[k][0] = 5.0 + 0.1 * k;
                up[k][1] = 7.0;
                down[k][0] = 4.0 - 0.1 * k;
                down[k][1] = 6.5;
            }
            reader.metadata = new BandMetadata(BandFixtures.inAs(), true, false, false,
                    BandFixtures.gammaXGamma(), List.of());
            reader.eigenvalues = new RawEigenvalues(List.of(up, down), List.of(occ, occ),
                    BandFixtures.gammaXGammaKpoints(), new double[22]);

            Dataset warmUp = loader.load(request().spin(Spin.UP).build());
            Dataset warmDown = loader.load(request().spin(Spin.DOWN).build());
            assertEquals(1, reader.eigenvalueReads);

            Dataset coldDown = new DatasetLoader(reader, new MapCache(), Optional.empty())
                    .load(request().spin(Spin.DOWN).build());

            assertEquals(0.1 * 21, warmUp.eigenvalue(0, 21), 1e-12);
            for (int b = 0; b < coldDown.bandCount(); b++) {
                assertArrayEquals(coldDown.getEigenvalues()[b], warmDown.getEigenvalues()[b],
                        0.0);
            }
            assertEquals(-1.0 - 0.1 * 21, warmDown.eigenvalue(0, 21), 1e-12);
        }
    }

    @Nested
    @DisplayName("設定の矛盾")
    class InvalidRequest {

        @Test
        @DisplayName("スピン分極していないデータセットに spin=DOWN は使えない")
        void downOnNonPolarized() {
            assertThrows(ConfigurationException.class,
                    () -> loader.load(request().spin(Spin.DOWN).build()));
        }

        @Test
        @DisplayName("スピン軌道計算でないデータセットに soc-axis は使えない")
        void socAxisOnNonSoc() {
            assertThrows(ConfigurationException.class,
                    () -> loader.load(request().socAxis(SocAxis.Z).build()));
        }

        @Test
        @DisplayName("射影重みを読み込む設定でなければ projections() は使えない")
        void projectionsNotRequested() {
            Dataset dataset = loader.load(request().build());

            assertThrows(ConfigurationException.class, dataset::projections);
        }

        @Test
        @DisplayName("キャッシュのチャネル数が計算条件と合わなければデータ不整合")
        void channelMismatch() {
            cache.entries.put(DerivedKind.MERGED_RAW, NdArray.zeros(2, 22, 7));

            assertThrows(DataIntegrityException.class, () -> loader.load(request().build()));
        }
    }

    @Nested
    @DisplayName("射影重み")
    class Projections {

        @BeforeEach
        void setUpProjections() {
            NdArray p = NdArray.zeros(2, 22, 1, 2, 9);
            p.set(0.5, 0, 4, 0, 1, 2);
            reader.projections = p;
        }

        @Test
        @DisplayName("初めて使うときに読み込み、二乗して保持する")
        void lazy() {
            Dataset dataset = loader.load(request().projected(true).build());

            assertEquals(0, reader.projectionReads);
            ProjectionTensor tensor = dataset.projections();
            dataset.projections();

            assertEquals(1, reader.projectionReads);
            assertEquals(0.25, tensor.weight(0, 4, 1, 2), 1e-12);
            assertTrue(cache.entries.containsKey(DerivedKind.PROJECTED_RAW));
        }

        @Test
        @DisplayName("バンド数が固有値と合わなければデータ不整合")
        void bandMismatch() {
            reader.projections = NdArray.zeros(3, 22, 1, 2, 9);
            Dataset dataset = loader.load(request().projected(true).build());

            assertThrows(DataIntegrityException.class, dataset::projections);
        }
    }

    @Nested
    @DisplayName("スピン軌道計算")
    class SpinOrbit {

        @BeforeEach
        void setUpSpinOrbit() {
            reader.metadata = new BandMetadata(BandFixtures.inAs(), false, true, false,
                    BandFixtures.gammaXGamma(), List.of());
            NdArray p = NdArray.zeros(2, 22, 4, 2, 9);
            p.set(-0.5, 0, 4, 3, 1, 2);
            p.set(0.3, 0, 5, 3, 1, 2);
            reader.projections = p;
            NdArray axis = NdArray.zeros(2, 22, 4);
            axis.set(-2.0, 0, 4, 3);
            axis.set(1.0, 1, 0, 3);
            reader.spinAxis = axis;
        }

        @Test
        @DisplayName("soc-axis の成分を擬スピンで分離してから二乗する")
        void projectionsFollowPseudoSpin() {
            Dataset dataset = loader.load(
                    request().socAxis(SocAxis.Z).spin(Spin.DOWN).projected(true).build());

            ProjectionTensor tensor = dataset.projections();

            assertEquals(0.25, tensor.weight(0, 4, 1, 2), 1e-12);
            assertEquals(0.0, tensor.weight(0, 5, 1, 2), 1e-12);
        }

        @Test
        @DisplayName("スピン軸射影は両側の最大値で正規化し、一度だけ読み込む")
        void spinProjections() {
            Dataset dataset = loader.load(
                    request().socAxis(SocAxis.Z).spin(Spin.DOWN).projected(true).build());

            assertTrue(dataset.hasSpinProjections());
            double[][] values = dataset.spinProjections();
            dataset.spinProjections();

            assertEquals(1.0, values[0][4], 1e-12);
            assertEquals(0.0, values[1][0], 1e-12);
            assertEquals(1, reader.spinAxisReads);
            assertTrue(cache.entries.containsKey(DerivedKind.SPIN_AXIS_RAW));
        }

        @Test
        @DisplayName("soc-axis がなければ全成分をそのまま二乗する")
        void withoutSocAxis() {
            NdArray p = NdArray.zeros(2, 22, 4, 2, 9);
            p.set(-0.5, 0, 4, 0, 1, 2);
            reader.projections = p;

            Dataset dataset = loader.load(request().projected(true).build());

            assertEquals(0.25, dataset.projections().weight(0, 4, 1, 2), 1e-12);
            assertFalse(dataset.hasSpinProjections());
        }
    }

    @Nested
    @DisplayName("ハイブリッド汎関数計算")
    class Hybrid {

        private static final int SCF_POINTS = 2;

        @BeforeEach
        void setUpHybrid() {
            double[][] path = BandFixtures.gammaXGammaKpoints();
            double[][] bands = BandFixtures.twoBands();
            int total = SCF_POINTS + path.length;
            double[][] kpoints = new double[total][];
            double[][] energies = new double[total][2];
            double[][] occupations = new double[total][2];
            double[] weights = new double[total];
            for (int k = 0; k < SCF_POINTS; k++) {
                kpoints[k] = new double[] {0.25, 0.25, 0.25 * k};
                energies[k][0] = 100.0;
                energies[k][1] = 100.0;
                weights[k] = 1.0;
            }
            for (int k = 0; k < path.length; k++) {
                kpoints[SCF_POINTS + k] = path[k];
                energies[SCF_POINTS + k][0] = bands[0][k] + 5.0;
                energies[SCF_POINTS + k][1] = bands[1][k] + 5.0;
            }
            reader.metadata = new BandMetadata(BandFixtures.inAs(), false, false, true, null,
                    BandFixtures.gammaXGamma().getPoints());
            reader.eigenvalues = new RawEigenvalues(List.<double[][]>of(energies),
                    List.<double[][]>of(occupations), kpoints, weights);
            NdArray p = NdArray.zeros(2, total, 1, 2, 9);
            p.set(0.5, 0, SCF_POINTS + 4, 0, 1, 2);
            reader.projections = p;
        }

        @Test
        @DisplayName("重み 0 の k 点だけを残してデータセットを作る")
        void keepsZeroWeightKpoints() {
            Dataset dataset = loader.load(request().build());

            assertEquals(SamplingScheme.HYBRID, dataset.getScheme());
            assertEquals(22, dataset.kpointCount());
            assertArrayEquals(BandFixtures.twoBands()[0], dataset.getEigenvalues()[0], 1e-12);
            assertEquals(22, cache.entries.get(DerivedKind.MERGED_RAW).dim(1));
        }

        @Test
        @DisplayName("射影重みにも同じ k 点のフィルタを掛けてから保存する")
        void projectionsAreFiltered() {
            Dataset dataset = loader.load(request().projected(true).build());

            ProjectionTensor tensor = dataset.projections();

            assertEquals(22, tensor.kpointCount());
            assertEquals(0.25, tensor.weight(0, 4, 1, 2), 1e-12);
            assertEquals(22, cache.entries.get(DerivedKind.PROJECTED_RAW).dim(1));
        }
    }

    @Nested
    @DisplayName("展開計算")
    class Unfold {

        private DatasetRequest.DatasetRequestBuilder unfoldRequest() {
            return request().unfold(true).unfoldLegs(List.of(List.of("G", "X")))
                    .highSymmetryPoints(List.of(new double[] {0, 0, 0}, new double[] {0.5, 0, 0}))
                    .pointsPerLeg(2)
                    .transform(new double[][] {{2, 0, 0}, {0, 1, 0}, {0, 0, 1}});
        }

        private NdArray unfolded() {
            NdArray u = NdArray.zeros(1, 3, 2, 3);
            for (int b = 0; b < 2; b++) {
                for (int k = 0; k < 3; k++) {
                    u.set(5.0 + b + k, 0, 0, b, k);
                    u.set(0.5, 0, 1, b, k);
                    u.set(k, 0, 2, b, k);
                }
            }
            return u;
        }

        @Test
        @DisplayName("展開のコンポーネントもキャッシュもなければ設定の誤り")
        void noUnfolder() {
            assertThrows(ConfigurationException.class, () -> loader.load(unfoldRequest().build()));
        }

        @Test
        @DisplayName("展開結果からスペクトル重み付きのデータセットを作り、キャッシュに保存する")
        void unfolds() {
            int[] calls = {0};
            Unfolder unfolder = (Path folder, UnfoldRequest r) -> {
                calls[0]++;
                assertEquals(3, r.getKpath().size());
                return unfolded();
            };
            loader = new DatasetLoader(reader, cache, Optional.of(unfolder));

            Dataset dataset = loader.load(unfoldRequest().build());
            loader.load(unfoldRequest().build());

            assertEquals(1, calls[0]);
            assertEquals(SamplingScheme.UNFOLDED, dataset.getScheme());
            assertTrue(dataset.hasSpectralWeights());
            assertEquals(3, dataset.kpointCount());
            assertEquals(0.0, dataset.eigenvalue(0, 0), 1e-12);
            assertEquals(0.5, dataset.spectralWeight(1, 2), 1e-12);
            assertNotNull(dataset.getOriginKIndices());
            assertFalse(cache.stored.contains(DerivedKind.MERGED_RAW));
        }

        @Test
        @DisplayName("射影重みは元の k インデックスでスーパーセルの k 点から取り出す")
        void projectionsFollowOriginIndices() {
            NdArray u = unfolded();
            int[] origin = {2, 0, 1};
            for (int b = 0; b < 2; b++) {
                for (int k = 0; k < 3; k++) {
                    u.set(origin[k], 0, 2, b, k);
                }
            }
            cache.entries.put(DerivedKind.UNFOLDED_RAW, u);
            NdArray p = NdArray.zeros(2, 3, 1, 2, 9);
            p.set(0.5, 0, 2, 0, 1, 2);
            reader.projections = p;

            Dataset dataset = loader.load(unfoldRequest().projected(true).build());
            ProjectionTensor tensor = dataset.projections();

            assertArrayEquals(origin, dataset.getOriginKIndices());
            assertEquals(3, tensor.kpointCount());
            assertEquals(0.25, tensor.weight(0, 0, 1, 2), 1e-12);
            assertEquals(0.0, tensor.weight(0, 2, 1, 2), 1e-12);
        }

        @Test
        @DisplayName("元の k インデックスがスーパーセルの k 点数を超えればデータ不整合")
        void originOutOfRange() {
            NdArray u = unfolded();
            u.set(5.0, 0, 2, 0, 0);
            cache.entries.put(DerivedKind.UNFOLDED_RAW, u);
            reader.projections = NdArray.zeros(2, 3, 1, 2, 9);

            Dataset dataset = loader.load(unfoldRequest().projected(true).build());

            assertThrows(DataIntegrityException.class, dataset::projections);
        }

        @Test
        @DisplayName("高対称点の数が区間数 + 1 でなければ設定の誤り")
        void pointCountMismatch() {
            assertThrows(ConfigurationException.class, () -> loader.load(
                    unfoldRequest().highSymmetryPoints(List.of(new double[] {0, 0, 0})).build()));
        }
    }
}
