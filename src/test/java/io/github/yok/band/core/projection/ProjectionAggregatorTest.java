package io.github.yok.band.core.projection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.band.core.array.NdArray;
import io.github.yok.band.core.error.ConfigurationException;
import io.github.yok.band.core.projection.ProjectionAggregator.AtomGroup;
import io.github.yok.band.core.projection.ProjectionAggregator.AtomOrbital;
import io.github.yok.band.core.projection.ProjectionAggregator.ElementGroup;
import io.github.yok.band.core.projection.ProjectionAggregator.ElementOrbital;
import io.github.yok.band.core.structure.OrbitalGroup;
import io.github.yok.band.core.structure.OrbitalTable;
import io.github.yok.band.core.structure.StructureInfo;
import io.github.yok.band.testing.BandFixtures;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ProjectionAggregatorTest {

    private static final int BANDS = 2;

    private static final int KPOINTS = 3;

    private StructureInfo structure;

    private ProjectionAggregator aggregator;

    private ProjectionTensor tensor;

    @BeforeEach
    void setUp() {
        // In0, In1, As2
        structure = BandFixtures.in2As();
        aggregator = new ProjectionAggregator(OrbitalTable.WITHOUT_F, structure);
        NdArray weights = NdArray.zeros(BANDS, KPOINTS, 3, 9);
        for (int b = 0; b < BANDS; b++) {
            for (int k = 0; k < KPOINTS; k++) {
                for (int a = 0; a < 3; a++) {
                    for (int o = 0; o < 9; o++) {
                        weights.set(0.01 * (b + 1) + 0.1 * k + a + 0.001 * o, b, k, a, o);
                    }
                }
            }
        }
        tensor = new ProjectionTensor(weights);
    }

    private double total(int b, int k) {
        double s = 0.0;
        for (int a = 0; a < 3; a++) {
            for (int o = 0; o < 9; o++) {
                s += tensor.weight(b, k, a, o);
            }
        }
        return s;
    }

    @Nested
    @DisplayName("和の整合")
    class Sums {

        @Test
        @DisplayName("元素の和はその元素の原子の和に一致する")
        void elementEqualsSumOfItsAtoms() {
            ProjectionChannels elements = aggregator.byElements(tensor, List.of("In", "As"));
            ProjectionChannels atoms = aggregator.byAtoms(tensor, new int[] {0, 1, 2});

            for (int b = 0; b < BANDS; b++) {
                for (int k = 0; k < KPOINTS; k++) {
                    assertEquals(atoms.value(b, k, 0) + atoms.value(b, k, 1),
                            elements.value(b, k, 0), 1e-12);
                    assertEquals(atoms.value(b, k, 2), elements.value(b, k, 1), 1e-12);
                }
            }
        }

        @Test
        @DisplayName("s, p, d の和は全原子・全軌道の和に一致する")
        void spdCoversAllOrbitals() {
            ProjectionChannels spd = aggregator.bySpd(tensor, OrbitalGroup.parseAll("spd"));

            for (int b = 0; b < BANDS; b++) {
                for (int k = 0; k < KPOINTS; k++) {
                    double s = spd.value(b, k, 0) + spd.value(b, k, 1) + spd.value(b, k, 2);
                    assertEquals(total(b, k), s, 1e-12);
                }
            }
        }

        @Test
        @DisplayName("元素と区分の組は、元素の原子について区分の軌道を足す")
        void elementSpd() {
            ProjectionChannels channels = aggregator.byElementSpd(tensor,
                    List.of(new ElementGroup("In", OrbitalGroup.P)));

            double expected = 0.0;
            for (int a = 0; a < 2; a++) {
                for (int o = 1; o < 4; o++) {
                    expected += tensor.weight(1, 2, a, o);
                }
            }
            assertEquals(expected, channels.value(1, 2, 0), 1e-12);
        }

        @Test
        @DisplayName("原子と軌道の組は 1 要素をそのまま取り出す")
        void atomOrbital() {
            ProjectionChannels channels =
                    aggregator.byAtomOrbitals(tensor, List.of(new AtomOrbital(1, 4)));

            assertEquals(tensor.weight(0, 1, 1, 4), channels.value(0, 1, 0), 0.0);
        }
    }

    @Nested
    @DisplayName("ラベル")
    class Labels {

        @Test
        @DisplayName("原子は元素記号 + 番号")
        void atomLabels() {
            assertEquals(List.of("In0", "As2"),
                    aggregator.byAtoms(tensor, new int[] {0, 2}).labels());
        }

        @Test
        @DisplayName("組のラベルは 左(軌道)")
        void pairLabels() {
            assertEquals(List.of("As2(p_{x})"),
                    aggregator.byAtomOrbitals(tensor, List.of(new AtomOrbital(2, 3))).labels());
            assertEquals(List.of("In1(d)"), aggregator
                    .byAtomSpd(tensor, List.of(new AtomGroup(1, OrbitalGroup.D))).labels());
            assertEquals(List.of("As(s)"), aggregator
                    .byElementOrbitals(tensor, List.of(new ElementOrbital("As", 0))).labels());
        }

        @Test
        @DisplayName("軌道は軌道名")
        void orbitalLabels() {
            assertEquals(List.of("s", "d_{x^{2}-y^{2}}"),
                    aggregator.byOrbitals(tensor, new int[] {0, 8}).labels());
        }
    }

    @Nested
    @DisplayName("不正な選択")
    class InvalidSelectors {

        @Test
        @DisplayName("構造に存在しない元素")
        void unknownElement() {
            assertThrows(ConfigurationException.class,
                    () -> aggregator.byElements(tensor, List.of("Ga")));
        }

        @Test
        @DisplayName("範囲外の原子")
        void atomOutOfRange() {
            assertThrows(ConfigurationException.class,
                    () -> aggregator.byAtoms(tensor, new int[] {3}));
        }

        @Test
        @DisplayName("範囲外の軌道")
        void orbitalOutOfRange() {
            assertThrows(ConfigurationException.class,
                    () -> aggregator.byOrbitals(tensor, new int[] {9}));
        }

        @Test
        @DisplayName("f 軌道のない構造での f 区分")
        void missingFBlock() {
            assertThrows(ConfigurationException.class,
                    () -> aggregator.bySpd(tensor, List.of(OrbitalGroup.F)));
        }

        @Test
        @DisplayName("空の選択")
        void emptySelection() {
            assertThrows(ConfigurationException.class,
                    () -> aggregator.byElements(tensor, List.of()));
        }
    }
}
