package io.github.yok.band.core.geometry;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.band.core.error.DataIntegrityException;
import io.github.yok.band.core.path.CustomPathSpec;
import io.github.yok.band.core.path.KPathResolver;
import io.github.yok.band.core.path.ResolvedPath;
import io.github.yok.band.testing.BandFixtures;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DistanceCalculatorTest {

    private final KPathResolver resolver = new KPathResolver();

    @Test
    @DisplayName("距離は区間をまたいで非減少で、全長は各区間の長さの和")
    void monotoneAndAdditive() {
        ResolvedPath path = resolver.resolve(
                resolver.naturalSegments(BandFixtures.regular(BandFixtures.twoBands())),
                CustomPathSpec.of(1, -2, 2));
        DistanceCalculator calculator = new DistanceCalculator(BandFixtures.identityLattice());

        List<double[]> distances =
                calculator.distances(path, BandFixtures.gammaXGammaKpoints());

        double previous = 0.0;
        double spans = 0.0;
        for (double[] d : distances) {
            assertEquals(previous, d[0], 1e-12);
            for (int i = 1; i < d.length; i++) {
                assertTrue(d[i] >= d[i - 1]);
            }
            spans += d[d.length - 1] - d[0];
            previous = d[d.length - 1];
        }
        assertEquals(spans, previous, 1e-12);
        assertEquals(1.5, previous, 1e-12);
    }

    @Test
    @DisplayName("逆行列の行ノルムの最小値で正規化する")
    void normalizesByMinimumRowNorm() {
        // 格子定数 (1, 2, 4) の直方晶: 逆行列の行ノルムは (1, 0.5, 0.25)
        double[][] lattice = {{1, 0, 0}, {0, 2, 0}, {0, 0, 4}};
        DistanceCalculator calculator = new DistanceCalculator(lattice);

        assertArrayEquals(new double[] {4, 2, 1}, calculator.toMetric(new double[] {1, 1, 1}),
                1e-12);
        double[] d = calculator.cumulative(new double[][] {{0, 0, 0}, {0, 0, 0.5}}, 3.0);
        assertArrayEquals(new double[] {3.0, 3.5}, d, 1e-12);
    }

    @Test
    @DisplayName("特異な格子行列はデータ不整合")
    void singularLattice() {
        double[][] lattice = {{1, 0, 0}, {2, 0, 0}, {0, 0, 1}};

        assertThrows(DataIntegrityException.class, () -> new DistanceCalculator(lattice));
    }
}
