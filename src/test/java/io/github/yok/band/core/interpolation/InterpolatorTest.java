package io.github.yok.band.core.interpolation;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InterpolatorTest {

    private final Interpolator interpolator = new Interpolator(7);

    @Nested
    @DisplayName("グリッド")
    class Grid {

        @Test
        @DisplayName("両端は区間の最小値・最大値に一致する")
        void endpoints() {
            double[] grid = interpolator.grid(new double[] {0.5, 0.7, 1.1});

            assertEquals(7, grid.length);
            assertEquals(0.5, grid[0], 0.0);
            assertEquals(1.1, grid[6], 0.0);
            assertEquals(0.6, grid[1], 1e-12);
        }

        @Test
        @DisplayName("new-n が 2 未満は拒否される")
        void tooFewPoints() {
            assertThrows(IllegalArgumentException.class, () -> new Interpolator(1));
        }
    }

    @Nested
    @DisplayName("再サンプリング")
    class Resample {

        @Test
        @DisplayName("定数は 3 次スプラインでも線形でも定数のまま")
        void constantIsPreserved() {
            double[] d = {0.0, 0.1, 0.3, 0.6, 1.0};
            double[][] rows = {{2.5, 2.5, 2.5, 2.5, 2.5}};

            for (InterpolationMode mode : InterpolationMode.values()) {
                double[] out = interpolator.resample(d, rows, mode).getValues()[0];
                for (double v : out) {
                    assertEquals(2.5, v, 1e-12);
                }
            }
        }

        @Test
        @DisplayName("節点では元の値を通る")
        void passesThroughKnots() {
            double[] d = {0.0, 0.5, 1.0, 1.5, 2.0, 2.5, 3.0};
            double[][] rows = {{0.0, 0.4, -0.2, 0.9, 1.1, 0.3, -0.5}};

            double[] out = interpolator.resample(d, rows, InterpolationMode.CUBIC_SIGNED)
                    .getValues()[0];

            assertArrayEquals(rows[0], out, 1e-9);
        }

        @Test
        @DisplayName("3 次スプラインは 3 次多項式をそのまま再現する")
        void reproducesCubicPolynomial() {
            double[] d = {0.0, 0.3, 0.5, 1.1, 1.4, 2.0};
            double[][] rows = new double[1][d.length];
            for (int i = 0; i < d.length; i++) {
                rows[0][i] = d[i] * d[i] * d[i] - 2.0 * d[i];
            }

            Interpolator.Resampled out =
                    interpolator.resample(d, rows, InterpolationMode.CUBIC_SIGNED);

            for (int i = 0; i < out.getDistances().length; i++) {
                double g = out.getDistances()[i];
                assertEquals(g * g * g - 2.0 * g, out.getValues()[0][i], 1e-9);
            }
        }

        @Test
        @DisplayName("3 点の区間は 2 次多項式で補間する")
        void threePointsGiveParabola() {
            double[] d = {0.0, 1.0, 3.0};
            double[][] rows = {{0.0, 1.0, 9.0}};

            double[] out = interpolator.resample(d, rows, InterpolationMode.CUBIC_SIGNED)
                    .getValues()[0];

            assertEquals(0.25, out[1], 1e-12);
            assertEquals(6.25, out[5], 1e-12);
        }

        @Test
        @DisplayName("2 点の区間は 3 次スプラインの指定でも線形になる")
        void twoPointsAreLinear() {
            double[] out = interpolator.resample(new double[] {0.0, 3.0},
                    new double[][] {{1.0, 4.0}}, InterpolationMode.CUBIC_SIGNED).getValues()[0];

            assertEquals(2.5, out[3], 1e-12);
        }

        @Test
        @DisplayName("線形補間の重みは負にならない")
        void weightsStayNonNegative() {
            double[] d = {0.0, 1.0, 2.0};
            double[][] rows = {{0.0, 0.0, 1.0}, {-1e-12, 0.5, 0.0}};

            double[][] out = interpolator.resample(d, rows, InterpolationMode.LINEAR_NON_NEGATIVE)
                    .getValues();

            for (double[] row : out) {
                for (double v : row) {
                    assertTrue(v >= 0.0);
                }
            }
            assertEquals(0.5, out[1][3], 1e-12);
        }

        @Test
        @DisplayName("同じ距離が続く点は最初の 1 点を使う")
        void duplicateDistances() {
            double[] d = {0.0, 1.0, 1.0, 2.0};
            double[][] rows = {{0.0, 1.0, 99.0, 2.0}};

            double[] out = interpolator.resample(d, rows, InterpolationMode.LINEAR_NON_NEGATIVE)
                    .getValues()[0];

            assertEquals(1.0, out[3], 1e-12);
            assertEquals(2.0, out[6], 1e-12);
        }

        @Test
        @DisplayName("1 点しかない区間は定数になる")
        void singlePoint() {
            double[] out = interpolator.resample(new double[] {0.3, 0.3},
                    new double[][] {{4.0, 7.0}}, InterpolationMode.CUBIC_SIGNED).getValues()[0];

            for (double v : out) {
                assertEquals(4.0, v, 0.0);
            }
        }

        @Test
        @DisplayName("距離が減少している場合は拒否される")
        void decreasingDistances() {
            assertThrows(IllegalArgumentException.class,
                    () -> interpolator.resample(new double[] {0.0, 1.0, 0.5},
                            new double[][] {{0, 0, 0}}, InterpolationMode.CUBIC_SIGNED));
        }

        @Test
        @DisplayName("区間ごとの結果は区間数 × new-n 点に連結される")
        void segmentsAreConcatenated() {
            Interpolator.Resampled out = interpolator.resampleSegments(
                    List.of(new double[] {0.0, 0.5, 1.0}, new double[] {1.0, 2.0}),
                    List.of(new double[][] {{1, 1, 1}}, new double[][] {{3, 5}}),
                    InterpolationMode.CUBIC_SIGNED);

            assertEquals(14, out.getDistances().length);
            assertEquals(1.0, out.getDistances()[6], 0.0);
            assertEquals(1.0, out.getDistances()[7], 0.0);
            assertEquals(3.0, out.getValues()[0][7], 1e-12);
            assertEquals(5.0, out.getValues()[0][13], 1e-12);
        }
    }
}
