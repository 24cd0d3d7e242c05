package io.github.yok.band.core.interpolation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NotAKnotSplineInterpolatorTest {

    private final NotAKnotSplineInterpolator interpolator = new NotAKnotSplineInterpolator();

    @Test
    @DisplayName("4 点なら節点を通る 1 本の 3 次多項式になる")
    void fourPointsGiveSingleCubic() {
        double[] x = {0.0, 1.0, 2.5, 3.0};
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            y[i] = 2.0 - x[i] + 0.5 * x[i] * x[i] * x[i];
        }

        PolynomialSplineFunction f = interpolator.interpolate(x, y);

        for (double t = 0.0; t <= 3.0; t += 0.125) {
            assertEquals(2.0 - t + 0.5 * t * t * t, f.value(t), 1e-10);
        }
    }

    @Test
    @DisplayName("端から 2 番目の節点で 3 階微分が連続になる")
    void thirdDerivativeIsContinuousNearEnds() {
        double[] x = {0.0, 0.4, 1.0, 1.3, 2.0, 2.2};
        double[] y = {0.0, 1.0, -0.5, 0.7, 0.2, 1.5};

        PolynomialSplineFunction f = interpolator.interpolate(x, y);

        PolynomialFunction[] pieces = f.getPolynomials();
        assertEquals(cubic(pieces[0]), cubic(pieces[1]), 1e-9);
        assertEquals(cubic(pieces[3]), cubic(pieces[4]), 1e-9);
    }

    private static double cubic(PolynomialFunction p) {
        double[] c = p.getCoefficients();
        return c.length > 3 ? c[3] : 0.0;
    }

    @Test
    @DisplayName("まとめて補間しても系列ごとに補間した結果と一致する")
    void batchMatchesSingle() {
        double[] x = {0.0, 0.5, 0.9, 1.6, 2.0};
        double[][] ys = {{1.0, 0.2, -0.3, 0.8, 0.0}, {-2.0, 3.0, 0.5, 0.5, 1.0}};

        PolynomialSplineFunction[] all = interpolator.interpolateAll(x, ys);

        for (int s = 0; s < ys.length; s++) {
            PolynomialSplineFunction single = interpolator.interpolate(x, ys[s]);
            for (double t = 0.0; t <= 2.0; t += 0.1) {
                assertEquals(single.value(t), all[s].value(t), 1e-12);
            }
        }
    }

    @Test
    @DisplayName("3 点未満、または節点が増加していない場合は拒否される")
    void invalidKnots() {
        assertThrows(IllegalArgumentException.class,
                () -> interpolator.interpolate(new double[] {0.0, 1.0}, new double[] {0.0, 1.0}));
        assertThrows(IllegalArgumentException.class, () -> interpolator
                .interpolate(new double[] {0.0, 1.0, 1.0}, new double[] {0.0, 1.0, 2.0}));
        assertThrows(IllegalArgumentException.class, () -> interpolator
                .interpolate(new double[] {0.0, 1.0, 2.0}, new double[] {0.0, 1.0}));
    }
}
