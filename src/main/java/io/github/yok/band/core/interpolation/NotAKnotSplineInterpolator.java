package io.github.yok.band.core.interpolation;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * not-a-knot 境界条件の 3 次スプライン補間です。
 *
 * <p>
 * 両端から 2 番目の節点で 3 階微分が連続になる条件を課します。3 次多項式はそのまま再現されます。 3 点の場合は 2 次多項式になります。
 * 節点での 2 階微分（モーメント）を連立方程式で求め、同じ節点を持つ複数の系列は 1 回の LU 分解でまとめて解きます。
 * </p>
 */
public final class NotAKnotSplineInterpolator implements UnivariateInterpolator {

    /**
     * 必要な最小点数です。
     */
    public static final int MIN_POINTS = 3;

    @Override
    public PolynomialSplineFunction interpolate(double[] x, double[] y) {
        return interpolateAll(x, new double[][] {y})[0];
    }

    /**
     * 同じ節点を持つ系列をまとめて補間します。
     *
     * @param x 節点です（狭義単調増加、{@value #MIN_POINTS} 点以上）
     * @param ys 系列ごとの節点の値 {@code [series][point]} です
     * @return 系列ごとのスプラインです
     * @throws IllegalArgumentException 節点が不足している場合、増加していない場合、または点数が一致しない場合に発生します
     * @throws IllegalStateException 連立方程式が解けない場合に発生します
     */
    public PolynomialSplineFunction[] interpolateAll(double[] x, double[][] ys) {
        Preconditions.checkNotNull(x, "x は null 不可です");
        Preconditions.checkNotNull(ys, "ys は null 不可です");
        int n = x.length;
        Preconditions.checkArgument(n >= MIN_POINTS, "3 次スプラインには %s 点以上が必要です: %s", MIN_POINTS,
                n);
        double[] h = new double[n - 1];
        for (int i = 0; i < n - 1; i++) {
            h[i] = x[i + 1] - x[i];
            Preconditions.checkArgument(h[i] > 0.0, "節点が増加していません: index=%s", i + 1);
        }
        for (double[] y : ys) {
            Preconditions.checkArgument(y.length == n, "値の点数と節点の数が一致しません: %s vs %s", y.length, n);
        }

        DMatrixRMaj a = new DMatrixRMaj(n, n);
        DMatrixRMaj b = new DMatrixRMaj(n, ys.length);
        if (n == MIN_POINTS) {
            // 2 次多項式: M0 = M1 = M2
            a.set(0, 0, 1.0);
            a.set(0, 1, -1.0);
            a.set(n - 1, n - 2, -1.0);
            a.set(n - 1, n - 1, 1.0);
        } else {
            a.set(0, 0, h[1]);
            a.set(0, 1, -(h[0] + h[1]));
            a.set(0, 2, h[0]);
            a.set(n - 1, n - 3, h[n - 2]);
            a.set(n - 1, n - 2, -(h[n - 3] + h[n - 2]));
            a.set(n - 1, n - 1, h[n - 3]);
        }
        for (int i = 1; i < n - 1; i++) {
            a.set(i, i - 1, h[i - 1]);
            a.set(i, i, 2.0 * (h[i - 1] + h[i]));
            a.set(i, i + 1, h[i]);
            for (int s = 0; s < ys.length; s++) {
                double[] y = ys[s];
                b.set(i, s, 6.0 * ((y[i + 1] - y[i]) / h[i] - (y[i] - y[i - 1]) / h[i - 1]));
            }
        }

        DMatrixRMaj moments = new DMatrixRMaj(n, ys.length);
        if (!CommonOps_DDRM.solve(a, b, moments)) {
            throw new IllegalStateException("スプラインのモーメントを求められません: 節点数=" + n);
        }

        PolynomialSplineFunction[] out = new PolynomialSplineFunction[ys.length];
        for (int s = 0; s < ys.length; s++) {
            double[] y = ys[s];
            PolynomialFunction[] pieces = new PolynomialFunction[n - 1];
            for (int i = 0; i < n - 1; i++) {
                double m0 = moments.get(i, s);
                double m1 = moments.get(i + 1, s);
                pieces[i] = new PolynomialFunction(new double[] {y[i],
                        (y[i + 1] - y[i]) / h[i] - h[i] * (2.0 * m0 + m1) / 6.0, m0 / 2.0,
                        (m1 - m0) / (6.0 * h[i])});
            }
            out[s] = new PolynomialSplineFunction(x, pieces);
        }
        return out;
    }
}
