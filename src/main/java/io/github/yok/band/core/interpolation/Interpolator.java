package io.github.yok.band.core.interpolation;

import com.google.common.base.Preconditions;
import java.util.List;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.function.Constant;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;

/**
 * 区間ごとの 1 次元補間で、値を等間隔の距離グリッドへ再サンプリングするクラスです。
 *
 * <p>
 * 区間は互いに独立に補間し、結果を k パスの順に連結します。区間境界をまたいだ補間は行いません。 各区間のグリッドは、その区間の距離の最小値から最大値までを
 * {@code newN} 点で等分したものです。 符号付きの値は not-a-knot 境界条件の 3 次スプラインで補間し、3 点未満の区間だけ線形補間にします。
 * </p>
 */
@Slf4j
public final class Interpolator {

    /**
     * 区間あたりの再サンプリング点数です。
     */
    private final int newN;

    /**
     * 補間器を生成します。
     *
     * @param newN 区間あたりの再サンプリング点数です（2 以上）
     * @throws IllegalArgumentException newN が 2 未満の場合に発生します
     */
    public Interpolator(int newN) {
        Preconditions.checkArgument(newN >= 2, "new-n は 2 以上が必要です: %s", newN);
        this.newN = newN;
    }

    public int getNewN() {
        return newN;
    }

    /**
     * 再サンプリングの結果です。
     */
    @Value
    public static class Resampled {

        /**
         * 再サンプリング後の距離です。
         */
        double[] distances;

        /**
         * 再サンプリング後の値 {@code [series][point]} です。
         */
        double[][] values;
    }

    /**
     * 1 区間の距離から、等間隔のグリッドを作ります。
     *
     * @param distances 区間の距離です（非減少）
     * @return グリッドです（両端は最小値・最大値に一致）
     */
    public double[] grid(double[] distances) {
        Preconditions.checkArgument(distances != null && distances.length > 0, "距離が空です");
        double min = distances[0];
        double max = distances[distances.length - 1];
        double[] out = new double[newN];
        for (int i = 0; i < newN; i++) {
            out[i] = min + (max - min) * i / (newN - 1);
        }
        out[newN - 1] = max;
        return out;
    }

    /**
     * 1 区間の値を再サンプリングします。
     *
     * @param distances 区間の距離です（非減少）
     * @param rows 系列ごとの値 {@code [series][point]} です
     * @param mode 補間方式です
     * @return 再サンプリングの結果です
     * @throws IllegalArgumentException 距離が減少している場合、または点数が一致しない場合に発生します
     */
    public Resampled resample(double[] distances, double[][] rows, InterpolationMode mode) {
        Preconditions.checkNotNull(distances, "distances は null 不可です");
        Preconditions.checkNotNull(rows, "rows は null 不可です");
        Preconditions.checkNotNull(mode, "mode は null 不可です");
        for (int i = 1; i < distances.length; i++) {
            Preconditions.checkArgument(distances[i] >= distances[i - 1], "距離が減少しています: index=%s",
                    i);
        }

        // 同じ距離が続く点は最初の 1 点だけを使います
        int[] unique = uniqueIndices(distances);
        double[] x = new double[unique.length];
        for (int i = 0; i < unique.length; i++) {
            x[i] = distances[unique[i]];
        }

        double[][] ys = new double[rows.length][unique.length];
        for (int r = 0; r < rows.length; r++) {
            double[] row = rows[r];
            Preconditions.checkArgument(row.length == distances.length,
                    "値の点数と距離の点数が一致しません: %s vs %s", row.length, distances.length);
            for (int i = 0; i < unique.length; i++) {
                ys[r][i] = row[unique[i]];
            }
        }

        double[] grid = grid(distances);
        UnivariateFunction[] functions = fit(x, ys, mode);
        double[][] out = new double[rows.length][];
        int clamped = 0;
        for (int r = 0; r < rows.length; r++) {
            out[r] = evaluate(functions[r], x, grid);
            if (mode == InterpolationMode.LINEAR_NON_NEGATIVE) {
                for (int i = 0; i < out[r].length; i++) {
                    if (out[r][i] < 0.0) {
                        out[r][i] = 0.0;
                        clamped++;
                    }
                }
            }
        }
        if (clamped > 0) {
            log.warn("補間で負になった重みを 0 に切り詰めました。件数={}", clamped);
        }
        return new Resampled(grid, out);
    }

    /**
     * 区間ごとに再サンプリングし、k パスの順に連結します。
     *
     * @param distances 区間ごとの距離です
     * @param rows 区間ごとの値 {@code [series][point]} です（系列数はすべての区間で同じ）
     * @param mode 補間方式です
     * @return 連結した結果です
     */
    public Resampled resampleSegments(List<double[]> distances, List<double[][]> rows,
            InterpolationMode mode) {
        Preconditions.checkNotNull(distances, "distances は null 不可です");
        Preconditions.checkNotNull(rows, "rows は null 不可です");
        Preconditions.checkArgument(distances.size() == rows.size(), "区間数が一致しません: %s vs %s",
                distances.size(), rows.size());
        Preconditions.checkArgument(!distances.isEmpty(), "区間が空です");

        int series = rows.get(0).length;
        int total = newN * distances.size();
        double[] grid = new double[total];
        double[][] values = new double[series][total];
        for (int s = 0; s < distances.size(); s++) {
            Preconditions.checkArgument(rows.get(s).length == series, "区間 %s の系列数が一致しません", s);
            Resampled part = resample(distances.get(s), rows.get(s), mode);
            System.arraycopy(part.getDistances(), 0, grid, s * newN, newN);
            for (int r = 0; r < series; r++) {
                System.arraycopy(part.getValues()[r], 0, values[r], s * newN, newN);
            }
        }
        return new Resampled(grid, values);
    }

    private static UnivariateFunction[] fit(double[] x, double[][] ys, InterpolationMode mode) {
        UnivariateFunction[] out = new UnivariateFunction[ys.length];
        if (x.length == 1) {
            for (int r = 0; r < ys.length; r++) {
                out[r] = new Constant(ys[r][0]);
            }
            return out;
        }
        if (mode == InterpolationMode.CUBIC_SIGNED
                && x.length >= NotAKnotSplineInterpolator.MIN_POINTS) {
            // 系列は節点を共有するので連立方程式を 1 回で解きます
            return new NotAKnotSplineInterpolator().interpolateAll(x, ys);
        }
        LinearInterpolator linear = new LinearInterpolator();
        for (int r = 0; r < ys.length; r++) {
            out[r] = linear.interpolate(x, ys[r]);
        }
        return out;
    }

    private static double[] evaluate(UnivariateFunction f, double[] x, double[] grid) {
        double[] out = new double[grid.length];
        double lo = x[0];
        double hi = x[x.length - 1];
        for (int i = 0; i < grid.length; i++) {
            // 丸め誤差で節点の範囲をわずかに外れた点は端に寄せます
            out[i] = f.value(Math.max(lo, Math.min(hi, grid[i])));
        }
        return out;
    }

    private static int[] uniqueIndices(double[] distances) {
        int count = distances.length == 0 ? 0 : 1;
        for (int i = 1; i < distances.length; i++) {
            if (distances[i] > distances[i - 1]) {
                count++;
            }
        }
        int[] out = new int[count];
        int next = 0;
        for (int i = 0; i < distances.length; i++) {
            if (i == 0 || distances[i] > distances[i - 1]) {
                out[next++] = i;
            }
        }
        return out;
    }
}
