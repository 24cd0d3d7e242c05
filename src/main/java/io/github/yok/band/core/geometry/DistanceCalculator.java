package io.github.yok.band.core.geometry;

import com.google.common.base.Preconditions;
import io.github.yok.band.core.error.DataIntegrityException;
import io.github.yok.band.core.path.ResolvedPath;
import java.util.ArrayList;
import java.util.List;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * k 点の分数座標を、k パスに沿った累積距離へ変換するクラスです。
 *
 * <p>
 * 格子行列の逆行列を、その行ベクトルのノルムの最小値で割った計量を使います。 逆格子の大きさが異なるセル同士でも相対的な距離を比較できます。
 * </p>
 */
public final class DistanceCalculator {

    /**
     * 正規化した逆格子行列（3×3）です。
     */
    private final DMatrixRMaj metric;

    /**
     * 格子行列から距離計算器を生成します。
     *
     * @param latticeMatrix 実空間の格子行列です（行が格子ベクトル）
     * @throws IllegalArgumentException 3×3 でない場合に発生します
     * @throws DataIntegrityException 格子行列が特異な場合に発生します
     */
    public DistanceCalculator(double[][] latticeMatrix) {
        Preconditions.checkNotNull(latticeMatrix, "latticeMatrix は null 不可です");
        Preconditions.checkArgument(latticeMatrix.length == 3, "格子行列は 3×3 が必要です");
        for (double[] row : latticeMatrix) {
            Preconditions.checkArgument(row != null && row.length == 3, "格子行列は 3×3 が必要です");
        }

        DMatrixRMaj lattice = new DMatrixRMaj(latticeMatrix);
        DMatrixRMaj inverse = new DMatrixRMaj(3, 3);
        if (!CommonOps_DDRM.invert(lattice, inverse)) {
            throw new DataIntegrityException("格子行列が特異です");
        }

        // 行ノルムの最小値で正規化します
        double minNorm = Double.POSITIVE_INFINITY;
        for (int row = 0; row < 3; row++) {
            double s = 0.0;
            for (int col = 0; col < 3; col++) {
                s += inverse.get(row, col) * inverse.get(row, col);
            }
            minNorm = Math.min(minNorm, Math.sqrt(s));
        }
        if (!(minNorm > 0.0) || !Double.isFinite(minNorm)) {
            throw new DataIntegrityException("格子行列の逆行列を正規化できません");
        }
        CommonOps_DDRM.divide(inverse, minNorm);
        this.metric = inverse;
    }

    /**
     * 分数座標を計量空間の座標に変換します（{@code k · M^T}）。
     *
     * @param k 分数座標です
     * @return 変換後の座標です
     */
    public double[] toMetric(double[] k) {
        double[] out = new double[3];
        for (int row = 0; row < 3; row++) {
            double s = 0.0;
            for (int col = 0; col < 3; col++) {
                s += metric.get(row, col) * k[col];
            }
            out[row] = s;
        }
        return out;
    }

    /**
     * 1 区間の累積距離を計算します。
     *
     * @param kpoints 進行方向に並べた分数座標です
     * @param offset 先頭の距離です
     * @return 累積距離です（先頭は offset）
     */
    public double[] cumulative(double[][] kpoints, double offset) {
        Preconditions.checkNotNull(kpoints, "kpoints は null 不可です");
        double[] out = new double[kpoints.length];
        if (kpoints.length == 0) {
            return out;
        }
        out[0] = offset;
        double[] prev = toMetric(kpoints[0]);
        for (int i = 1; i < kpoints.length; i++) {
            double[] cur = toMetric(kpoints[i]);
            double dx = cur[0] - prev[0];
            double dy = cur[1] - prev[1];
            double dz = cur[2] - prev[2];
            out[i] = out[i - 1] + Math.sqrt(dx * dx + dy * dy + dz * dz);
            prev = cur;
        }
        return out;
    }

    /**
     * 解決した k パスの区間ごとの距離を計算します。
     *
     * <p>
     * 各区間は 0 から累積し、直前の区間の最後の距離だけずらして連結します。 そのため区間境界では直前の区間の終点と次の区間の始点が同じ距離になります。
     * </p>
     *
     * @param path 解決した区間の並びです
     * @param kpoints データセットの k 点座標です
     * @return 区間ごとの距離（進行方向）です
     */
    public List<double[]> distances(ResolvedPath path, double[][] kpoints) {
        Preconditions.checkNotNull(path, "path は null 不可です");
        Preconditions.checkNotNull(kpoints, "kpoints は null 不可です");

        List<double[]> out = new ArrayList<>();
        double offset = 0.0;
        for (int i = 0; i < path.size(); i++) {
            double[] d = cumulative(path.sliceKpoints(kpoints, i), offset);
            out.add(d);
            offset = d[d.length - 1];
        }
        return out;
    }
}
