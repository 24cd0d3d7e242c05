package io.github.yok.band.core.unfold;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;

/**
 * 展開計算で使う k パスを組み立てるユーティリティです。
 */
public final class UnfoldedKPath {

    private UnfoldedKPath() {}

    /**
     * 高対称点を結ぶ k パスを生成します。
     *
     * <p>
     * 各区間は始点を含み終点を含まない {@code n} 点で等分し、最後に終点を 1 点加えます。 区間数を L とすると全体は {@code n*L+1} 点です。
     * </p>
     *
     * @param highSymmetryPoints 高対称点です（2 点以上）
     * @param n 区間あたりの点数です（1 以上）
     * @return k 点の分数座標です
     */
    public static List<double[]> build(List<double[]> highSymmetryPoints, int n) {
        Preconditions.checkNotNull(highSymmetryPoints, "highSymmetryPoints は null 不可です");
        Preconditions.checkArgument(highSymmetryPoints.size() >= 2, "高対称点は 2 点以上が必要です");
        Preconditions.checkArgument(n >= 1, "n は 1 以上が必要です: %s", n);

        List<double[]> path = new ArrayList<>();
        for (int leg = 0; leg + 1 < highSymmetryPoints.size(); leg++) {
            double[] from = highSymmetryPoints.get(leg);
            double[] to = highSymmetryPoints.get(leg + 1);
            for (int j = 0; j < n; j++) {
                double t = j / (double) n;
                double[] k = new double[3];
                for (int c = 0; c < 3; c++) {
                    k[c] = from[c] + (to[c] - from[c]) * t;
                }
                path.add(k);
            }
        }
        path.add(highSymmetryPoints.get(highSymmetryPoints.size() - 1).clone());
        return path;
    }

    /**
     * 区間境界の点を複製して、各区間が両端を含む {@code n+1} 点を持つように並べ替えるインデックスを返します。
     *
     * <p>
     * 例えば 2 区間・n=2 なら {@code [0, 1, 2, 2, 3, 4]} です。
     * </p>
     *
     * @param legCount 区間数です（1 以上）
     * @param n 区間あたりの点数です（1 以上）
     * @return 元の k パスに対するインデックスです（長さ {@code (n+1)*legCount}）
     */
    public static int[] boundaryDuplicatedIndices(int legCount, int n) {
        Preconditions.checkArgument(legCount >= 1, "区間数は 1 以上が必要です: %s", legCount);
        Preconditions.checkArgument(n >= 1, "n は 1 以上が必要です: %s", n);

        int[] out = new int[(n + 1) * legCount];
        int next = 0;
        for (int leg = 0; leg < legCount; leg++) {
            for (int j = 0; j <= n; j++) {
                out[next++] = leg * n + j;
            }
        }
        return out;
    }
}
