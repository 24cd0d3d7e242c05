package io.github.yok.band.core.projection;

import com.google.common.base.Preconditions;
import io.github.yok.band.core.array.NdArray;

/**
 * 射影重み {@code [band][k][atom][orbital]} を保持するクラスです。
 *
 * <p>
 * 値は二乗済みの大きさで、すべて 0 以上です。生成後は変更しません。
 * </p>
 */
public final class ProjectionTensor {

    private final NdArray weights;

    /**
     * 射影重みを生成します。
     *
     * @param weights 形状 {@code (bands, k, atoms, orbitals)} の配列です（所有権を引き取ります）
     * @throws IllegalArgumentException 次元数が 4 でない場合、または負値・非有限値を含む場合に発生します
     */
    public ProjectionTensor(NdArray weights) {
        Preconditions.checkNotNull(weights, "weights は null 不可です");
        Preconditions.checkArgument(weights.rank() == 4, "射影重みは 4 次元が必要です: %s", weights);
        for (double w : weights.rawData()) {
            Preconditions.checkArgument(Double.isFinite(w) && w >= 0.0,
                    "射影重みは 0 以上の有限値が必要です: %s", w);
        }
        this.weights = weights;
    }

    public int bandCount() {
        return weights.dim(0);
    }

    public int kpointCount() {
        return weights.dim(1);
    }

    public int atomCount() {
        return weights.dim(2);
    }

    public int orbitalCount() {
        return weights.dim(3);
    }

    /**
     * 重みを返します。
     *
     * @param band バンドです
     * @param k k 点です
     * @param atom 原子です
     * @param orbital 軌道です
     * @return 重みです
     */
    public double weight(int band, int k, int atom, int orbital) {
        return weights.get(band, k, atom, orbital);
    }

    /**
     * 指定した k 点だけを指定順に並べた射影重みを返します。
     *
     * <p>
     * 展開したデータセットで、スーパーセルの k 点を展開後の k パスへ対応付けるときに使います。 同じ k 点を複数回指定しても構いません。
     * </p>
     *
     * @param kIndices 元の k 点インデックスです
     * @return 新しい射影重みです
     * @throws IndexOutOfBoundsException 範囲外のインデックスを含む場合に発生します
     */
    public ProjectionTensor takeKpoints(int[] kIndices) {
        Preconditions.checkNotNull(kIndices, "kIndices は null 不可です");
        int bands = bandCount();
        int atoms = atomCount();
        int orbitals = orbitalCount();
        int block = atoms * orbitals;
        NdArray out = NdArray.zeros(bands, kIndices.length, atoms, orbitals);
        double[] src = weights.rawData();
        double[] dst = out.rawData();
        for (int b = 0; b < bands; b++) {
            for (int j = 0; j < kIndices.length; j++) {
                int from = weights.offset(b, kIndices[j], 0, 0);
                System.arraycopy(src, from, dst, out.offset(b, j, 0, 0), block);
            }
        }
        return new ProjectionTensor(out);
    }
}
