package io.github.yok.band.core.dataset;

import com.google.common.base.Preconditions;
import io.github.yok.band.core.array.NdArray;
import io.github.yok.band.core.error.DataIntegrityException;
import io.github.yok.band.core.projection.ProjectionTensor;
import io.github.yok.band.core.projection.PseudoSpinSeparator;
import io.github.yok.band.core.reader.RawEigenvalues;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Reader の出力を正規化した配列へ変換するクラスです。
 *
 * <p>
 * キャッシュに保存する配列（スピン・軸の選択前）を組み立てる処理と、 キャッシュから読んだ配列に対してスピン・軸の選択を行う処理の両方を担います。 選択はキャッシュの後段でのみ行うため、ヒット時と再計算時で結果は一致します。
 * </p>
 */
@Slf4j
public final class RawDataAdapter {

    /**
     * マージ済み配列の末尾に置く k 点座標の列数です。
     */
    static final int KPOINT_COLUMNS = 3;

    /**
     * 重みが 0 の k 点のインデックスを昇順で返します。
     *
     * @param weights k 点の重みです
     * @return インデックスです
     */
    public int[] zeroWeightIndices(double[] weights) {
        Preconditions.checkNotNull(weights, "weights は null 不可です");
        int count = 0;
        for (double w : weights) {
            if (w == 0.0) {
                count++;
            }
        }
        int[] out = new int[count];
        int next = 0;
        for (int k = 0; k < weights.length; k++) {
            if (weights[k] == 0.0) {
                out[next++] = k;
            }
        }
        return out;
    }

    /**
     * 全スピンチャネルの固有値を k 点座標と連結した配列を作ります。
     *
     * <p>
     * 結果の形状は {@code (bands, k, 2*channels+3)} で、末尾軸はチャネルごとの（エネルギー, 占有数）に続けて kx, ky, kz
     * です。エネルギーはフェルミ補正前の値のまま保存します。ハイブリッド汎関数計算では重み 0 の k 点だけを残します。
     * </p>
     *
     * @param raw 生の固有値です
     * @param hybrid ハイブリッド汎関数計算の場合は true です
     * @return マージ済み配列です
     * @throws DataIntegrityException 残る k 点がない場合に発生します
     */
    public NdArray merge(RawEigenvalues raw, boolean hybrid) {
        Preconditions.checkNotNull(raw, "raw は null 不可です");

        int[] keep = hybrid ? zeroWeightIndices(raw.getKpointWeights())
                : allIndices(raw.kpointCount());
        if (keep.length == 0) {
            throw new DataIntegrityException("バンド計算の k 点がありません（ハイブリッド汎関数計算で重み 0 の k 点が見つかりません）");
        }

        int channels = raw.channelCount();
        int bands = raw.bandCount();
        int columns = 2 * channels + KPOINT_COLUMNS;
        NdArray merged = NdArray.zeros(bands, keep.length, columns);
        for (int b = 0; b < bands; b++) {
            for (int j = 0; j < keep.length; j++) {
                int k = keep[j];
                for (int c = 0; c < channels; c++) {
                    merged.set(raw.getEnergies().get(c)[k][b], b, j, 2 * c);
                    merged.set(raw.getOccupations().get(c)[k][b], b, j, 2 * c + 1);
                }
                for (int axis = 0; axis < KPOINT_COLUMNS; axis++) {
                    merged.set(raw.getKpoints()[k][axis], b, j, 2 * channels + axis);
                }
            }
        }
        if (hybrid) {
            log.info("重み 0 の k 点だけを残しました。{} / {}", keep.length, raw.kpointCount());
        }
        return merged;
    }

    /**
     * マージ済み配列のチャネル数を返します。
     *
     * @param merged マージ済み配列です
     * @return チャネル数（1 または 2）です
     * @throws DataIntegrityException 末尾軸の長さが不正な場合に発生します
     */
    public int mergedChannelCount(NdArray merged) {
        int columns = merged.dim(2) - KPOINT_COLUMNS;
        if (columns != 2 && columns != 4) {
            throw new DataIntegrityException("マージ済み固有値の末尾軸の長さが不正です: " + merged);
        }
        return columns / 2;
    }

    /**
     * マージ済み配列から 1 チャネル分の固有値を取り出し、フェルミ補正します。
     *
     * @param merged マージ済み配列です
     * @param channel チャネルです
     * @param efermi フェルミエネルギーです
     * @return {@code [band][k]} のフェルミ補正済み固有値です
     */
    public double[][] selectEigenvalues(NdArray merged, int channel, double efermi) {
        Preconditions.checkElementIndex(channel, mergedChannelCount(merged), "channel");
        Preconditions.checkArgument(Double.isFinite(efermi), "efermi は有限値が必要です: %s", efermi);
        int bands = merged.dim(0);
        int kpoints = merged.dim(1);
        double[][] out = new double[bands][kpoints];
        for (int b = 0; b < bands; b++) {
            for (int k = 0; k < kpoints; k++) {
                out[b][k] = merged.get(b, k, 2 * channel) - efermi;
            }
        }
        return out;
    }

    /**
     * マージ済み配列から k 点座標を取り出します。
     *
     * @param merged マージ済み配列です
     * @return {@code [k][3]} の分数座標です
     */
    public double[][] kpointsOf(NdArray merged) {
        int first = 2 * mergedChannelCount(merged);
        int kpoints = merged.dim(1);
        double[][] out = new double[kpoints][KPOINT_COLUMNS];
        if (merged.dim(0) == 0) {
            return out;
        }
        for (int k = 0; k < kpoints; k++) {
            for (int axis = 0; axis < KPOINT_COLUMNS; axis++) {
                out[k][axis] = merged.get(0, k, first + axis);
            }
        }
        return out;
    }

    /**
     * 第 2 軸（k 点）を指定インデックスで抜き出します。
     *
     * @param array 形状 {@code (bands, k, ...)} の配列です
     * @param keep 残す k 点のインデックスです
     * @return 新しい配列です
     * @throws DataIntegrityException インデックスが k 点軸の範囲外の場合に発生します
     */
    public NdArray filterKpoints(NdArray array, int[] keep) {
        Preconditions.checkNotNull(array, "array は null 不可です");
        Preconditions.checkArgument(array.rank() >= 2, "k 点軸がありません: %s", array);
        int[] shape = array.shape();
        int block = 1;
        for (int axis = 2; axis < shape.length; axis++) {
            block *= shape[axis];
        }
        for (int k : keep) {
            if (k < 0 || k >= shape[1]) {
                throw new DataIntegrityException(
                        "k 点のインデックスが範囲外です: " + k + "（k点数 " + shape[1] + "）: " + array);
            }
        }
        int[] outShape = shape.clone();
        outShape[1] = keep.length;
        NdArray out = NdArray.zeros(outShape);
        double[] src = array.rawData();
        double[] dst = out.rawData();
        for (int b = 0; b < shape[0]; b++) {
            for (int j = 0; j < keep.length; j++) {
                System.arraycopy(src, (b * shape[1] + keep[j]) * block, dst,
                        (b * keep.length + j) * block, block);
            }
        }
        return out;
    }

    /**
     * 展開結果から 1 チャネルを取り出し、フェルミ補正と区間境界の複製を行います。
     *
     * @param unfolded 形状 {@code (channels, 3, bands, kPath)} の展開結果です
     * @param channel チャネルです
     * @param efermi フェルミエネルギーです
     * @param pathIndices 区間境界を複製した k パスのインデックスです
     * @return 選択結果です
     * @throws DataIntegrityException 元の k インデックスが整数でない場合に発生します
     */
    public UnfoldedSelection selectUnfolded(NdArray unfolded, int channel, double efermi,
            int[] pathIndices) {
        Preconditions.checkElementIndex(channel, unfolded.dim(0), "channel");
        int bands = unfolded.dim(2);
        double[][] eigenvalues = new double[bands][pathIndices.length];
        double[][] weights = new double[bands][pathIndices.length];
        int[][] origin = new int[bands][pathIndices.length];
        for (int b = 0; b < bands; b++) {
            for (int j = 0; j < pathIndices.length; j++) {
                int k = pathIndices[j];
                eigenvalues[b][j] = unfolded.get(channel, 0, b, k) - efermi;
                weights[b][j] = unfolded.get(channel, 1, b, k);
                double index = unfolded.get(channel, 2, b, k);
                if (index != Math.rint(index) || index < 0) {
                    throw new DataIntegrityException("元の k インデックスが非負の整数ではありません: " + index);
                }
                origin[b][j] = (int) index;
            }
        }
        return new UnfoldedSelection(eigenvalues, weights, origin);
    }

    /**
     * 展開結果の選択です。
     */
    @Value
    public static class UnfoldedSelection {

        /**
         * フェルミ補正済みの固有値 {@code [band][k]} です。
         */
        double[][] eigenvalues;

        /**
         * スペクトル重み {@code [band][k]} です。
         */
        double[][] spectralWeights;

        /**
         * スーパーセルでの元の k インデックス {@code [band][k]} です。
         */
        int[][] originKIndices;
    }

    /**
     * 符号付き射影成分から 1 成分を選び、二乗した射影重みを作ります。
     *
     * <p>
     * {@code pseudoSpin} を指定した場合は、二乗する前に正負で擬スピンを分離し、指定した側だけを残します。
     * </p>
     *
     * @param projected 形状 {@code (bands, k, components, atoms, orbitals)} の配列です
     * @param component 成分番号です
     * @param pseudoSpin 擬スピン（分離しない場合は null）です
     * @return 射影重みです
     */
    public ProjectionTensor selectProjections(NdArray projected, int component, Spin pseudoSpin) {
        Preconditions.checkArgument(projected.rank() == 5, "射影成分は 5 次元が必要です: %s", projected);
        Preconditions.checkElementIndex(component, projected.dim(2), "component");
        int bands = projected.dim(0);
        int kpoints = projected.dim(1);
        int atoms = projected.dim(3);
        int orbitals = projected.dim(4);
        NdArray out = NdArray.zeros(bands, kpoints, atoms, orbitals);
        for (int b = 0; b < bands; b++) {
            for (int k = 0; k < kpoints; k++) {
                for (int a = 0; a < atoms; a++) {
                    for (int o = 0; o < orbitals; o++) {
                        double v = projected.get(b, k, component, a, o);
                        if (pseudoSpin != null) {
                            v = PseudoSpinSeparator.select(v, pseudoSpin);
                        }
                        out.set(v * v, b, k, a, o);
                    }
                }
            }
        }
        return new ProjectionTensor(out);
    }

    /**
     * スピン軸射影を擬スピンに分離し、両側を通した最大値で正規化したうえで指定側を返します。
     *
     * @param spinAxis 形状 {@code (bands, k, components)} の配列です
     * @param axis スピン軸です
     * @param spin 擬スピンです
     * @return {@code [band][k]} の 0 以上 1 以下の値です
     */
    public double[][] selectSpinAxis(NdArray spinAxis, SocAxis axis, Spin spin) {
        Preconditions.checkArgument(spinAxis.rank() == 3, "スピン軸射影は 3 次元が必要です: %s", spinAxis);
        Preconditions.checkElementIndex(axis.component(), spinAxis.dim(2), "component");
        int bands = spinAxis.dim(0);
        int kpoints = spinAxis.dim(1);

        double max = 0.0;
        for (int b = 0; b < bands; b++) {
            for (int k = 0; k < kpoints; k++) {
                max = Math.max(max, Math.abs(spinAxis.get(b, k, axis.component())));
            }
        }

        double[][] out = new double[bands][kpoints];
        if (max == 0.0) {
            log.warn("スピン軸射影がすべて 0 です。axis={}", axis);
            return out;
        }
        for (int b = 0; b < bands; b++) {
            for (int k = 0; k < kpoints; k++) {
                out[b][k] = PseudoSpinSeparator.select(spinAxis.get(b, k, axis.component()), spin)
                        / max;
            }
        }
        return out;
    }

    /**
     * 固有値に倍率を掛けます（その場で書き換えます）。
     *
     * @param eigenvalues {@code [band][k]} の固有値です
     * @param factor 倍率です
     */
    public void stretch(double[][] eigenvalues, double factor) {
        Preconditions.checkArgument(Double.isFinite(factor) && factor > 0.0,
                "stretch-factor は正の有限値が必要です: %s", factor);
        if (factor == 1.0) {
            return;
        }
        for (double[] band : eigenvalues) {
            for (int k = 0; k < band.length; k++) {
                band[k] *= factor;
            }
        }
    }

    private static int[] allIndices(int n) {
        int[] out = new int[n];
        for (int i = 0; i < n; i++) {
            out[i] = i;
        }
        return out;
    }
}
