package io.github.yok.band.core.array;

import com.google.common.base.Preconditions;
import java.util.Arrays;

/**
 * 形状と行優先（C 順）の double 配列を保持する多次元配列です。
 *
 * <p>
 * キャッシュに永続化する派生配列（マージ済み固有値、展開スペクトル、射影重み、スピン軸射影）の 共通表現として使います。
 * </p>
 */
public final class NdArray {

    /**
     * 各軸の長さです。
     */
    private final int[] shape;

    /**
     * 各軸のストライド（要素数単位）です。
     */
    private final int[] strides;

    /**
     * 行優先で並べた要素です。
     */
    private final double[] data;

    private NdArray(int[] shape, double[] data) {
        this.shape = shape;
        this.data = data;
        this.strides = new int[shape.length];
        int stride = 1;
        for (int axis = shape.length - 1; axis >= 0; axis--) {
            strides[axis] = stride;
            stride *= shape[axis];
        }
    }

    /**
     * ゼロ初期化した配列を生成します。
     *
     * @param shape 形状です（各軸 0 以上）
     * @return 配列です
     * @throws IllegalArgumentException 形状が不正な場合に発生します
     */
    public static NdArray zeros(int... shape) {
        return new NdArray(checkedShape(shape), new double[elementCount(shape)]);
    }

    /**
     * 既存の要素配列を包んで配列を生成します（コピーしません）。
     *
     * @param data 行優先の要素です
     * @param shape 形状です
     * @return 配列です
     * @throws IllegalArgumentException 要素数と形状が一致しない場合に発生します
     */
    public static NdArray wrap(double[] data, int... shape) {
        Preconditions.checkNotNull(data, "data は null 不可です");
        int[] copy = checkedShape(shape);
        Preconditions.checkArgument(data.length == elementCount(copy),
                "要素数と形状が一致しません: length=%s, shape=%s", data.length, Arrays.toString(copy));
        return new NdArray(copy, data);
    }

    private static int[] checkedShape(int[] shape) {
        Preconditions.checkNotNull(shape, "shape は null 不可です");
        for (int dim : shape) {
            Preconditions.checkArgument(dim >= 0, "shape に負の長さが含まれています: %s",
                    Arrays.toString(shape));
        }
        return shape.clone();
    }

    private static int elementCount(int[] shape) {
        long count = 1;
        for (int dim : shape) {
            count *= dim;
        }
        Preconditions.checkArgument(count <= Integer.MAX_VALUE, "要素数が大きすぎます: %s", count);
        return (int) count;
    }

    /**
     * 形状のコピーを返します。
     *
     * @return 形状です
     */
    public int[] shape() {
        return shape.clone();
    }

    /**
     * 次元数を返します。
     *
     * @return 次元数です
     */
    public int rank() {
        return shape.length;
    }

    /**
     * 指定軸の長さを返します。
     *
     * @param axis 軸です
     * @return 長さです
     */
    public int dim(int axis) {
        return shape[axis];
    }

    /**
     * 要素数を返します。
     *
     * @return 要素数です
     */
    public int size() {
        return data.length;
    }

    /**
     * 内部の要素配列をそのまま返します。
     *
     * <p>
     * 永続化と一括コピー専用です。呼び出し側で書き換えないでください。
     * </p>
     *
     * @return 行優先の要素です
     */
    public double[] rawData() {
        return data;
    }

    /**
     * 要素を返します。
     *
     * @param index 各軸のインデックスです
     * @return 要素です
     */
    public double get(int... index) {
        return data[offset(index)];
    }

    /**
     * 要素を設定します。
     *
     * @param value 値です
     * @param index 各軸のインデックスです
     */
    public void set(double value, int... index) {
        data[offset(index)] = value;
    }

    /**
     * 行優先での平坦インデックスを返します。
     *
     * @param index 各軸のインデックスです
     * @return 平坦インデックスです
     * @throws IndexOutOfBoundsException 範囲外の場合に発生します
     */
    public int offset(int... index) {
        if (index.length != shape.length) {
            throw new IndexOutOfBoundsException(
                    "インデックスの次元数が一致しません: " + index.length + " vs " + shape.length);
        }
        int off = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            int i = index[axis];
            if (i < 0 || i >= shape[axis]) {
                throw new IndexOutOfBoundsException(
                        "axis=" + axis + " のインデックスが範囲外です: " + i + " (長さ " + shape[axis] + ")");
            }
            off += i * strides[axis];
        }
        return off;
    }

    /**
     * 形状が一致するかを返します。
     *
     * @param expected 期待する形状です
     * @return 一致する場合は true です
     */
    public boolean hasShape(int... expected) {
        return Arrays.equals(shape, expected);
    }

    @Override
    public String toString() {
        return "NdArray" + Arrays.toString(shape);
    }
}
