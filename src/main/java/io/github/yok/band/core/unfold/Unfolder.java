package io.github.yok.band.core.unfold;

import io.github.yok.band.core.array.NdArray;
import java.nio.file.Path;

/**
 * スーパーセルの波動関数を基本セルのスペクトル重みへ展開する外部コンポーネントのインタフェースです。
 *
 * <p>
 * 数値アルゴリズム本体はこの境界の外にあり、データセットごとに一度だけ呼び出されます。
 * </p>
 */
public interface Unfolder {

    /**
     * 指定 k パスに沿ってバンドを展開します。
     *
     * @param folder 波動関数を含むデータセットのフォルダです
     * @param request 展開の依頼内容です
     * @return 形状 {@code (spinChannels, 3, bands, kpoints)} の配列です。第 2 軸は（固有値、スペクトル重み、元の k インデックス）の順です
     */
    NdArray unfold(Path folder, UnfoldRequest request);
}
