package io.github.yok.band.core.cache;

import io.github.yok.band.core.array.NdArray;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 計算コストの高い派生配列を、データセットのフォルダ単位で永続化するキャッシュです。
 *
 * <p>
 * ヒットした配列は正として扱い、再計算を行いません。破損や形状不一致は
 * {@link io.github.yok.band.core.error.DataIntegrityException} として通知し、再計算へフォールバックしません。
 * </p>
 */
public interface DerivedDataCache {

    /**
     * キャッシュを読み込みます。
     *
     * @param folder データセットのフォルダです
     * @param kind 派生配列の種類です
     * @return キャッシュがあれば配列、なければ空です
     */
    Optional<NdArray> load(Path folder, DerivedKind kind);

    /**
     * キャッシュを書き込みます。
     *
     * <p>
     * 同じ（フォルダ, 種類）への書き込みはプロセス内で高々 1 回です。
     * </p>
     *
     * @param folder データセットのフォルダです
     * @param kind 派生配列の種類です
     * @param array 配列です
     */
    void store(Path folder, DerivedKind kind, NdArray array);
}
