package io.github.yok.band.core.reader;

import io.github.yok.band.core.array.NdArray;
import java.nio.file.Path;

/**
 * 第一原理計算の出力を読み込む Reader のインタフェースです。
 *
 * <p>
 * 生ファイル形式の解釈はこの境界の向こう側に閉じ込め、コア側は数値配列と構造メタ情報だけを扱います。 いずれのメソッドも、必須ファイルの欠落や数値の解釈失敗は
 * {@link io.github.yok.band.core.error.DataIntegrityException} で通知します。
 * </p>
 */
public interface BandDataReader {

    /**
     * 構造と計算条件のメタ情報を読み込みます。
     *
     * @param folder データセットのフォルダです
     * @return メタ情報です
     */
    BandMetadata readMetadata(Path folder);

    /**
     * フェルミエネルギーを読み込みます。
     *
     * @param folder フェルミエネルギーを含むフォルダです（SCF 計算のフォルダでも構いません）
     * @return フェルミエネルギー（eV）です
     */
    double readFermiEnergy(Path folder);

    /**
     * 全 k 点の固有値を読み込みます。
     *
     * @param folder データセットのフォルダです
     * @return 生の固有値です
     */
    RawEigenvalues readEigenvalues(Path folder);

    /**
     * 全 k 点の射影重みを読み込みます。
     *
     * @param folder データセットのフォルダです
     * @return 形状 {@code (bands, k, components, atoms, orbitals)} の符号付き射影成分です
     */
    NdArray readProjections(Path folder);

    /**
     * 全 k 点のスピン軸射影（全原子・全軌道の合計）を読み込みます。
     *
     * @param folder データセットのフォルダです
     * @return 形状 {@code (bands, k, components)} の符号付きスピン成分です
     */
    NdArray readSpinAxisProjections(Path folder);
}
