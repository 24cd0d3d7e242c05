package io.github.yok.band.core.reader;

import io.github.yok.band.core.structure.StructureInfo;
import java.util.List;
import lombok.Value;

/**
 * Reader が返す計算条件と構造のメタ情報です。
 *
 * <p>
 * 固有値本体の読み込みとは分離しており、キャッシュヒット時でもメタ情報だけは毎回読み込みます。
 * </p>
 */
@Value
public class BandMetadata {

    /**
     * 構造情報です。
     */
    StructureInfo structure;

    /**
     * スピン分極計算かどうかです。
     */
    boolean spinPolarized;

    /**
     * スピン軌道相互作用を含む計算かどうかです。
     */
    boolean spinOrbit;

    /**
     * ハイブリッド汎関数（重み 0 の k 点でバンドを評価する方式）かどうかです。
     */
    boolean hybridFunctional;

    /**
     * ライン形式の k 点指定です（通常計算のみ、それ以外は null）。
     */
    LineModeKPoints lineMode;

    /**
     * ハイブリッド汎関数計算で k 点と照合する高対称点の座標集合です（不要な場合は空）。
     */
    List<HighSymmetryPoint> symmetryPoints;
}
