package io.github.yok.band.core.reader;

import java.util.List;
import lombok.Value;

/**
 * ライン形式の k 点指定（通常計算）を表すクラスです。
 *
 * <p>
 * 高対称点は始点・終点のペアで並び、各ペアの間に {@code divisions} 個の k 点が 両端を含めて生成されている前提です。
 * </p>
 */
@Value
public class LineModeKPoints {

    /**
     * 1 区間あたりの k 点数（両端を含む）です。
     */
    int divisions;

    /**
     * 始点・終点のペアで並んだ高対称点です（偶数長）。
     */
    List<HighSymmetryPoint> points;
}
