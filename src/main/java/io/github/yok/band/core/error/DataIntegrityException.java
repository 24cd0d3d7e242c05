package io.github.yok.band.core.error;

/**
 * 入力ファイルやキャッシュの内容が、期待する形状・順序の契約を満たさない場合に発生する例外です。
 *
 * <p>
 * キャッシュの形状不一致や破損を検知しても再計算へ黙ってフォールバックしません。
 * </p>
 */
public class DataIntegrityException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public DataIntegrityException(String message) {
        super(message);
    }

    /**
     * 原因付きで例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public DataIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
