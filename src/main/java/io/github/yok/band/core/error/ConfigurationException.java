package io.github.yok.band.core.error;

/**
 * 利用者が指定した設定値（カスタム k パス、軌道・原子・元素の選択子、SOC 軸など）が データセットと矛盾する場合に発生する例外です。
 *
 * <p>
 * 同じ入力で再実行しても結果は変わらないため、リトライせずに即座に呼び出し元へ伝播させます。
 * </p>
 */
public class ConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * 原因付きで例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
