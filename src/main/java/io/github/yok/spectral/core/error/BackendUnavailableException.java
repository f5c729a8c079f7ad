package io.github.yok.spectral.core.error;

/**
 * 外部スペクトルフィッティングツールが利用できない場合に発生する例外です。
 */
public class BackendUnavailableException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public BackendUnavailableException(String message) {
        super(message);
    }

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
