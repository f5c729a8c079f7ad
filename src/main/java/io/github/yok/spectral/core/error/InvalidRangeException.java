package io.github.yok.spectral.core.error;

/**
 * エネルギーグリッドのパラメータが不正な場合に発生する例外です。
 *
 * <p>
 * {@code emax <= emin}、{@code nchan <= 0}、または非有限値が渡された場合に、構築時に発生します。
 * </p>
 */
public class InvalidRangeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public InvalidRangeException(String message) {
        super(message);
    }
}
