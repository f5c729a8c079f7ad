package io.github.yok.spectral.core.backend;

/**
 * {@link java.util.ServiceLoader} で検出する外部フィッティングツールの実装です。
 *
 * <p>
 * 実装は {@code META-INF/services/io.github.yok.spectral.core.backend.FittingTool} に登録します。
 * </p>
 */
public interface FittingTool {

    /**
     * ツール名を返します。
     *
     * @return ツール名です
     */
    String name();

    /**
     * セッションを開きます。
     *
     * @return セッションです
     */
    FittingToolSession openSession();
}
