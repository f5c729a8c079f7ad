package io.github.yok.spectral.core.backend;

import io.github.yok.spectral.core.error.BackendUnavailableException;

/**
 * 外部ツールのセッションを提供するインタフェースです。
 */
@FunctionalInterface
public interface FittingToolSessionProvider {

    /**
     * セッションを開きます。
     *
     * @return セッションです
     * @throws BackendUnavailableException ツールが利用できない場合に発生します
     */
    FittingToolSession openSession();
}
