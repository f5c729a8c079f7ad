package io.github.yok.spectral.core.backend;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.spectral.core.error.BackendUnavailableException;
import java.net.URL;
import java.net.URLClassLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ServiceLoaderSessionProviderTest {

    @Test
    @DisplayName("登録済みの FittingTool があればそのセッションを返す")
    void findsRegisteredTool() {
        ServiceLoaderSessionProvider provider =
                new ServiceLoaderSessionProvider(getClass().getClassLoader());
        assertNotNull(provider.openSession());
    }

    @Test
    @DisplayName("FittingTool が見つからない場合は BackendUnavailableException")
    void noToolInstalled() throws Exception {
        try (URLClassLoader empty = new URLClassLoader(new URL[0], null)) {
            ServiceLoaderSessionProvider provider = new ServiceLoaderSessionProvider(empty);
            assertThrows(BackendUnavailableException.class, provider::openSession);
        }
    }
}
