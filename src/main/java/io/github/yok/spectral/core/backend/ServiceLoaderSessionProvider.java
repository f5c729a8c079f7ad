package io.github.yok.spectral.core.backend;

import io.github.yok.spectral.core.error.BackendUnavailableException;
import java.util.Iterator;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import lombok.extern.slf4j.Slf4j;

/**
 * クラスパス上の {@link FittingTool} 実装を {@link ServiceLoader} で探してセッションを開くプロバイダです。
 *
 * <p>
 * 最初に見つかった実装を使います。
 * </p>
 */
@Slf4j
public final class ServiceLoaderSessionProvider implements FittingToolSessionProvider {

    private final ClassLoader classLoader;

    /**
     * スレッドのコンテキストクラスローダで探すプロバイダを生成します。
     */
    public ServiceLoaderSessionProvider() {
        this(Thread.currentThread().getContextClassLoader());
    }

    /**
     * 指定クラスローダで探すプロバイダを生成します。
     *
     * @param classLoader クラスローダです
     */
    public ServiceLoaderSessionProvider(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public FittingToolSession openSession() {
        Iterator<FittingTool> it;
        FittingTool tool;
        try {
            it = ServiceLoader.load(FittingTool.class, classLoader).iterator();
            if (!it.hasNext()) {
                throw new BackendUnavailableException("外部フィッティングツールがインストールされていません");
            }
            tool = it.next();
        } catch (ServiceConfigurationError e) {
            throw new BackendUnavailableException("外部フィッティングツールを読み込めません", e);
        }
        log.info("外部フィッティングツールを使用します: {}", tool.name());
        return tool.openSession();
    }
}
