package com.configmirror.sdk;

import com.configmirror.sdk.subsystems.ClientContext;
import com.configmirror.sdk.subsystems.ErrorReporter;
import com.configmirror.sdk.subsystems.HttpConfiguration;
import com.launchdarkly.logging.LDLogger;

/**
 * This package-private subclass of {@link ClientContext} contains additional non-public SDK objects
 * that may be used by our internal components.
 * <p>
 * Components are built through {@link com.configmirror.sdk.subsystems.ComponentConfigurer}, which
 * only receives a {@link ClientContext}. Our own components call {@link #get(ClientContext)} to
 * reach the synchronizers and executor behind it. If those were never set, which only happens
 * when a component is built outside of {@link ConfigMirrorClient}, an unchecked exception is
 * thrown immediately.
 */
final class ClientContextImpl extends ClientContext {
    private final ConfigSpecSynchronizer configSpecSynchronizer;
    private final IdListSynchronizer idListSynchronizer;
    private final ErrorReporter errorReporter;
    private final TaskExecutor taskExecutor;

    ClientContextImpl(
            ClientContext base,
            ConfigSpecSynchronizer configSpecSynchronizer,
            IdListSynchronizer idListSynchronizer,
            ErrorReporter errorReporter,
            TaskExecutor taskExecutor
    ) {
        super(base);
        this.configSpecSynchronizer = configSpecSynchronizer;
        this.idListSynchronizer = idListSynchronizer;
        this.errorReporter = errorReporter;
        this.taskExecutor = taskExecutor;
    }

    /**
     * Builds the public part of the context, including the HTTP configuration, which itself needs
     * a context to be built.
     */
    static ClientContext baseFromConfig(MirrorConfig config, LDLogger logger) {
        ClientContext minimalContext = new ClientContext(config.getServerKey(), logger, config,
                null, config.serviceEndpoints);
        HttpConfiguration httpConfig = config.http.build(minimalContext);
        return new ClientContext(config.getServerKey(), logger, config, httpConfig,
                config.serviceEndpoints);
    }

    static ClientContextImpl get(ClientContext context) {
        if (context instanceof ClientContextImpl) {
            return (ClientContextImpl) context;
        }
        return new ClientContextImpl(context, null, null, null, null);
    }

    ConfigSpecSynchronizer getConfigSpecSynchronizer() {
        return throwExceptionIfNull(configSpecSynchronizer);
    }

    IdListSynchronizer getIdListSynchronizer() {
        return throwExceptionIfNull(idListSynchronizer);
    }

    ErrorReporter getErrorReporter() {
        return throwExceptionIfNull(errorReporter);
    }

    TaskExecutor getTaskExecutor() {
        return throwExceptionIfNull(taskExecutor);
    }

    private static <T> T throwExceptionIfNull(T o) {
        if (o == null) {
            throw new IllegalStateException(
                    "Attempted to use an SDK component without the necessary dependencies from ConfigMirrorClient;"
                    + " this should never happen unless an application has tried to construct the"
                    + " component directly outside of normal SDK usage"
            );
        }
        return o;
    }
}
