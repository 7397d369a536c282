package com.configmirror.sdk;

import com.configmirror.sdk.integrations.HttpConfigurationBuilder;
import com.configmirror.sdk.integrations.PollingDataSourceBuilder;
import com.configmirror.sdk.integrations.ServiceEndpointsBuilder;
import com.configmirror.sdk.subsystems.ClientContext;
import com.configmirror.sdk.subsystems.DataSource;
import com.configmirror.sdk.subsystems.ErrorReporter;
import com.configmirror.sdk.subsystems.HttpConfiguration;
import com.configmirror.sdk.subsystems.ServiceEndpoints;
import com.launchdarkly.logging.LDLogger;

import java.util.HashMap;
import java.util.Map;

/**
 * This class contains the package-private implementations of component factories and builders whose
 * public factory methods are in {@link Components}.
 */
abstract class ComponentsImpl {
    private ComponentsImpl() {
    }

    /**
     * Default {@link ErrorReporter}: a summary at error level, and the stack trace at debug level.
     */
    static final class LoggingErrorReporter implements ErrorReporter {
        private final LDLogger logger;

        LoggingErrorReporter(LDLogger logger) {
            this.logger = logger;
        }

        @Override
        public void reportException(Throwable error) {
            SdkUtil.logExceptionAtErrorLevel(logger, error, "Sync failed");
        }
    }

    static final class HttpConfigurationBuilderImpl extends HttpConfigurationBuilder {
        @Override
        public HttpConfiguration build(ClientContext clientContext) {
            // Build the default headers
            Map<String, String> headers = new HashMap<>();
            if (clientContext.getServerKey() != null) {
                headers.put("Authorization", SdkUtil.AUTH_SCHEME + clientContext.getServerKey());
            }
            headers.put("User-Agent", SdkUtil.USER_AGENT_HEADER_VALUE);
            headers.put("Content-Type", "application/json");
            if (wrapperName != null) {
                String wrapperId = wrapperVersion == null ? wrapperName : (wrapperName + "/" + wrapperVersion);
                headers.put("X-ConfigMirror-Wrapper", wrapperId);
            }

            return new HttpConfiguration(
                    connectTimeoutMillis,
                    socketTimeoutMillis,
                    headers
            );
        }
    }

    static final class PollingDataSourceBuilderImpl extends PollingDataSourceBuilder {
        @Override
        public DataSource build(ClientContext clientContext) {
            ClientContextImpl clientContextImpl = ClientContextImpl.get(clientContext);
            return new PollingDataSource(
                    clientContextImpl.getConfigSpecSynchronizer(),
                    clientContextImpl.getIdListSynchronizer(),
                    configSyncIntervalMillis,
                    idListSyncIntervalMillis,
                    clientContextImpl.getTaskExecutor(),
                    clientContextImpl.getErrorReporter(),
                    clientContext.getBaseLogger().subLogger("DataSource")
            );
        }
    }

    static final class ServiceEndpointsBuilderImpl extends ServiceEndpointsBuilder {
        @Override
        public ServiceEndpoints build() {
            // There is no public default for the API; a missing URI is reported when the
            // HTTP fetcher is created.
            return new ServiceEndpoints(apiBaseUri);
        }
    }
}
