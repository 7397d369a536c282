package com.configmirror.sdk;

import com.configmirror.sdk.integrations.ServiceEndpointsBuilder;
import com.configmirror.sdk.subsystems.ComponentConfigurer;
import com.configmirror.sdk.subsystems.DataSource;
import com.configmirror.sdk.subsystems.ErrorReporter;
import com.configmirror.sdk.subsystems.HttpConfiguration;
import com.configmirror.sdk.subsystems.ServiceEndpoints;
import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.Logs;

/**
 * This class exposes advanced configuration options for {@link ConfigMirrorClient}.
 * <p>
 * Instances of {@link MirrorConfig} are immutable once created. They can be created with the
 * constructor {@link MirrorConfig.Builder}.
 */
public class MirrorConfig {
    /**
     * The default value for {@link Builder#idListFetchConcurrency(int)}.
     */
    public static final int DEFAULT_ID_LIST_FETCH_CONCURRENCY = 8;

    static final LDLogLevel DEFAULT_LOG_LEVEL = LDLogLevel.INFO;

    private final String serverKey;

    final ServiceEndpoints serviceEndpoints;

    final ComponentConfigurer<DataSource> dataSource;
    final ComponentConfigurer<HttpConfiguration> http;

    private final String bootstrapValues;
    private final RulesUpdatedCallback rulesUpdatedCallback;
    private final ErrorReporter errorReporter;
    private final int idListFetchConcurrency;
    private final LDLogAdapter logAdapter;
    private final String loggerName;

    MirrorConfig(String serverKey,
                 ServiceEndpoints serviceEndpoints,
                 ComponentConfigurer<DataSource> dataSource,
                 ComponentConfigurer<HttpConfiguration> http,
                 String bootstrapValues,
                 RulesUpdatedCallback rulesUpdatedCallback,
                 ErrorReporter errorReporter,
                 int idListFetchConcurrency,
                 LDLogAdapter logAdapter,
                 String loggerName) {
        this.serverKey = serverKey;
        this.serviceEndpoints = serviceEndpoints;
        this.dataSource = dataSource;
        this.http = http;
        this.bootstrapValues = bootstrapValues;
        this.rulesUpdatedCallback = rulesUpdatedCallback;
        this.errorReporter = errorReporter;
        this.idListFetchConcurrency = idListFetchConcurrency;
        this.logAdapter = logAdapter;
        this.loggerName = loggerName;
    }

    /**
     * @return the server key used to authenticate API requests
     */
    public String getServerKey() {
        return serverKey;
    }

    /**
     * @return the bootstrap values, or null if none were configured
     */
    public String getBootstrapValues() {
        return bootstrapValues;
    }

    /**
     * @return the callback for committed config snapshots, or null
     */
    public RulesUpdatedCallback getRulesUpdatedCallback() {
        return rulesUpdatedCallback;
    }

    /**
     * @return the configured error reporter, or null to use the default logging reporter
     */
    public ErrorReporter getErrorReporter() {
        return errorReporter;
    }

    /**
     * @return the maximum number of ID list content fetches that run at once
     */
    public int getIdListFetchConcurrency() {
        return idListFetchConcurrency;
    }

    LDLogAdapter getLogAdapter() { return logAdapter; }

    String getLoggerName() { return loggerName; }

    /**
     * A <a href="http://en.wikipedia.org/wiki/Builder_pattern">builder</a> that helps construct
     * {@link MirrorConfig} objects. Builder calls can be chained, enabling the following pattern:
     * <pre>
     * MirrorConfig config = new MirrorConfig.Builder()
     *          .serverKey("server-key")
     *          .serviceEndpoints(Components.serviceEndpoints().api("https://config.example.com/v1"))
     *          .build();
     * </pre>
     */
    public static class Builder {
        private String serverKey;

        private ServiceEndpointsBuilder serviceEndpointsBuilder;

        private ComponentConfigurer<DataSource> dataSource = null;
        private ComponentConfigurer<HttpConfiguration> http = null;

        private String bootstrapValues;
        private RulesUpdatedCallback rulesUpdatedCallback;
        private ErrorReporter errorReporter;
        private int idListFetchConcurrency = DEFAULT_ID_LIST_FETCH_CONCURRENCY;

        private LDLogAdapter logAdapter = defaultLogAdapter();
        private String loggerName = SdkPackageConsts.DEFAULT_LOGGER_NAME;
        private LDLogLevel logLevel = null;

        /**
         * Sets the key for authenticating with the server. It is sent in the {@code Authorization}
         * header of API requests, and never to ID list content hosts.
         *
         * @param serverKey the server key
         * @return the builder
         */
        public Builder serverKey(String serverKey) {
            this.serverKey = serverKey;
            return this;
        }

        /**
         * Sets the base service URI used by SDK components. There is no default; a client that
         * fetches over HTTP must have one.
         *
         * @param serviceEndpointsBuilder a configuration builder object returned by {@link Components#serviceEndpoints()}
         * @return the builder
         */
        public Builder serviceEndpoints(ServiceEndpointsBuilder serviceEndpointsBuilder) {
            this.serviceEndpointsBuilder = serviceEndpointsBuilder;
            return this;
        }

        /**
         * Sets the configuration of the component that polls the server.
         * <p>
         * The default is {@link Components#pollingDataSource()} with default intervals.
         *
         * @param dataSourceConfigurer the data source configuration builder
         * @return the builder
         * @see Components#pollingDataSource()
         */
        public Builder dataSource(ComponentConfigurer<DataSource> dataSourceConfigurer) {
            this.dataSource = dataSourceConfigurer;
            return this;
        }

        /**
         * Sets the SDK's networking configuration, using a configuration builder obtained from
         * {@link Components#httpConfiguration()}.
         *
         * @param httpConfigurer the HTTP configuration builder
         * @return the builder
         * @see Components#httpConfiguration()
         */
        public Builder http(ComponentConfigurer<HttpConfiguration> httpConfigurer) {
            this.http = httpConfigurer;
            return this;
        }

        /**
         * Supplies config data, in the same JSON format as the server's config specs response,
         * for the client to serve before its first successful sync. Values that cannot be parsed
         * are logged and ignored.
         *
         * @param bootstrapValues the JSON data, or null for none
         * @return the builder
         */
        public Builder bootstrapValues(String bootstrapValues) {
            this.bootstrapValues = bootstrapValues;
            return this;
        }

        /**
         * Sets a callback to be told about every config snapshot committed from the server.
         *
         * @param rulesUpdatedCallback the callback, or null for none
         * @return the builder
         */
        public Builder rulesUpdatedCallback(RulesUpdatedCallback rulesUpdatedCallback) {
            this.rulesUpdatedCallback = rulesUpdatedCallback;
            return this;
        }

        /**
         * Sets the destination for sync failures. By default they are logged at error level.
         *
         * @param errorReporter the error reporter, or null for the default
         * @return the builder
         */
        public Builder errorReporter(ErrorReporter errorReporter) {
            this.errorReporter = errorReporter;
            return this;
        }

        /**
         * Sets how many ID list content fetches may run at once. Values less than 1 restore the
         * default of {@link #DEFAULT_ID_LIST_FETCH_CONCURRENCY}.
         *
         * @param idListFetchConcurrency the number of worker threads for ID list fetches
         * @return the builder
         */
        public Builder idListFetchConcurrency(int idListFetchConcurrency) {
            this.idListFetchConcurrency = idListFetchConcurrency < 1 ?
                    DEFAULT_ID_LIST_FETCH_CONCURRENCY : idListFetchConcurrency;
            return this;
        }

        /**
         * Specifies the implementation of logging to use.
         * <p>
         * The <a href="https://github.com/launchdarkly/java-logging"><code>com.launchdarkly.logging</code></a>
         * API defines the {@link LDLogAdapter} interface to specify where log output should be sent.
         * The default is {@link Logs#basic()}, which writes to standard error. To send output to
         * SLF4J or another framework, use the matching adapter from that library.
         *
         * @param logAdapter an {@link LDLogAdapter} for the desired logging implementation
         * @return the builder
         * @see #logLevel(LDLogLevel)
         * @see #loggerName(String)
         */
        public Builder logAdapter(LDLogAdapter logAdapter) {
            this.logAdapter = logAdapter == null ? defaultLogAdapter() : logAdapter;
            return this;
        }

        /**
         * Specifies the lowest level of logging to enable.
         * <p>
         * The default is {@link LDLogLevel#INFO}, meaning that {@code INFO}, {@code WARN}, and
         * {@code ERROR} levels are enabled, but {@code DEBUG} is disabled.
         *
         * @param logLevel the lowest level of logging to enable
         * @return the builder
         * @see #logAdapter(LDLogAdapter)
         */
        public Builder logLevel(LDLogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        /**
         * Specifies a custom logger name for the SDK. If not specified, the default is
         * "ConfigMirror".
         *
         * @param loggerName the logger name
         * @return the builder
         */
        public Builder loggerName(String loggerName) {
            this.loggerName = loggerName == null ? SdkPackageConsts.DEFAULT_LOGGER_NAME : loggerName;
            return this;
        }

        private static LDLogAdapter defaultLogAdapter() {
            return Logs.basic();
        }

        /**
         * Returns the configured {@link MirrorConfig} object.
         * @return the configuration
         */
        public MirrorConfig build() {
            LDLogAdapter actualLogAdapter = Logs.level(logAdapter,
                    logLevel == null ? DEFAULT_LOG_LEVEL : logLevel);

            ServiceEndpoints serviceEndpoints =
                    (serviceEndpointsBuilder == null ? Components.serviceEndpoints() :
                            serviceEndpointsBuilder)
                            .build();

            return new MirrorConfig(
                    serverKey,
                    serviceEndpoints,
                    this.dataSource == null ? Components.pollingDataSource() : this.dataSource,
                    this.http == null ? Components.httpConfiguration() : this.http,
                    bootstrapValues,
                    rulesUpdatedCallback,
                    errorReporter,
                    idListFetchConcurrency,
                    actualLogAdapter,
                    loggerName);
        }
    }
}
