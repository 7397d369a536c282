package com.configmirror.sdk.subsystems;

import com.configmirror.sdk.ConfigMirrorClient;
import com.configmirror.sdk.MirrorConfig;
import com.launchdarkly.logging.LDLogger;

/**
 * Configuration information provided by the {@link ConfigMirrorClient} when it is creating
 * components.
 * <p>
 * The getter methods in this class provide information about the initial configuration of the
 * client. This includes properties from {@link MirrorConfig}, and also values that are computed
 * during initialization.
 */
public class ClientContext {
    private final String serverKey;
    private final LDLogger baseLogger;
    private final MirrorConfig config;
    private final HttpConfiguration http;
    private final ServiceEndpoints serviceEndpoints;

    /**
     * @param serverKey the server key
     * @param baseLogger the base logger
     * @param config the client configuration
     * @param http the HTTP configuration, or null if it has not been computed yet
     * @param serviceEndpoints the service endpoints
     */
    public ClientContext(
            String serverKey,
            LDLogger baseLogger,
            MirrorConfig config,
            HttpConfiguration http,
            ServiceEndpoints serviceEndpoints
    ) {
        this.serverKey = serverKey;
        this.baseLogger = baseLogger;
        this.config = config;
        this.http = http;
        this.serviceEndpoints = serviceEndpoints;
    }

    /**
     * Copy constructor.
     *
     * @param copyFrom the instance to copy from
     */
    protected ClientContext(ClientContext copyFrom) {
        this(copyFrom.serverKey, copyFrom.baseLogger, copyFrom.config, copyFrom.http,
                copyFrom.serviceEndpoints);
    }

    /**
     * The base logger for the SDK.
     * @return a logger instance
     */
    public LDLogger getBaseLogger() {
        return baseLogger;
    }

    /**
     * Returns the full configuration object.
     * @return the configuration
     */
    public MirrorConfig getConfig() {
        return config;
    }

    /**
     * Returns the HTTP configuration.
     * @return the HTTP configuration
     */
    public HttpConfiguration getHttp() {
        return http;
    }

    /**
     * Returns the configured server key.
     * @return the server key
     */
    public String getServerKey() {
        return serverKey;
    }

    /**
     * Returns the base service URI used by SDK components.
     * @return the service endpoint URI
     */
    public ServiceEndpoints getServiceEndpoints() {
        return serviceEndpoints;
    }
}
