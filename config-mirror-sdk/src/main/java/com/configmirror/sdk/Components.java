package com.configmirror.sdk;

import com.configmirror.sdk.integrations.HttpConfigurationBuilder;
import com.configmirror.sdk.integrations.PollingDataSourceBuilder;
import com.configmirror.sdk.integrations.ServiceEndpointsBuilder;
import com.configmirror.sdk.subsystems.ComponentConfigurer;

/**
 * Provides configurable factories for the standard implementations of SDK component interfaces.
 * <p>
 * Some of the configuration options in {@link MirrorConfig.Builder} affect the entire SDK, but
 * others are specific to one area of functionality, such as polling or networking. For the latter,
 * call one of the static methods here, apply any desired configuration to the object it returns,
 * and pass that object to the corresponding method in {@link MirrorConfig.Builder}.
 */
public abstract class Components {
    private Components() {}

    /**
     * Returns a configuration builder for the SDK's networking configuration.
     * <p>
     * Passing this to {@link MirrorConfig.Builder#http(ComponentConfigurer)} applies this
     * configuration to all HTTP requests made by the SDK.
     * <pre><code>
     *     MirrorConfig config = new MirrorConfig.Builder()
     *         .http(
     *              Components.httpConfiguration()
     *                  .connectTimeoutMillis(3000)
     *                  .socketTimeoutMillis(30_000)
     *         )
     *         .build();
     * </code></pre>
     *
     * @return a factory object
     * @see MirrorConfig.Builder#http(ComponentConfigurer)
     */
    public static HttpConfigurationBuilder httpConfiguration() {
        return new ComponentsImpl.HttpConfigurationBuilderImpl();
    }

    /**
     * Returns a configuration builder for the polling data source.
     * <p>
     * Passing this to {@link MirrorConfig.Builder#dataSource(ComponentConfigurer)}, after setting
     * any desired properties on the builder, applies this configuration to the SDK.
     * <pre><code>
     *     MirrorConfig config = new MirrorConfig.Builder()
     *         .dataSource(
     *              Components.pollingDataSource()
     *                  .configSyncIntervalMillis(30_000)
     *                  .idListSyncIntervalMillis(300_000)
     *         )
     *         .build();
     * </code></pre>
     *
     * @return a builder for setting polling properties
     * @see MirrorConfig.Builder#dataSource(ComponentConfigurer)
     */
    public static PollingDataSourceBuilder pollingDataSource() {
        return new ComponentsImpl.PollingDataSourceBuilderImpl();
    }

    /**
     * Returns a builder for configuring custom service URIs.
     * <p>
     * Passing this to {@link MirrorConfig.Builder#serviceEndpoints(ServiceEndpointsBuilder)},
     * after setting any desired properties on the builder, applies this configuration to the SDK.
     *
     * @return a builder object
     * @see MirrorConfig.Builder#serviceEndpoints(ServiceEndpointsBuilder)
     */
    public static ServiceEndpointsBuilder serviceEndpoints() {
        return new ComponentsImpl.ServiceEndpointsBuilderImpl();
    }
}
