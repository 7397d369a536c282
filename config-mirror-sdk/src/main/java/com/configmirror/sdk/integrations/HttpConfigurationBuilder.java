package com.configmirror.sdk.integrations;

import com.configmirror.sdk.Components;
import com.configmirror.sdk.MirrorConfig;
import com.configmirror.sdk.subsystems.ComponentConfigurer;
import com.configmirror.sdk.subsystems.HttpConfiguration;

/**
 * Contains methods for configuring the SDK's networking behavior.
 * <p>
 * If you want to set non-default values for any of these properties, create a builder with
 * {@link Components#httpConfiguration()}, change its properties with the methods of this class,
 * and pass it to {@link MirrorConfig.Builder#http(ComponentConfigurer)}:
 * <pre><code>
 *     MirrorConfig config = new MirrorConfig.Builder()
 *         .http(Components.httpConfiguration().connectTimeoutMillis(3000))
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#httpConfiguration()}.
 */
public abstract class HttpConfigurationBuilder implements ComponentConfigurer<HttpConfiguration> {
    /**
     * The default value for {@link #connectTimeoutMillis(int)}: ten seconds.
     */
    public static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 10_000;

    /**
     * The default value for {@link #socketTimeoutMillis(int)}: ten seconds.
     */
    public static final int DEFAULT_SOCKET_TIMEOUT_MILLIS = 10_000;

    protected int connectTimeoutMillis = DEFAULT_CONNECT_TIMEOUT_MILLIS;
    protected int socketTimeoutMillis = DEFAULT_SOCKET_TIMEOUT_MILLIS;
    protected String wrapperName;
    protected String wrapperVersion;

    /**
     * Sets the connection timeout.
     * <p>
     * The default is {@link #DEFAULT_CONNECT_TIMEOUT_MILLIS}.
     *
     * @param connectTimeoutMillis the connection timeout in milliseconds
     * @return the builder
     */
    public HttpConfigurationBuilder connectTimeoutMillis(int connectTimeoutMillis) {
        this.connectTimeoutMillis = connectTimeoutMillis <= 0 ? DEFAULT_CONNECT_TIMEOUT_MILLIS :
                connectTimeoutMillis;
        return this;
    }

    /**
     * Sets the read timeout for each request. ID list content can be large, so this may need to
     * be raised for slow links.
     * <p>
     * The default is {@link #DEFAULT_SOCKET_TIMEOUT_MILLIS}.
     *
     * @param socketTimeoutMillis the socket timeout in milliseconds
     * @return the builder
     */
    public HttpConfigurationBuilder socketTimeoutMillis(int socketTimeoutMillis) {
        this.socketTimeoutMillis = socketTimeoutMillis <= 0 ? DEFAULT_SOCKET_TIMEOUT_MILLIS :
                socketTimeoutMillis;
        return this;
    }

    /**
     * For use by wrapper libraries to set an identifying name for the wrapper being used. This will be included in a
     * header during requests to the server.
     *
     * @param wrapperName an identifying name for the wrapper library
     * @param wrapperVersion version string for the wrapper library
     * @return the builder
     */
    public HttpConfigurationBuilder wrapper(String wrapperName, String wrapperVersion) {
        this.wrapperName = wrapperName;
        this.wrapperVersion = wrapperVersion;
        return this;
    }
}
