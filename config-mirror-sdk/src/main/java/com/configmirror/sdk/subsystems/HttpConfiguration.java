package com.configmirror.sdk.subsystems;

import com.configmirror.sdk.integrations.HttpConfigurationBuilder;

import java.util.HashMap;
import java.util.Map;

import static java.util.Collections.emptyMap;

/**
 * Encapsulates top-level HTTP configuration that applies to all SDK components.
 * <p>
 * Use {@link HttpConfigurationBuilder} to construct an instance of this class.
 */
public final class HttpConfiguration {
    private final int connectTimeoutMillis;
    private final int socketTimeoutMillis;
    private final Map<String, String> defaultHeaders;

    /**
     * Creates an instance.
     *
     * @param connectTimeoutMillis see {@link #getConnectTimeoutMillis()}
     * @param socketTimeoutMillis see {@link #getSocketTimeoutMillis()}
     * @param defaultHeaders see {@link #getDefaultHeaders()}
     */
    public HttpConfiguration(
            int connectTimeoutMillis,
            int socketTimeoutMillis,
            Map<String, String> defaultHeaders
    ) {
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.socketTimeoutMillis = socketTimeoutMillis;
        this.defaultHeaders = defaultHeaders == null ? emptyMap() : new HashMap<>(defaultHeaders);
    }

    /**
     * The connection timeout. This is the time allowed for the underlying HTTP client to connect
     * to the server.
     *
     * @return the connection timeout in milliseconds
     */
    public int getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    /**
     * The read timeout for each request.
     *
     * @return the socket timeout in milliseconds
     */
    public int getSocketTimeoutMillis() {
        return socketTimeoutMillis;
    }

    /**
     * Returns the basic headers that should be added to all HTTP requests to the API endpoints.
     * These are not sent with ID list content requests.
     *
     * @return a list of HTTP header names and values
     */
    public Iterable<Map.Entry<String, String>> getDefaultHeaders() {
        return defaultHeaders.entrySet();
    }
}
