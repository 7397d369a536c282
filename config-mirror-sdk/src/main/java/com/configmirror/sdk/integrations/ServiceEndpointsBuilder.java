package com.configmirror.sdk.integrations;

import com.configmirror.sdk.Components;
import com.configmirror.sdk.subsystems.ServiceEndpoints;

import java.net.URI;

/**
 * Contains methods for configuring the SDK's service URI.
 * <p>
 * The client needs to know where the config specs and ID list catalog endpoints live. ID list
 * content is fetched from whatever URL the catalog reports for each list, so it is not configured
 * here.
 * <pre><code>
 *     MirrorConfig config = new MirrorConfig.Builder()
 *         .serviceEndpoints(
 *             Components.serviceEndpoints().api("https://config.example.com/v1")
 *         )
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling
 * {@link Components#serviceEndpoints()}.
 */
public abstract class ServiceEndpointsBuilder {
    protected URI apiBaseUri;

    /**
     * Sets a custom base URI for the API endpoints.
     *
     * @param uri the base URI of the API
     * @return the builder
     */
    public ServiceEndpointsBuilder api(URI uri) {
        apiBaseUri = uri;
        return this;
    }

    /**
     * Equivalent to {@link #api(URI)}, specifying the URI as a string.
     *
     * @param uri the base URI of the API
     * @return the builder
     */
    public ServiceEndpointsBuilder api(String uri) {
        return api(URI.create(uri));
    }

    /**
     * Called internally by the SDK to create a configuration instance. Applications do not need
     * to call this method.
     *
     * @return the configuration object
     */
    public abstract ServiceEndpoints build();
}
