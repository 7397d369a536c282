package com.configmirror.sdk.subsystems;

import com.configmirror.sdk.integrations.ServiceEndpointsBuilder;

import java.net.URI;

/**
 * Specifies the base service URI used by SDK components.
 * <p>
 * See {@link ServiceEndpointsBuilder} for more details on this property.
 */
public final class ServiceEndpoints {
    private final URI apiBaseUri;

    /**
     * Used internally by the SDK to store service endpoints.
     * @param apiBaseUri the base URI for the config and ID list catalog endpoints
     */
    public ServiceEndpoints(URI apiBaseUri) {
        this.apiBaseUri = apiBaseUri;
    }

    /**
     * The base URI for the config and ID list catalog endpoints.
     * @return the base URI, or null
     */
    public URI getApiBaseUri() {
        return apiBaseUri;
    }
}
