package com.configmirror.sdk;

import com.configmirror.sdk.subsystems.ClientContext;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.sdk.LDValue;
import com.launchdarkly.sdk.internal.http.HttpHelpers;
import com.launchdarkly.sdk.internal.http.HttpProperties;

import java.io.IOException;
import java.net.URI;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@link SpecsFetcher} that talks to the server over HTTP with OkHttp.
 * <p>
 * API requests are POSTs carrying the SDK metadata and the configured default headers, which
 * include the server key. Content requests go to the URL given in the ID list catalog, which is
 * usually a CDN, so they carry only the user agent and the range header.
 */
final class HttpSpecsFetcher implements SpecsFetcher {
    static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final URI apiBaseUri;
    private final SdkMetadata metadata;
    private final HttpProperties httpProperties;
    private final OkHttpClient client;
    private final LDLogger logger;

    HttpSpecsFetcher(ClientContext clientContext, SdkMetadata metadata) {
        this.apiBaseUri = clientContext.getServiceEndpoints().getApiBaseUri();
        if (apiBaseUri == null) {
            throw new IllegalStateException("an API base URI must be configured with MirrorConfig.Builder.serviceEndpoints()");
        }
        this.metadata = metadata;
        this.httpProperties = SdkUtil.makeHttpProperties(clientContext.getHttp());
        this.logger = clientContext.getBaseLogger().subLogger("Http");
        this.client = httpProperties.toHttpClientBuilder()
                .retryOnConnectionFailure(true)
                .build();
    }

    @Override
    public String fetchConfigSpecs(long sinceTime) throws SyncFailure {
        LDValue body = LDValue.buildObject()
                .put("sinceTime", sinceTime)
                .put("metadata", metadataValue())
                .build();
        return post(StandardEndpoints.CONFIG_SPECS_PATH, body);
    }

    @Override
    public String fetchIdLists() throws SyncFailure {
        LDValue body = LDValue.buildObject()
                .put("metadata", metadataValue())
                .build();
        return post(StandardEndpoints.ID_LISTS_PATH, body);
    }

    @Override
    public RangeResponse fetchRange(String url, long offset) throws SyncFailure {
        final Request request;
        try {
            request = new Request.Builder().url(url)
                    .header("User-Agent", SdkUtil.USER_AGENT_HEADER_VALUE)
                    .header("Range", "bytes=" + offset + "-")
                    // transparent gzip would strip Content-Length, which we need
                    .header("Accept-Encoding", "identity")
                    .build();
        } catch (IllegalArgumentException e) {
            throw new SyncFailure("Invalid ID list URL: " + url, e, SyncFailure.FailureType.INVALID_RESPONSE_BODY);
        }

        logger.debug("Fetching ID list content: {} from offset {}", url, offset);
        try (Response response = client.newCall(request).execute()) {
            String body = readBody(response);
            if (!response.isSuccessful()) {
                throw new InvalidResponseCodeFailure("Unexpected response when fetching ID list: " + response +
                        " using url: " + url, response.code(), SdkUtil.isHttpErrorRecoverable(response.code()));
            }
            return new RangeResponse(body, parseContentLength(response.header("Content-Length")));
        } catch (IOException e) {
            throw new SyncFailure("Exception while fetching ID list content", e, SyncFailure.FailureType.NETWORK_FAILURE);
        }
    }

    @Override
    public void close() {
        HttpProperties.shutdownHttpClient(client);
    }

    private String post(String path, LDValue payload) throws SyncFailure {
        URI uri = HttpHelpers.concatenateUriPath(apiBaseUri, path);
        final Request request;
        try {
            request = new Request.Builder().url(uri.toURL())
                    .headers(httpProperties.toHeadersBuilder().build())
                    .post(RequestBody.create(payload.toJsonString(), JSON))
                    .build();
        } catch (IOException e) {
            throw new SyncFailure("Unexpected error in constructing request", e, SyncFailure.FailureType.UNKNOWN_ERROR);
        }

        logger.debug("Requesting {}", request.url());
        try (Response response = client.newCall(request).execute()) {
            String body = readBody(response);
            if (!response.isSuccessful()) {
                if (response.code() == 401 || response.code() == 403) {
                    logger.error("Received {} response; check that the server key is valid", response.code());
                }
                throw new InvalidResponseCodeFailure("Unexpected response when requesting " + path + ": " +
                        response + " with body: " + body, response.code(),
                        SdkUtil.isHttpErrorRecoverable(response.code()));
            }
            return body;
        } catch (IOException e) {
            throw new SyncFailure("Exception while requesting " + path, e, SyncFailure.FailureType.NETWORK_FAILURE);
        }
    }

    private LDValue metadataValue() {
        return LDValue.buildObject()
                .put("sdkType", metadata.getSdkType())
                .put("sdkVersion", metadata.getSdkVersion())
                .put("sessionID", metadata.getSessionID())
                .build();
    }

    private static String readBody(Response response) throws IOException {
        ResponseBody responseBody = response.body();
        return responseBody == null ? "" : responseBody.string();
    }

    static long parseContentLength(String header) {
        if (header == null) {
            return -1;
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
