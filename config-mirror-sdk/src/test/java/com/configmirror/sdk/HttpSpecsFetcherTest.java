package com.configmirror.sdk;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.configmirror.sdk.subsystems.ClientContext;
import com.configmirror.sdk.subsystems.HttpConfiguration;
import com.configmirror.sdk.subsystems.ServiceEndpoints;
import com.launchdarkly.sdk.LDValue;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import java.net.URI;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

public class HttpSpecsFetcherTest {
    private static final String SERVER_KEY = "secret-server-key";
    private static final SdkMetadata METADATA = new SdkMetadata("config-mirror-java", "1.0.0", "session-1");

    private MockWebServer server;

    @Rule
    public LogCaptureRule logging = new LogCaptureRule();

    @Before
    public void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @After
    public void tearDown() throws Exception {
        server.shutdown();
    }

    private HttpSpecsFetcher makeFetcher(URI apiBaseUri) {
        MirrorConfig config = new MirrorConfig.Builder().serverKey(SERVER_KEY).build();
        ClientContext minimal = new ClientContext(SERVER_KEY, logging.logger, config, null,
                new ServiceEndpoints(apiBaseUri));
        HttpConfiguration http = Components.httpConfiguration().build(minimal);
        return new HttpSpecsFetcher(new ClientContext(SERVER_KEY, logging.logger, config, http,
                new ServiceEndpoints(apiBaseUri)), METADATA);
    }

    private HttpSpecsFetcher makeFetcher() {
        return makeFetcher(server.url("/v1").uri());
    }

    @Test
    public void configSpecsRequestIsAuthenticatedPost() throws Exception {
        String body = SpecsJson.snapshot(100).gates("g1").build();
        server.enqueue(new MockResponse().setBody(body));

        try (HttpSpecsFetcher fetcher = makeFetcher()) {
            assertEquals(body, fetcher.fetchConfigSpecs(42));
        }

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/v1/download_config_specs", request.getPath());
        assertEquals("api_key " + SERVER_KEY, request.getHeader("Authorization"));
        assertEquals(SdkUtil.USER_AGENT_HEADER_VALUE, request.getHeader("User-Agent"));
        LDValue sent = LDValue.parse(request.getBody().readUtf8());
        assertEquals(42, sent.get("sinceTime").longValue());
        assertEquals("config-mirror-java", sent.get("metadata").get("sdkType").stringValue());
        assertEquals("1.0.0", sent.get("metadata").get("sdkVersion").stringValue());
        assertEquals("session-1", sent.get("metadata").get("sessionID").stringValue());
    }

    @Test
    public void idListCatalogRequestIsPost() throws Exception {
        server.enqueue(new MockResponse().setBody("{}"));

        try (HttpSpecsFetcher fetcher = makeFetcher()) {
            assertEquals("{}", fetcher.fetchIdLists());
        }

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/v1/get_id_lists", request.getPath());
        LDValue sent = LDValue.parse(request.getBody().readUtf8());
        assertEquals("session-1", sent.get("metadata").get("sessionID").stringValue());
        assertTrue(sent.get("sinceTime").isNull());
    }

    @Test
    public void rangeRequestAsksForBytesFromOffsetWithoutServerKey() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(206).setBody("+ghi\n"));

        RangeResponse response;
        try (HttpSpecsFetcher fetcher = makeFetcher()) {
            response = fetcher.fetchRange(server.url("/lists/list_1").toString(), 14);
        }

        assertEquals("+ghi\n", response.getContent());
        assertEquals(5, response.getContentLength());
        RecordedRequest request = server.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("/lists/list_1", request.getPath());
        assertEquals("bytes=14-", request.getHeader("Range"));
        assertNull(request.getHeader("Authorization"));
        assertEquals(SdkUtil.USER_AGENT_HEADER_VALUE, request.getHeader("User-Agent"));
    }

    @Test
    public void unauthorizedResponseIsUnrecoverableFailure() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(401));

        try (HttpSpecsFetcher fetcher = makeFetcher()) {
            fetcher.fetchConfigSpecs(0);
            fail("expected exception");
        } catch (InvalidResponseCodeFailure e) {
            assertEquals(401, e.getResponseCode());
            assertFalse(e.isRetryable());
            assertEquals(SyncFailure.FailureType.UNEXPECTED_RESPONSE_CODE, e.getFailureType());
        }
        logging.assertErrorLogged("server key");
    }

    @Test
    public void serverErrorIsRecoverableFailure() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));

        try (HttpSpecsFetcher fetcher = makeFetcher()) {
            fetcher.fetchIdLists();
            fail("expected exception");
        } catch (InvalidResponseCodeFailure e) {
            assertEquals(503, e.getResponseCode());
            assertTrue(e.isRetryable());
        }
    }

    @Test
    public void rangeErrorStatusIsFailure() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));

        try (HttpSpecsFetcher fetcher = makeFetcher()) {
            fetcher.fetchRange(server.url("/lists/missing").toString(), 0);
            fail("expected exception");
        } catch (InvalidResponseCodeFailure e) {
            assertEquals(404, e.getResponseCode());
        }
    }

    @Test
    public void connectionFailureIsNetworkFailure() throws Exception {
        MockWebServer deadServer = new MockWebServer();
        deadServer.start();
        URI deadUri = deadServer.url("/v1").uri();
        deadServer.shutdown();

        try (HttpSpecsFetcher fetcher = makeFetcher(deadUri)) {
            fetcher.fetchConfigSpecs(0);
            fail("expected exception");
        } catch (SyncFailure e) {
            assertEquals(SyncFailure.FailureType.NETWORK_FAILURE, e.getFailureType());
        }
    }

    @Test
    public void invalidRangeUrlIsFailure() {
        try (HttpSpecsFetcher fetcher = makeFetcher()) {
            fetcher.fetchRange("not a url", 0);
            fail("expected exception");
        } catch (SyncFailure e) {
            assertEquals(SyncFailure.FailureType.INVALID_RESPONSE_BODY, e.getFailureType());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void apiBaseUriIsRequired() {
        makeFetcher(null);
    }

    @Test
    public void parseContentLength() {
        assertEquals(14, HttpSpecsFetcher.parseContentLength("14"));
        assertEquals(14, HttpSpecsFetcher.parseContentLength(" 14 "));
        assertEquals(-1, HttpSpecsFetcher.parseContentLength(null));
        assertEquals(-1, HttpSpecsFetcher.parseContentLength("abc"));
    }
}
