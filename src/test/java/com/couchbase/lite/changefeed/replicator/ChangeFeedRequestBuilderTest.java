package com.couchbase.lite.changefeed.replicator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.couchbase.lite.changefeed.auth.Authorizer;
import com.couchbase.lite.changefeed.auth.BasicAuthorizer;
import com.couchbase.lite.changefeed.support.TLSSettings;
import com.couchbase.lite.changefeed.websocket.HandshakeRequest;
import java.net.URL;
import java.util.HashMap;
import java.util.Map;
import okhttp3.Request;
import org.apache.http.client.CookieStore;
import org.apache.http.impl.client.BasicCookieStore;
import org.apache.http.impl.cookie.BasicClientCookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChangeFeedRequestBuilderTest {

    private URL feedURL;
    private CookieStore cookieStore;

    @BeforeEach
    void setUp() throws Exception {
        feedURL = new URL("http://sync.example.com:4984/db/_changes?feed=websocket");
        cookieStore = new BasicCookieStore();
        BasicClientCookie session = new BasicClientCookie("SyncGatewaySession", "abc123");
        session.setDomain("sync.example.com");
        session.setPath("/db");
        cookieStore.addCookie(session);
    }

    @Test
    void timeoutIsOneAndAHalfHeartbeats() {
        HandshakeRequest request = ChangeFeedRequestBuilder.build(feedURL, null, null, null, 30_000, null);

        assertEquals(45_000, request.getTimeoutMillis());
    }

    @Test
    void requestIsAGetOfTheFeedURL() {
        HandshakeRequest request = ChangeFeedRequestBuilder.build(feedURL, null, null, null, 30_000, null);

        assertEquals("GET", request.getRequest().method());
        assertEquals(feedURL.toExternalForm(), request.getURL().toExternalForm());
        assertEquals("websocket", request.getRequest().url().queryParameter("feed"));
    }

    @Test
    void storedCookiesAreSent() {
        HandshakeRequest request = ChangeFeedRequestBuilder.build(feedURL, null, cookieStore, null, 30_000, null);

        assertTrue(request.isHandlingCookies());
        assertEquals("SyncGatewaySession=abc123", request.getRequest().header("Cookie"));
    }

    @Test
    void cookiesForOtherHostsAreNotSent() throws Exception {
        URL other = new URL("http://other.example.com/db/_changes?feed=websocket");

        HandshakeRequest request = ChangeFeedRequestBuilder.build(other, null, cookieStore, null, 30_000, null);

        assertNull(request.getRequest().header("Cookie"));
    }

    @Test
    void callerCookieHeaderDisablesStoredCookies() {
        for (String name : new String[]{"Cookie", "cookie", "COOKIE"}) {
            Map<String, Object> headers = new HashMap<String, Object>();
            headers.put(name, "mine=1");

            HandshakeRequest request = ChangeFeedRequestBuilder.build(feedURL, headers, cookieStore, null, 30_000, null);

            assertFalse(request.isHandlingCookies(), name);
            assertEquals(1, request.getRequest().headers("Cookie").size(), name);
            assertEquals("mine=1", request.getRequest().header("Cookie"), name);
        }
    }

    @Test
    void headersAreApplied() {
        Map<String, Object> headers = new HashMap<String, Object>();
        headers.put("User-Agent", "CouchbaseLite/1.0");
        headers.put("X-Request-Count", 3);
        headers.put("X-Skipped", null);

        Request request = ChangeFeedRequestBuilder.build(feedURL, headers, null, null, 30_000, null).getRequest();

        assertEquals("CouchbaseLite/1.0", request.header("User-Agent"));
        assertEquals("3", request.header("X-Request-Count"));
        assertNull(request.header("X-Skipped"));
    }

    @Test
    void authorizerSetsAuthorization() {
        Request request = ChangeFeedRequestBuilder.build(feedURL, null, null,
                new BasicAuthorizer("pupshaw", "frank"), 30_000, null).getRequest();

        assertEquals("Basic cHVwc2hhdzpmcmFuaw==", request.header("Authorization"));
    }

    @Test
    void emptyAuthorizationIsNotSent() {
        Authorizer silent = new Authorizer() {
            @Override
            public String authorizeURLRequest(URL url, String realm) {
                return "";
            }
        };

        Request request = ChangeFeedRequestBuilder.build(feedURL, null, null, silent, 30_000, null).getRequest();

        assertNull(request.header("Authorization"));
    }

    @Test
    void tlsSettingsArePassedThrough() {
        TLSSettings tls = new TLSSettings();

        HandshakeRequest request = ChangeFeedRequestBuilder.build(feedURL, null, null, null, 30_000, tls);

        assertSame(tls, request.getTLSSettings());
    }
}
