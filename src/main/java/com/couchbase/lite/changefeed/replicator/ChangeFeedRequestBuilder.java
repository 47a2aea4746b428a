package com.couchbase.lite.changefeed.replicator;

import com.couchbase.lite.changefeed.auth.Authorizer;
import com.couchbase.lite.changefeed.support.CookieHeaders;
import com.couchbase.lite.changefeed.support.TLSSettings;
import com.couchbase.lite.changefeed.util.Log;
import com.couchbase.lite.changefeed.websocket.HandshakeRequest;

import java.net.URL;
import java.util.Map;

import okhttp3.Request;

import org.apache.http.client.CookieStore;

/**
 * Composes the WebSocket upgrade request for the changes feed. Nothing is sent.
 *
 * A WebSocket has to be opened with a GET (RFC 6455), so the feed options can't go in a POST
 * body the way they do over HTTP; they follow in the first message once the socket is open.
 */
public class ChangeFeedRequestBuilder {

    /**
     * The handshake may take this many heartbeat intervals.
     */
    public static final double HEARTBEAT_TIMEOUT_FACTOR = 1.5;

    public static final String AUTHORIZATION = "Authorization";

    private ChangeFeedRequestBuilder() {}

    /**
     * @param url the resolved changes feed URL
     * @param requestHeaders extra headers; a "Cookie" header (any case) disables stored cookies
     * @param cookieStore cookies to send when the caller didn't set its own; may be null
     * @param authorizer supplies the Authorization header; may be null
     * @param heartbeatMillis the feed's heartbeat interval
     * @param tlsSettings passed through to the connector; may be null
     */
    public static HandshakeRequest build(URL url, Map<String, Object> requestHeaders, CookieStore cookieStore,
                                         Authorizer authorizer, long heartbeatMillis, TLSSettings tlsSettings) {
        Request.Builder request = new Request.Builder().url(url);

        boolean handleCookies = true;
        if (requestHeaders != null) {
            for (Map.Entry<String, Object> header : requestHeaders.entrySet()) {
                if (header.getValue() == null) {
                    continue;
                }
                request.header(header.getKey(), header.getValue().toString());
                if (CookieHeaders.COOKIE.equalsIgnoreCase(header.getKey())) {
                    handleCookies = false;
                }
            }
        }

        if (handleCookies) {
            String cookieHeader = CookieHeaders.cookieHeaderForURL(cookieStore, url);
            if (cookieHeader != null) {
                request.header(CookieHeaders.COOKIE, cookieHeader);
            }
        }

        if (authorizer != null) {
            // Let the Authorizer add its own credential:
            String authHeader = authorizer.authorizeURLRequest(url, null);
            if (authHeader != null && !authHeader.isEmpty()) {
                request.header(AUTHORIZATION, authHeader);
            } else {
                Log.v(Log.TAG_SYNC, "%s gave no Authorization header for %s", authorizer, url.getPath());
            }
        }

        long timeoutMillis = (long) (heartbeatMillis * HEARTBEAT_TIMEOUT_FACTOR);
        return new HandshakeRequest(request.build(), timeoutMillis, handleCookies, tlsSettings);
    }
}
