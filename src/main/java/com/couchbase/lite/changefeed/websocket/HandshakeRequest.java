package com.couchbase.lite.changefeed.websocket;

import com.couchbase.lite.changefeed.support.TLSSettings;

import java.net.URL;

import okhttp3.Request;

/**
 * Everything a {@link WebSocketConnector} needs to open a connection: the upgrade GET with its
 * headers, how long the handshake may take, and the TLS settings to apply.
 */
public class HandshakeRequest {

    private final Request request;
    private final long timeoutMillis;
    private final boolean handlingCookies;
    private final TLSSettings tlsSettings;

    public HandshakeRequest(Request request, long timeoutMillis, boolean handlingCookies, TLSSettings tlsSettings) {
        this.request = request;
        this.timeoutMillis = timeoutMillis;
        this.handlingCookies = handlingCookies;
        this.tlsSettings = tlsSettings;
    }

    public Request getRequest() {
        return request;
    }

    public URL getURL() {
        return request.url().url();
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    /**
     * False if the caller supplied its own Cookie header, so stored cookies were left out.
     */
    public boolean isHandlingCookies() {
        return handlingCookies;
    }

    /**
     * May be null.
     */
    public TLSSettings getTLSSettings() {
        return tlsSettings;
    }

    @Override
    public String toString() {
        return request.method() + " " + request.url().redact();
    }
}
