package com.couchbase.lite.changefeed.websocket;

import java.security.cert.X509Certificate;

/**
 * Events from a {@link WebSocketConnection}, delivered on the transport's own threads.
 *
 * For one connection the order is: trust validation (TLS only), open, messages in the order
 * received, then exactly one of {@link #onFailure} or {@link #onClosed}.
 */
public interface WebSocketEventListener {

    /**
     * Asks whether the server's certificate chain should be trusted. The handshake waits for the
     * answer; returning false aborts it with an SSL failure.
     */
    boolean validateServerTrust(WebSocketConnection connection, X509Certificate[] chain, String authType);

    void onOpen(WebSocketConnection connection);

    void onTextMessage(WebSocketConnection connection, String text);

    void onBinaryMessage(WebSocketConnection connection, byte[] data);

    /**
     * The connection failed, either during the handshake or afterwards.
     *
     * @param httpStatus the status of a rejected handshake response, or 0 if there was none
     */
    void onFailure(WebSocketConnection connection, Throwable error, int httpStatus);

    void onClosed(WebSocketConnection connection, int code, String reason, boolean wasClean);
}
