package com.couchbase.lite.changefeed.websocket;

import java.io.IOException;

/**
 * Opens WebSocket connections.
 */
public interface WebSocketConnector {

    /**
     * Starts opening a connection and returns without waiting for the handshake. Every event
     * for the new connection goes to {@code listener}.
     *
     * @throws IOException if the connection can't even be attempted, e.g. TLS can't be set up
     */
    WebSocketConnection open(HandshakeRequest request, WebSocketEventListener listener) throws IOException;
}
