package com.couchbase.lite.changefeed.websocket;

/**
 * An open (or opening) WebSocket. Methods may be called from any thread.
 */
public interface WebSocketConnection {

    /**
     * Queues a text frame.
     * @return false if the connection is closing or closed
     */
    boolean send(String text);

    /**
     * Starts the closing handshake. A close event follows, unless the connection was already
     * closed.
     * @return false if the connection was already closing or closed
     */
    boolean close(int code, String reason);

    /**
     * Stops (or resumes) delivery of incoming messages. Messages already received are still
     * delivered; nothing is dropped.
     */
    void setReadPaused(boolean paused);

    boolean isReadPaused();
}
