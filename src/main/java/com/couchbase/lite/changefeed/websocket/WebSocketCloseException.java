package com.couchbase.lite.changefeed.websocket;

import java.io.IOException;

/**
 * A WebSocket that closed with anything other than a clean {@link WebSocketCloseCode#NORMAL}.
 */
public class WebSocketCloseException extends IOException {

    private final int code;
    private final String reason;
    private final String failingURL;

    public WebSocketCloseException(int code, String reason, String failingURL) {
        this(code, reason, failingURL, null);
    }

    /**
     * @param cause the transport error that ended the connection before the close handshake did
     */
    public WebSocketCloseException(int code, String reason, String failingURL, Throwable cause) {
        super("WebSocket to " + failingURL + " closed with code " + code
                + (reason != null && !reason.isEmpty() ? ": " + reason : ""), cause);
        this.code = code;
        this.reason = reason;
        this.failingURL = failingURL;
    }

    public int getCode() {
        return code;
    }

    /**
     * The reason the peer gave in its close frame; may be empty.
     */
    public String getReason() {
        return reason;
    }

    public String getFailingURL() {
        return failingURL;
    }
}
