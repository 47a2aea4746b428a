package com.couchbase.lite.changefeed.websocket;

/**
 * Standard WebSocket close status codes, defined at
 * <a href="http://tools.ietf.org/html/rfc6455#section-7.4.1">RFC 6455 section 7.4.1</a>.
 */
public interface WebSocketCloseCode {
    int NORMAL = 1000;
    int GOING_AWAY = 1001; // Peer has to close, e.g. because host app is quitting
    int PROTOCOL_ERROR = 1002; // Protocol violation: invalid framing data
    int UNHANDLED_TYPE = 1003; // Message payload cannot be handled
    int NO_STATUS = 1005; // Never sent, only received
    int ABNORMAL = 1006; // Never sent, only received
    int BAD_MESSAGE_FORMAT = 1007; // Unparseable message
    int POLICY_ERROR = 1008;
    int MESSAGE_TOO_BIG = 1009;
    int MISSING_EXTENSION = 1010; // Peer doesn't provide a necessary extension
    int CANT_FULFILL = 1011; // Can't fulfill request due to "unexpected condition"
    int TLS_FAILURE = 1015; // Never sent, only received
}
