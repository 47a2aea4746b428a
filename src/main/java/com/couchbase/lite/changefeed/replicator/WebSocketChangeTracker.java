package com.couchbase.lite.changefeed.replicator;

import com.couchbase.lite.changefeed.CouchbaseLiteException;
import com.couchbase.lite.changefeed.Misc;
import com.couchbase.lite.changefeed.Status;
import com.couchbase.lite.changefeed.internal.InterfaceAudience;
import com.couchbase.lite.changefeed.support.HttpClientFactory;
import com.couchbase.lite.changefeed.support.ThreadConfinedExecutor;
import com.couchbase.lite.changefeed.util.Log;
import com.couchbase.lite.changefeed.websocket.HandshakeRequest;
import com.couchbase.lite.changefeed.websocket.OkHttpWebSocketConnector;
import com.couchbase.lite.changefeed.websocket.WebSocketCloseCode;
import com.couchbase.lite.changefeed.websocket.WebSocketCloseException;
import com.couchbase.lite.changefeed.websocket.WebSocketConnection;
import com.couchbase.lite.changefeed.websocket.WebSocketConnector;
import com.couchbase.lite.changefeed.websocket.WebSocketEventListener;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.security.cert.X509Certificate;

/**
 * Change tracker that reads the feed over a WebSocket ({@code _changes?feed=websocket}).
 *
 * The feed options go out as the first message after the socket opens. Each incoming text
 * message is one JSON array of changes; an empty array means the server has nothing more for
 * now, i.e. we're caught up.
 *
 * Transport events arrive on OkHttp's threads and are moved to the work thread by
 * {@link ThreadConfinedWebSocketListener}; the {@code WebSocketEventListener} methods below
 * therefore always run on the work thread.
 */
public class WebSocketChangeTracker extends ChangeTracker implements WebSocketEventListener {

    private final WebSocketConnector connector;

    private WebSocketConnection connection;
    private BackpressureGate gate;
    private boolean running;
    private long startTime;
    private int localCloseCode;
    private String localCloseReason;
    private int maxPendingMessages = BackpressureGate.DEFAULT_MAX_PENDING_MESSAGES;

    @InterfaceAudience.Public
    public WebSocketChangeTracker(URL databaseURL, ChangeTrackerClient client, ThreadConfinedExecutor workExecutor,
                                  HttpClientFactory clientFactory) {
        super(databaseURL, client, workExecutor, clientFactory);
        this.connector = new OkHttpWebSocketConnector(this.clientFactory.getOkHttpClient());
    }

    @InterfaceAudience.Private
    public WebSocketChangeTracker(URL databaseURL, ChangeTrackerClient client, ThreadConfinedExecutor workExecutor,
                                  HttpClientFactory clientFactory, WebSocketConnector connector) {
        super(databaseURL, client, workExecutor, clientFactory);
        this.connector = connector;
    }

    @Override
    public URL getChangesFeedURL() {
        // The options will be sent in a WebSocket message after opening (see onOpen below)
        return Misc.appendToURL(databaseURL, "_changes?feed=websocket");
    }

    @Override
    protected boolean startTracking() {
        if (connection != null) {
            return false;
        }
        Log.d(Log.TAG_CHANGE_TRACKER, "%s: Starting...", this);

        URL url = getChangesFeedURL();
        HandshakeRequest request = ChangeFeedRequestBuilder.build(url, requestHeaders,
                clientFactory.getCookieStore(), authorizer, heartbeatMillis, tlsSettings);
        Log.v(Log.TAG_SYNC, "%s: %s", this, request);

        state = State.CONNECTING;
        error = null;
        running = true;
        caughtUp = false;
        startTime = System.currentTimeMillis();
        localCloseCode = 0;
        localCloseReason = null;
        gate = new BackpressureGate(maxPendingMessages, paused);
        resetParser();
        try {
            connection = connector.open(request, new ThreadConfinedWebSocketListener(this, workExecutor, gate));
        } catch (IOException e) {
            Log.e(Log.TAG_CHANGE_TRACKER, "%s: unable to open WebSocket", e, this);
            running = false;
            failedWithError(e);
            return false;
        }
        Log.d(Log.TAG_CHANGE_TRACKER, "%s: Started... <%s>", this, Misc.sanitizeURL(url));
        return true;
    }

    @Override
    protected void stopTracking() {
        running = false; // don't want to receive any more messages
        if (connection != null) {
            Log.d(Log.TAG_CHANGE_TRACKER, "%s: stop after %d ms", this, System.currentTimeMillis() - startTime);
            WebSocketConnection closing = connection;
            connection = null;
            closing.close(WebSocketCloseCode.NORMAL, null);
        }
    }

    @Override
    protected void pausedChanged() {
        if (gate == null) {
            return;
        }
        // Pause the WebSocket if the client paused _or_ there are too many incoming messages:
        gate.setClientPaused(paused);
        boolean pause = gate.shouldPauseReading();
        if (connection != null && pause != connection.isReadPaused()) {
            Log.d(Log.TAG_CHANGE_TRACKER, "%s: %s WebSocket", this, pause ? "PAUSE" : "RESUME");
            connection.setReadPaused(pause);
        }
    }

    /**
     * How many received messages may wait for processing before the socket stops reading;
     * 0 never pauses. Takes effect at the next start.
     */
    public void setMaxPendingMessages(int maxPendingMessages) {
        if (maxPendingMessages < 0) {
            throw new IllegalArgumentException("maxPendingMessages must be >= 0");
        }
        this.maxPendingMessages = maxPendingMessages;
    }

    public int getMaxPendingMessages() {
        return maxPendingMessages;
    }

    public int getPendingMessageCount() {
        BackpressureGate current = gate;
        return current != null ? current.getPendingMessageCount() : 0;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * When the current connection was started, in milliseconds since the epoch.
     */
    public long getStartTime() {
        return startTime;
    }

    /* package */ WebSocketConnection getConnection() {
        return connection;
    }

    // WebSocketEventListener, called on the work thread:

    @Override
    @InterfaceAudience.Private
    public boolean validateServerTrust(WebSocketConnection ws, X509Certificate[] chain, String authType) {
        if (ws != connection) {
            Log.v(Log.TAG_CHANGE_TRACKER, "%s: rejecting trust check of a stale connection", this);
            return false;
        }
        return checkServerTrust(chain, authType);
    }

    @Override
    @InterfaceAudience.Private
    public void onOpen(WebSocketConnection ws) {
        if (ws != connection) {
            return;
        }
        Log.v(Log.TAG_CHANGE_TRACKER, "%s: WebSocket opened", this);
        retryCount = 0;
        state = State.OPEN;
        // Now that the WebSocket is open, send the changes-feed options (the ones that would have
        // gone in the POST body if this were HTTP-based.)
        ws.send(changesFeedPOSTBody());
    }

    /**
     * A textual message from the peer: one batch of changes.
     */
    @Override
    @InterfaceAudience.Private
    public void onTextMessage(WebSocketConnection ws, String msg) {
        Log.v(Log.TAG_CHANGE_TRACKER, "%s: Got a message: %s", this, msg);
        if (msg.length() == 0 || ws != connection || !running || state != State.OPEN) {
            return;
        }
        byte[] data = msg.getBytes(StandardCharsets.UTF_8);
        boolean parsed = parseBytes(data, 0, data.length);
        if (parsed) {
            int changeCount = endParsingData();
            parsed = changeCount >= 0;
            if (changeCount == 0 && !caughtUp) {
                // Received an empty changes array: means server is waiting, so I'm caught up
                setCaughtUp();
            }
        } else {
            resetParser();
        }
        if (!parsed) {
            Log.w(Log.TAG_CHANGE_TRACKER, "%s: Couldn't parse message: %s", this, msg);
            closeConnection(WebSocketCloseCode.UNHANDLED_TYPE, "Unparseable change entry");
        }
    }

    @Override
    @InterfaceAudience.Private
    public void onBinaryMessage(WebSocketConnection ws, byte[] data) {
        Log.w(Log.TAG_CHANGE_TRACKER, "%s: Unhandled binary message (%d bytes)", this, data.length);
        if (ws == connection) {
            closeConnection(WebSocketCloseCode.UNHANDLED_TYPE, "Unknown message");
        } else {
            ws.close(WebSocketCloseCode.UNHANDLED_TYPE, "Unknown message");
        }
    }

    @Override
    @InterfaceAudience.Private
    public void onFailure(WebSocketConnection ws, Throwable error, int httpStatus) {
        if (ws != connection) {
            Log.v(Log.TAG_CHANGE_TRACKER, "%s: ignoring failure of a stale connection: %s", this, error);
            return;
        }
        connection = null;
        running = false;
        Throwable myError = error;
        if (localCloseCode != 0) {
            // we were already closing because we rejected a message; that's the real reason
            myError = new WebSocketCloseException(localCloseCode, localCloseReason,
                    Misc.sanitizeURL(getChangesFeedURL()), error);
        } else if (httpStatus > 0) {
            // Map HTTP errors to my own error domain:
            String message = String.format("%s returned HTTP %d", Misc.sanitizeURL(getChangesFeedURL()), httpStatus);
            myError = new CouchbaseLiteException(message, error, new Status(httpStatus));
        }
        failedWithError(myError);
    }

    /**
     * Called after the WebSocket closes, either intentionally or due to an error.
     */
    @Override
    @InterfaceAudience.Private
    public void onClosed(WebSocketConnection ws, int code, String reason, boolean wasClean) {
        if (ws != connection) {
            return;
        }
        connection = null;
        if (localCloseCode != 0) {
            // we rejected something; whatever the peer echoed, report our own reason
            code = localCloseCode;
            reason = localCloseReason;
        }
        if (wasClean && code == WebSocketCloseCode.NORMAL) {
            Log.d(Log.TAG_CHANGE_TRACKER, "%s: closed", this);
            stop();
        } else {
            running = false;
            failedWithError(new WebSocketCloseException(code, reason, Misc.sanitizeURL(getChangesFeedURL())));
        }
    }

    private void closeConnection(int code, String reason) {
        if (state == State.CLOSING) {
            return;
        }
        state = State.CLOSING;
        localCloseCode = code;
        localCloseReason = reason;
        connection.close(code, reason);
    }
}
