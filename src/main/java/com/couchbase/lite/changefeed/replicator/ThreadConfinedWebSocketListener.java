package com.couchbase.lite.changefeed.replicator;

import com.couchbase.lite.changefeed.support.ThreadConfinedExecutor;
import com.couchbase.lite.changefeed.util.Log;
import com.couchbase.lite.changefeed.websocket.WebSocketConnection;
import com.couchbase.lite.changefeed.websocket.WebSocketEventListener;

import java.security.cert.X509Certificate;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/**
 * Moves every event of one connection from the transport's threads onto the work thread that
 * owns the tracker, and pumps its messages through a {@link BackpressureGate}.
 *
 * Trust validation blocks the transport until the work thread has decided. Everything else is
 * queued and returns at once.
 */
class ThreadConfinedWebSocketListener implements WebSocketEventListener {

    private final WebSocketEventListener delegate;
    private final ThreadConfinedExecutor workExecutor;
    private final BackpressureGate gate;

    ThreadConfinedWebSocketListener(WebSocketEventListener delegate, ThreadConfinedExecutor workExecutor,
                                    BackpressureGate gate) {
        this.delegate = delegate;
        this.workExecutor = workExecutor;
        this.gate = gate;
    }

    @Override
    public boolean validateServerTrust(final WebSocketConnection connection, final X509Certificate[] chain,
                                       final String authType) {
        try {
            Boolean trusted = workExecutor.callSynchronously(new Callable<Boolean>() {
                @Override
                public Boolean call() {
                    return delegate.validateServerTrust(connection, chain, authType);
                }
            });
            return trusted != null && trusted;
        } catch (InterruptedException e) {
            Log.w(Log.TAG_CHANGE_TRACKER, "%s: interrupted validating server trust; rejecting", delegate);
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            Log.e(Log.TAG_CHANGE_TRACKER, "Server trust validation failed; rejecting", e.getCause());
            return false;
        }
    }

    @Override
    public void onOpen(final WebSocketConnection connection) {
        workExecutor.execute(new Runnable() {
            @Override
            public void run() {
                delegate.onOpen(connection);
            }
        });
    }

    @Override
    public void onTextMessage(final WebSocketConnection connection, final String text) {
        messageArrived(connection);
        workExecutor.execute(new Runnable() {
            @Override
            public void run() {
                try {
                    delegate.onTextMessage(connection, text);
                } finally {
                    messageProcessed(connection);
                }
            }
        });
    }

    @Override
    public void onBinaryMessage(final WebSocketConnection connection, final byte[] data) {
        messageArrived(connection);
        workExecutor.execute(new Runnable() {
            @Override
            public void run() {
                try {
                    delegate.onBinaryMessage(connection, data);
                } finally {
                    messageProcessed(connection);
                }
            }
        });
    }

    @Override
    public void onFailure(final WebSocketConnection connection, final Throwable error, final int httpStatus) {
        workExecutor.execute(new Runnable() {
            @Override
            public void run() {
                delegate.onFailure(connection, error, httpStatus);
            }
        });
    }

    @Override
    public void onClosed(final WebSocketConnection connection, final int code, final String reason,
                         final boolean wasClean) {
        workExecutor.execute(new Runnable() {
            @Override
            public void run() {
                delegate.onClosed(connection, code, reason, wasClean);
            }
        });
    }

    // transport thread
    private void messageArrived(WebSocketConnection connection) {
        int pending = gate.messageArrived();
        if (gate.shouldPauseReading() && !connection.isReadPaused()) {
            Log.v(Log.TAG_CHANGE_TRACKER, "%s: %d messages pending, PAUSE WebSocket", delegate, pending);
            connection.setReadPaused(true);
        }
    }

    // work thread
    private void messageProcessed(WebSocketConnection connection) {
        gate.messageProcessed();
        // this will resume the WebSocket unless the client paused it
        boolean pause = gate.shouldPauseReading();
        if (pause != connection.isReadPaused()) {
            Log.v(Log.TAG_CHANGE_TRACKER, "%s: %s WebSocket", delegate, pause ? "PAUSE" : "RESUME");
            connection.setReadPaused(pause);
        }
    }
}
