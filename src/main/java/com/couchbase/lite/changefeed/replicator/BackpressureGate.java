package com.couchbase.lite.changefeed.replicator;

import com.couchbase.lite.changefeed.util.Log;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts the messages of one connection that were received but not processed yet, and decides
 * whether the connection should stop reading.
 *
 * Arrivals are counted on the transport's thread, completions on the tracker's work thread.
 */
public class BackpressureGate {

    public static final int DEFAULT_MAX_PENDING_MESSAGES = 2;

    private final AtomicInteger pendingMessageCount = new AtomicInteger(0);
    private final int maxPendingMessages;
    private volatile boolean clientPaused;

    /**
     * @param maxPendingMessages reading pauses once this many messages are pending; 0 means never
     */
    public BackpressureGate(int maxPendingMessages, boolean clientPaused) {
        if (maxPendingMessages < 0) {
            throw new IllegalArgumentException("maxPendingMessages must be >= 0");
        }
        this.maxPendingMessages = maxPendingMessages;
        this.clientPaused = clientPaused;
    }

    public int messageArrived() {
        return pendingMessageCount.incrementAndGet();
    }

    /**
     * @return the new count; never goes below zero
     */
    public int messageProcessed() {
        while (true) {
            int current = pendingMessageCount.get();
            if (current <= 0) {
                Log.w(Log.TAG_CHANGE_TRACKER, "%s: message processed with no message pending", this);
                return 0;
            }
            if (pendingMessageCount.compareAndSet(current, current - 1)) {
                return current - 1;
            }
        }
    }

    public int getPendingMessageCount() {
        return pendingMessageCount.get();
    }

    public boolean isSaturated() {
        return maxPendingMessages > 0 && pendingMessageCount.get() >= maxPendingMessages;
    }

    public void setClientPaused(boolean clientPaused) {
        this.clientPaused = clientPaused;
    }

    /**
     * Reading stops if the client paused _or_ there are too many incoming messages.
     */
    public boolean shouldPauseReading() {
        return clientPaused || isSaturated();
    }

    @Override
    public String toString() {
        return "BackpressureGate[" + pendingMessageCount.get() + "/" + maxPendingMessages
                + (clientPaused ? ", paused" : "") + "]";
    }
}
