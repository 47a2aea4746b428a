package com.couchbase.lite.changefeed.replicator;

import com.couchbase.lite.changefeed.CouchbaseLiteException;
import com.couchbase.lite.changefeed.Misc;
import com.couchbase.lite.changefeed.auth.Authorizer;
import com.couchbase.lite.changefeed.internal.InterfaceAudience;
import com.couchbase.lite.changefeed.support.ChangeFeedHttpClientFactory;
import com.couchbase.lite.changefeed.support.HttpClientFactory;
import com.couchbase.lite.changefeed.support.TLSSettings;
import com.couchbase.lite.changefeed.support.ThreadConfinedExecutor;
import com.couchbase.lite.changefeed.util.Log;
import com.couchbase.lite.changefeed.websocket.WebSocketCloseCode;
import com.couchbase.lite.changefeed.websocket.WebSocketCloseException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URL;
import java.security.GeneralSecurityException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import javax.net.ssl.SSLException;
import javax.net.ssl.X509TrustManager;

/**
 * Reads the _changes feed of a remote database and hands each change to a
 * {@link ChangeTrackerClient}.
 *
 * This class holds what every transport shares: feed options, parsing, the caught-up and paused
 * state, trust checks and the retry policy. Subclasses open the actual connection.
 *
 * All state belongs to the work executor's thread. The public control methods may be called
 * from any thread; they run on the work thread and wait for it.
 */
public abstract class ChangeTracker implements ChangeFeedParser.ChangeHandler {

    public enum State {
        /** Not started yet, or waiting for a scheduled retry. */
        IDLE,
        CONNECTING,
        /** Connected; see {@link #isCaughtUp()}. */
        OPEN,
        /** The tracker asked the peer to close the connection. */
        CLOSING,
        /** Stopped on request or after a clean close. */
        CLOSED,
        /** Stopped after an error that won't be retried. */
        FAILED
    }

    public static final long DEFAULT_HEARTBEAT_MILLIS = 5 * 60 * 1000;

    protected static final long INITIAL_RETRY_DELAY_MILLIS = 2 * 1000;
    protected static final long MAX_RETRY_DELAY_MILLIS = 10 * 60 * 1000;
    protected static final int MAX_RETRIES = 6;

    private static final ObjectMapper mapper = new ObjectMapper();

    protected final URL databaseURL;
    protected final ChangeTrackerClient client;
    protected final ThreadConfinedExecutor workExecutor;
    protected final HttpClientFactory clientFactory;

    protected Object lastSequenceID;
    protected String filterName;
    protected Map<String, Object> filterParams;
    protected List<String> docIDs;
    protected boolean includeConflicts;
    protected boolean activeOnly;
    protected int limit;
    protected long heartbeatMillis = DEFAULT_HEARTBEAT_MILLIS;
    protected Map<String, Object> requestHeaders = new HashMap<String, Object>();
    protected Authorizer authorizer;
    protected TLSSettings tlsSettings;

    protected State state = State.IDLE;
    protected boolean caughtUp;
    protected boolean paused;
    protected int retryCount;
    protected Throwable error;

    private long initialRetryDelayMillis = INITIAL_RETRY_DELAY_MILLIS;
    private int maxRetries = MAX_RETRIES;
    private ScheduledFuture<?> restartFuture;
    private final ChangeFeedParser parser;

    protected ChangeTracker(URL databaseURL, ChangeTrackerClient client, ThreadConfinedExecutor workExecutor,
                            HttpClientFactory clientFactory) {
        if (databaseURL == null || workExecutor == null) {
            throw new IllegalArgumentException("databaseURL and workExecutor are required");
        }
        this.databaseURL = databaseURL;
        this.client = client;
        this.workExecutor = workExecutor;
        this.clientFactory = clientFactory != null ? clientFactory : new ChangeFeedHttpClientFactory();
        this.parser = new ChangeFeedParser(mapper, this);
    }

    /**
     * Opens a connection.
     * @return false if a connection is already open or couldn't be attempted
     */
    protected abstract boolean startTracking();

    /**
     * Closes the connection, if any. After this, nothing it delivers may have any effect.
     */
    protected abstract void stopTracking();

    /**
     * The paused flag changed.
     */
    protected void pausedChanged() {
    }

    public abstract URL getChangesFeedURL();

    @InterfaceAudience.Public
    public boolean start() {
        return onWorkThread(new Callable<Boolean>() {
            @Override
            public Boolean call() {
                cancelPendingRestart();
                if (!startTracking()) {
                    return false;
                }
                retryCount = 0;
                return true;
            }
        });
    }

    /**
     * Stops tracking and cancels any pending retry. Safe to call in any state, any number of times.
     */
    @InterfaceAudience.Public
    public void stop() {
        onWorkThread(new Callable<Void>() {
            @Override
            public Void call() {
                cancelPendingRestart();
                stopTracking();
                stopped(State.CLOSED);
                return null;
            }
        });
    }

    @InterfaceAudience.Public
    public void setPaused(final boolean paused) {
        onWorkThread(new Callable<Void>() {
            @Override
            public Void call() {
                if (ChangeTracker.this.paused != paused) {
                    Log.v(Log.TAG_CHANGE_TRACKER, "%s: paused = %s", ChangeTracker.this, paused);
                }
                ChangeTracker.this.paused = paused;
                pausedChanged();
                return null;
            }
        });
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isCaughtUp() {
        return caughtUp;
    }

    public State getState() {
        return state;
    }

    public Throwable getLastError() {
        return error;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public boolean isRetryPending() {
        return restartFuture != null;
    }

    public URL getDatabaseURL() {
        return databaseURL;
    }

    public Object getLastSequenceID() {
        return lastSequenceID;
    }

    public void setLastSequenceID(Object lastSequenceID) {
        this.lastSequenceID = lastSequenceID;
    }

    public String getFilterName() {
        return filterName;
    }

    public void setFilterName(String filterName) {
        this.filterName = filterName;
    }

    public Map<String, Object> getFilterParams() {
        return filterParams;
    }

    public void setFilterParams(Map<String, Object> filterParams) {
        this.filterParams = filterParams;
    }

    public List<String> getDocIDs() {
        return docIDs;
    }

    public void setDocIDs(List<String> docIDs) {
        this.docIDs = docIDs;
    }

    public boolean isIncludeConflicts() {
        return includeConflicts;
    }

    public void setIncludeConflicts(boolean includeConflicts) {
        this.includeConflicts = includeConflicts;
    }

    public boolean isActiveOnly() {
        return activeOnly;
    }

    public void setActiveOnly(boolean activeOnly) {
        this.activeOnly = activeOnly;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    public long getHeartbeatMillis() {
        return heartbeatMillis;
    }

    public void setHeartbeatMillis(long heartbeatMillis) {
        if (heartbeatMillis <= 0) {
            throw new IllegalArgumentException("heartbeat must be positive");
        }
        this.heartbeatMillis = heartbeatMillis;
    }

    public Map<String, Object> getRequestHeaders() {
        return requestHeaders;
    }

    public void setRequestHeaders(Map<String, Object> requestHeaders) {
        this.requestHeaders = requestHeaders != null ? requestHeaders : new HashMap<String, Object>();
    }

    public Authorizer getAuthorizer() {
        return authorizer;
    }

    public void setAuthorizer(Authorizer authorizer) {
        this.authorizer = authorizer;
    }

    public TLSSettings getTLSSettings() {
        return tlsSettings;
    }

    public void setTLSSettings(TLSSettings tlsSettings) {
        this.tlsSettings = tlsSettings;
    }

    public HttpClientFactory getClientFactory() {
        return clientFactory;
    }

    /* package */ void setRetryPolicy(long initialRetryDelayMillis, int maxRetries) {
        this.initialRetryDelayMillis = initialRetryDelayMillis;
        this.maxRetries = maxRetries;
    }

    /**
     * The feed options, as the JSON object a POST to _changes would carry.
     */
    public Map<String, Object> changesFeedPostBodyMap() {
        Map<String, Object> post = new LinkedHashMap<String, Object>();
        post.put("feed", "websocket");
        post.put("heartbeat", heartbeatMillis);
        if (includeConflicts) {
            post.put("style", "all_docs");
        }
        if (lastSequenceID != null) {
            post.put("since", lastSequenceID);
        }
        if (activeOnly) {
            post.put("active_only", true);
        }
        if (limit > 0) {
            post.put("limit", limit);
        }
        if (docIDs != null && !docIDs.isEmpty()) {
            post.put("filter", "_doc_ids");
            post.put("doc_ids", new ArrayList<String>(docIDs));
        } else if (filterName != null) {
            post.put("filter", filterName);
            if (filterParams != null) {
                for (Map.Entry<String, Object> param : filterParams.entrySet()) {
                    if (!post.containsKey(param.getKey())) {
                        post.put(param.getKey(), param.getValue());
                    }
                }
            }
        }
        return post;
    }

    public String changesFeedPOSTBody() {
        try {
            return mapper.writeValueAsString(changesFeedPostBodyMap());
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    protected boolean parseBytes(byte[] bytes, int offset, int length) {
        return parser.parseBytes(bytes, offset, length);
    }

    /**
     * @return the number of changes parsed since the last call, or -1 on a parse error
     */
    protected int endParsingData() {
        return parser.endParsingData();
    }

    protected void resetParser() {
        parser.reset();
    }

    @Override
    public boolean receivedChange(Map<String, Object> change) {
        Object seq = change.get("seq");
        if (seq == null) {
            Log.w(Log.TAG_CHANGE_TRACKER, "%s: change has no sequence: %s", this, change);
            return false;
        }
        Object docID = change.get("id");
        if (!(docID instanceof String)) {
            Log.w(Log.TAG_CHANGE_TRACKER, "%s: change has no valid doc ID: %s", this, change);
            return false;
        }
        if (!(change.get("changes") instanceof List)) {
            Log.w(Log.TAG_CHANGE_TRACKER, "%s: change has no revisions: %s", this, change);
            return false;
        }
        lastSequenceID = seq;
        if (((String) docID).startsWith("_user/")) {
            // user docs show up in the feed when the user's channel access changes
            Log.v(Log.TAG_CHANGE_TRACKER, "%s: skipping %s", this, docID);
            return true;
        }
        if (client != null) {
            client.changeTrackerReceivedChange(change);
        }
        return true;
    }

    protected void setCaughtUp() {
        if (caughtUp) {
            return;
        }
        Log.d(Log.TAG_CHANGE_TRACKER, "%s: caught up!", this);
        caughtUp = true;
        if (client != null) {
            client.changeTrackerCaughtUp();
        }
    }

    /**
     * Decides whether to trust the server's certificate chain.
     */
    protected boolean checkServerTrust(X509Certificate[] chain, String authType) {
        String host = databaseURL.getHost();
        if (tlsSettings != null && tlsSettings.shouldDisableCertificateValidation(host)) {
            Log.v(Log.TAG_SYNC, "%s: not validating certificate of IP address host %s", this, host);
            return true;
        }
        try {
            X509TrustManager trustManager = tlsSettings != null && tlsSettings.getTrustManager() != null
                    ? tlsSettings.getTrustManager()
                    : TLSSettings.defaultTrustManager();
            trustManager.checkServerTrusted(chain, authType);
            return true;
        } catch (CertificateException e) {
            Log.w(Log.TAG_SYNC, "%s: server certificate rejected", e, this);
            return false;
        } catch (GeneralSecurityException e) {
            Log.e(Log.TAG_SYNC, "%s: unable to load a trust manager", e, this);
            return false;
        }
    }

    /**
     * Reports the error to the client, then retries later or stops.
     */
    protected void failedWithError(Throwable error) {
        Log.w(Log.TAG_CHANGE_TRACKER, "%s: failed", error, this);
        this.error = error;
        if (client != null) {
            client.changeTrackerFailed(this, error);
            if (state == State.CLOSED || state == State.FAILED) {
                return; // the client stopped us
            }
        }
        if (isTransientError(error) && retryCount < maxRetries) {
            retryCount++;
            long delay = retryDelayMillis(retryCount);
            Log.i(Log.TAG_CHANGE_TRACKER, "%s: retry #%d in %d ms", this, retryCount, delay);
            state = State.IDLE;
            scheduleRestart(delay);
        } else {
            stopped(State.FAILED);
        }
    }

    /**
     * Might the error go away by itself if the request is made again?
     */
    protected boolean isTransientError(Throwable error) {
        if (error instanceof CouchbaseLiteException) {
            return ((CouchbaseLiteException) error).getCBLStatus().isTransient();
        }
        if (error instanceof WebSocketCloseException) {
            switch (((WebSocketCloseException) error).getCode()) {
                case WebSocketCloseCode.NORMAL:
                case WebSocketCloseCode.PROTOCOL_ERROR:
                case WebSocketCloseCode.UNHANDLED_TYPE:
                case WebSocketCloseCode.BAD_MESSAGE_FORMAT:
                case WebSocketCloseCode.POLICY_ERROR:
                    return false;
                default:
                    return true;
            }
        }
        if (error instanceof SSLException) {
            return false;
        }
        return error instanceof IOException;
    }

    protected long retryDelayMillis(int attempt) {
        long delay = initialRetryDelayMillis;
        for (int i = 1; i < attempt && delay < MAX_RETRY_DELAY_MILLIS; i++) {
            delay *= 2;
        }
        return Math.min(delay, MAX_RETRY_DELAY_MILLIS);
    }

    private void scheduleRestart(long delayMillis) {
        cancelPendingRestart();
        restartFuture = workExecutor.schedule(new Runnable() {
            @Override
            public void run() {
                restartFuture = null;
                if (state != State.IDLE) {
                    return;
                }
                Log.d(Log.TAG_CHANGE_TRACKER, "%s: RETRYING", ChangeTracker.this);
                startTracking();
            }
        }, delayMillis, TimeUnit.MILLISECONDS);
    }

    private void cancelPendingRestart() {
        if (restartFuture != null) {
            Log.v(Log.TAG_CHANGE_TRACKER, "%s: cancelling pending retry", this);
            restartFuture.cancel(false);
            restartFuture = null;
        }
    }

    /**
     * Shared teardown. Tells the client once per run of the tracker.
     */
    protected void stopped(State finalState) {
        boolean wasActive = state == State.CONNECTING || state == State.OPEN || state == State.CLOSING
                || (state == State.IDLE && retryCount > 0);
        if (!wasActive) {
            return;
        }
        Log.d(Log.TAG_CHANGE_TRACKER, "%s: stopped (%s)", this, finalState);
        state = finalState;
        if (client != null) {
            client.changeTrackerStopped(this);
        }
    }

    protected <T> T onWorkThread(Callable<T> task) {
        try {
            return workExecutor.callSynchronously(task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for " + this, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + Misc.sanitizeURL(databaseURL) + "]";
    }
}
