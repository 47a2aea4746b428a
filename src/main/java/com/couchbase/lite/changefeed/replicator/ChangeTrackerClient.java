package com.couchbase.lite.changefeed.replicator;

import com.couchbase.lite.changefeed.internal.InterfaceAudience;

import java.util.Map;

/**
 * Receives the output of a {@link ChangeTracker}. Every method is called on the tracker's
 * work thread.
 */
@InterfaceAudience.Private
public interface ChangeTrackerClient {

    void changeTrackerReceivedChange(Map<String, Object> change);

    /**
     * The feed has no more backlog; called at most once per connection.
     */
    void changeTrackerCaughtUp();

    /**
     * Called exactly once for each failure, before the tracker either schedules a retry or stops.
     */
    void changeTrackerFailed(ChangeTracker tracker, Throwable error);

    void changeTrackerStopped(ChangeTracker tracker);
}
