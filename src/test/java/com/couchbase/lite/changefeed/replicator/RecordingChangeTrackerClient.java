package com.couchbase.lite.changefeed.replicator;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

class RecordingChangeTrackerClient implements ChangeTrackerClient {

    final List<Map<String, Object>> changes = new CopyOnWriteArrayList<>();
    final List<Throwable> failures = new CopyOnWriteArrayList<>();
    final AtomicInteger caughtUpCount = new AtomicInteger();
    final AtomicInteger stoppedCount = new AtomicInteger();
    final List<String> callbackThreads = new CopyOnWriteArrayList<>();

    @Override
    public void changeTrackerReceivedChange(Map<String, Object> change) {
        callbackThreads.add(Thread.currentThread().getName());
        changes.add(change);
    }

    @Override
    public void changeTrackerCaughtUp() {
        callbackThreads.add(Thread.currentThread().getName());
        caughtUpCount.incrementAndGet();
    }

    @Override
    public void changeTrackerFailed(ChangeTracker tracker, Throwable error) {
        callbackThreads.add(Thread.currentThread().getName());
        failures.add(error);
    }

    @Override
    public void changeTrackerStopped(ChangeTracker tracker) {
        callbackThreads.add(Thread.currentThread().getName());
        stoppedCount.incrementAndGet();
    }
}
