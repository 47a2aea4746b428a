package com.couchbase.lite.changefeed.support;

import com.couchbase.lite.changefeed.util.Log;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Runs tasks on the single thread that owns an object's state.
 *
 * The wrapped executor must have exactly one worker thread; tasks then run one at a time in
 * submission order, so state touched only from here needs no locking. Other threads hand work
 * over with {@link #execute} (fire and forget) or {@link #callSynchronously} (wait for the
 * result).
 */
public class ThreadConfinedExecutor {

    private final ScheduledExecutorService executor;
    private volatile Thread ownerThread;

    public ThreadConfinedExecutor(ScheduledExecutorService executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor is required");
        }
        this.executor = executor;
    }

    /**
     * A confined executor backed by a new daemon thread with the given name.
     */
    public static ThreadConfinedExecutor newSingleThread(final String threadName) {
        return new ThreadConfinedExecutor(Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, threadName);
                thread.setDaemon(true);
                return thread;
            }
        }));
    }

    /**
     * Is the calling thread the owning thread?
     */
    public boolean isOwnerThread() {
        return Thread.currentThread() == ownerThread;
    }

    /**
     * Queues {@code task} to run on the owning thread and returns immediately. Tasks posted after
     * {@link #shutdown()} are logged and dropped.
     */
    public void execute(final Runnable task) {
        try {
            executor.execute(confined(task));
        } catch (RejectedExecutionException e) {
            Log.w(Log.TAG_SYNC, "%s: dropping task %s, executor is shut down", this, task);
        }
    }

    public ScheduledFuture<?> schedule(Runnable task, long delay, TimeUnit unit) {
        return executor.schedule(confined(task), delay, unit);
    }

    /**
     * Runs {@code task} on the owning thread and waits for its result. Called on the owning
     * thread itself, the task runs inline; otherwise the caller blocks until the queue reaches it.
     *
     * @throws ExecutionException wrapping whatever the task threw
     * @throws InterruptedException if the caller was interrupted while waiting
     */
    public <T> T callSynchronously(final Callable<T> task) throws InterruptedException, ExecutionException {
        if (isOwnerThread()) {
            try {
                return task.call();
            } catch (Exception e) {
                throw new ExecutionException(e);
            }
        }
        Future<T> future;
        try {
            future = executor.submit(new Callable<T>() {
                @Override
                public T call() throws Exception {
                    ownerThread = Thread.currentThread();
                    return task.call();
                }
            });
        } catch (RejectedExecutionException e) {
            throw new ExecutionException("Executor is shut down", e);
        }
        return future.get();
    }

    public void shutdown() {
        executor.shutdown();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    private Runnable confined(final Runnable task) {
        return new Runnable() {
            @Override
            public void run() {
                ownerThread = Thread.currentThread();
                try {
                    task.run();
                } catch (RuntimeException e) {
                    // a scheduled executor would bury this in a Future nobody reads
                    Log.e(Log.TAG_SYNC, "Uncaught exception in confined task " + task, e);
                    throw e;
                }
            }
        };
    }
}
