package com.couchbase.lite.changefeed.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ThreadConfinedExecutorTest {

    private ThreadConfinedExecutor executor;

    @BeforeEach
    void setUp() {
        executor = ThreadConfinedExecutor.newSingleThread("confined");
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void tasksRunInOrderOnTheOwningThread() throws Exception {
        List<String> log = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 10; i++) {
            int n = i;
            executor.execute(() -> log.add(n + "@" + Thread.currentThread().getName()));
        }
        executor.callSynchronously(() -> null);

        assertEquals(10, log.size());
        for (int i = 0; i < 10; i++) {
            assertEquals(i + "@confined", log.get(i));
        }
    }

    @Test
    void callSynchronouslyReturnsTheResult() throws Exception {
        String thread = executor.callSynchronously(() -> Thread.currentThread().getName());

        assertEquals("confined", thread);
        assertFalse(executor.isOwnerThread());
    }

    @Test
    void callSynchronouslyRunsInlineOnTheOwningThread() throws Exception {
        // would deadlock if the nested call were queued behind the outer one
        Boolean nested = executor.callSynchronously(() ->
                executor.callSynchronously(() -> executor.isOwnerThread()));

        assertTrue(nested);
    }

    @Test
    void callSynchronouslyWrapsTheTasksException() {
        IllegalStateException boom = new IllegalStateException("boom");

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> executor.callSynchronously(() -> {
                    throw boom;
                }));
        assertSame(boom, e.getCause());
    }

    @Test
    void callSynchronouslyAfterShutdownFails() {
        executor.shutdown();

        assertTrue(executor.isShutdown());
        assertThrows(ExecutionException.class, () -> executor.callSynchronously(() -> null));
    }

    @Test
    void executeAfterShutdownIsDropped() {
        executor.shutdown();

        executor.execute(() -> {
            throw new AssertionError("must not run");
        });
    }

    @Test
    void scheduledTasksRunOnTheOwningThread() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        AtomicReference<Boolean> owner = new AtomicReference<>();
        executor.schedule(() -> {
            owner.set(executor.isOwnerThread());
            ran.countDown();
        }, 10, TimeUnit.MILLISECONDS);

        assertTrue(ran.await(5, TimeUnit.SECONDS));
        assertTrue(owner.get());
    }

    @Test
    void failingTaskDoesNotKillTheQueue() throws Exception {
        executor.execute(() -> {
            throw new IllegalStateException("expected by test");
        });

        assertEquals("still here", executor.callSynchronously(() -> "still here"));
    }

    @Test
    void executorIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> new ThreadConfinedExecutor(null));
    }
}
