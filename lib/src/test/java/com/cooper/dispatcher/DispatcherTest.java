package com.cooper.dispatcher;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Dispatcher class.
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class DispatcherTest {

    private Dispatcher dispatcher;

    @AfterEach
    void cleanup() {
        if (dispatcher != null && !dispatcher.isShutdown()) {
            dispatcher.shutdown();
            dispatcher.awaitTermination(2, TimeUnit.SECONDS);
        }
    }

    @Test
    void testForkJoinDispatcherCreation() {
        dispatcher = Dispatcher.forkJoinDispatcher();
        assertNotNull(dispatcher);
        assertFalse(dispatcher.isShutdown());
        assertEquals("dispatcher", dispatcher.getName());
    }

    @Test
    void testForkJoinWorkersCarryDispatcherName() throws InterruptedException {
        dispatcher = Dispatcher.forkJoinDispatcher("fj", 2);
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        dispatcher.schedule(() -> {
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertTrue(latch.await(1, TimeUnit.SECONDS), "Task should complete");
        assertTrue(threadName.get().startsWith("fj-"), threadName.get());
    }

    @Test
    void testFixedThreadPoolDispatcherWithCustomName() throws InterruptedException {
        dispatcher = Dispatcher.fixedThreadPoolDispatcher(4, "fixed-dispatcher");
        assertEquals("fixed-dispatcher", dispatcher.getName());

        AtomicReference<Thread> worker = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);
        dispatcher.schedule(() -> {
            worker.set(Thread.currentThread());
            latch.countDown();
        });

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertTrue(worker.get().getName().startsWith("fixed-dispatcher-"));
        assertTrue(worker.get().isDaemon());
    }

    @Test
    void testScheduleMultipleTasks() throws InterruptedException {
        dispatcher = Dispatcher.fixedThreadPoolDispatcher(2);
        int taskCount = 100;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger counter = new AtomicInteger(0);
        Set<String> threads = ConcurrentHashMap.newKeySet();

        for (int i = 0; i < taskCount; i++) {
            assertTrue(dispatcher.schedule(() -> {
                counter.incrementAndGet();
                threads.add(Thread.currentThread().getName());
                latch.countDown();
            }));
        }

        assertTrue(latch.await(2, TimeUnit.SECONDS), "All tasks should complete");
        assertEquals(taskCount, counter.get());
        assertTrue(threads.size() <= 2);
    }

    @Test
    void testScheduleAfterShutdownIsRefused() {
        dispatcher = Dispatcher.forkJoinDispatcher("closing", 1);
        dispatcher.shutdown();

        assertTrue(dispatcher.isShutdown());
        assertFalse(dispatcher.schedule(() -> fail("must not run")));
        assertTrue(dispatcher.awaitTermination(2, TimeUnit.SECONDS));
    }

    @Test
    void testRejectingExecutorIsReportedAsRefusal() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        executor.shutdown();
        dispatcher = Dispatcher.fromExecutor(executor, "wrapped");

        assertFalse(dispatcher.isShutdown());
        assertFalse(dispatcher.schedule(() -> fail("must not run")));
    }

    @Test
    void testShutdownIsIdempotent() {
        dispatcher = Dispatcher.fixedThreadPoolDispatcher(1);
        dispatcher.shutdown();
        dispatcher.shutdown();
        assertTrue(dispatcher.awaitTermination(2, TimeUnit.SECONDS));
    }
}
