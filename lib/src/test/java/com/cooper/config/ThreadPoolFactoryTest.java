package com.cooper.config;

import com.cooper.dispatcher.Dispatcher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
class ThreadPoolFactoryTest {

    @Test
    void testDefaults() {
        ThreadPoolFactory factory = new ThreadPoolFactory();

        assertEquals(ThreadPoolFactory.ThreadPoolType.FORK_JOIN, factory.getExecutorType());
        assertEquals(Runtime.getRuntime().availableProcessors(), factory.getPoolSize());
        assertEquals(64, factory.getActorBatchSize());
        assertEquals(10, factory.getShutdownTimeoutSeconds());
        assertTrue(factory.isUseNamedThreads());
        assertTrue(factory.isDaemonActorThreads());
    }

    @Test
    void testFluentConfiguration() {
        ThreadPoolFactory factory = new ThreadPoolFactory()
                .setExecutorType(ThreadPoolFactory.ThreadPoolType.FIXED)
                .setPoolSize(3)
                .setActorBatchSize(0)
                .setShutdownTimeoutSeconds(1);

        assertEquals(ThreadPoolFactory.ThreadPoolType.FIXED, factory.getExecutorType());
        assertEquals(3, factory.getPoolSize());
        assertEquals(1, factory.getActorBatchSize(), "Batch size is clamped to at least one");
        assertEquals(1, factory.getShutdownTimeoutSeconds());
    }

    @Test
    void testInvalidSettingsAreRejected() {
        ThreadPoolFactory factory = new ThreadPoolFactory();
        assertThrows(IllegalArgumentException.class, () -> factory.setPoolSize(0));
        assertThrows(IllegalArgumentException.class, () -> factory.setExecutorType(null));
    }

    @Test
    void testFixedDispatcherUsesPoolName() throws InterruptedException {
        Dispatcher dispatcher = new ThreadPoolFactory()
                .setExecutorType(ThreadPoolFactory.ThreadPoolType.FIXED)
                .setPoolSize(1)
                .createDispatcher("workers");
        try {
            AtomicReference<String> threadName = new AtomicReference<>();
            CountDownLatch latch = new CountDownLatch(1);
            dispatcher.schedule(() -> {
                threadName.set(Thread.currentThread().getName());
                latch.countDown();
            });

            assertTrue(latch.await(1, TimeUnit.SECONDS));
            assertEquals("workers", dispatcher.getName());
            assertEquals("workers-1", threadName.get());
        } finally {
            dispatcher.shutdown();
        }
    }

    @Test
    void testActorThreadIsNamedAndUnstarted() {
        Thread thread = new ThreadPoolFactory().createActorThread("counter", () -> { });

        assertEquals("actor-counter", thread.getName());
        assertTrue(thread.isDaemon());
        assertEquals(Thread.State.NEW, thread.getState());
    }

    @Test
    void testNonDaemonActorThreads() {
        Thread thread = new ThreadPoolFactory()
                .setDaemonActorThreads(false)
                .setUseNamedThreads(false)
                .createActorThread("counter", () -> { });

        assertFalse(thread.isDaemon());
        assertNotEquals("actor-counter", thread.getName());
    }
}
