package com.cooper.dispatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatcher schedules actor runners on a shared thread pool.
 * By default, uses a ForkJoinPool in async (FIFO) mode, which suits many short activations.
 * Can optionally use a fixed-size platform thread pool.
 */
public final class Dispatcher {

    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

    private final ExecutorService executor;
    private final String name;
    private volatile boolean shutdown = false;

    private Dispatcher(ExecutorService executor, String name) {
        this.executor = executor;
        this.name = name;
    }

    /**
     * Creates a dispatcher backed by a ForkJoinPool sized to the available processors.
     *
     * @return A new Dispatcher
     */
    public static Dispatcher forkJoinDispatcher() {
        return forkJoinDispatcher("dispatcher", Runtime.getRuntime().availableProcessors());
    }

    /**
     * Creates a dispatcher backed by a ForkJoinPool in async mode with named daemon workers.
     *
     * @param name The name prefix for worker threads
     * @param parallelism The target number of worker threads
     * @return A new Dispatcher
     */
    public static Dispatcher forkJoinDispatcher(String name, int parallelism) {
        int poolSize = Math.max(1, parallelism);
        ForkJoinPool pool = new ForkJoinPool(
            poolSize,
            forkJoinPool -> {
                ForkJoinWorkerThread thread = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(forkJoinPool);
                thread.setName(name + "-" + thread.getPoolIndex());
                return thread;
            },
            (thread, error) -> logger.error("Uncaught error on dispatcher thread {}", thread.getName(), error),
            true
        );
        logger.info("Created fork-join dispatcher: {} with parallelism {}", name, poolSize);
        return new Dispatcher(pool, name);
    }

    /**
     * Creates a dispatcher backed by a fixed-size platform thread pool.
     *
     * @param threads The number of platform threads in the pool
     * @return A new Dispatcher using platform threads
     */
    public static Dispatcher fixedThreadPoolDispatcher(int threads) {
        return fixedThreadPoolDispatcher(threads, "dispatcher");
    }

    /**
     * Creates a dispatcher backed by a fixed-size platform thread pool with a custom name.
     *
     * @param threads The number of platform threads in the pool
     * @param name The name prefix for threads
     * @return A new Dispatcher using platform threads
     */
    public static Dispatcher fixedThreadPoolDispatcher(int threads, String name) {
        int poolSize = Math.max(1, threads);
        AtomicInteger threadNumber = new AtomicInteger(1);
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, runnable -> {
            Thread thread = new Thread(runnable, name + "-" + threadNumber.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        logger.info("Created fixed thread pool dispatcher: {} with {} threads", name, poolSize);
        return new Dispatcher(executor, name);
    }

    /**
     * Wraps an existing executor. The dispatcher takes ownership and shuts it down.
     *
     * @param executor The executor to run actor activations on
     * @param name The dispatcher name, for logging
     * @return A new Dispatcher
     */
    public static Dispatcher fromExecutor(ExecutorService executor, String name) {
        return new Dispatcher(Objects.requireNonNull(executor, "executor"), Objects.requireNonNull(name, "name"));
    }

    /**
     * Schedules an actor runner for execution on the dispatcher's thread pool.
     *
     * @param task The runnable task (typically an ActorRunner) to schedule
     * @return true if the task was accepted, false if the dispatcher is shut down
     */
    public boolean schedule(Runnable task) {
        if (shutdown) {
            logger.warn("Attempted to schedule task on shutdown dispatcher: {}", name);
            return false;
        }
        try {
            executor.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            logger.warn("Dispatcher {} rejected task: {}", name, e.getMessage());
            return false;
        }
    }

    /**
     * Initiates shutdown of the dispatcher.
     * No new tasks will be accepted after this call.
     * Tasks already scheduled still run.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.info("Shutting down dispatcher: {}", name);
        executor.shutdown();
    }

    /**
     * Waits for scheduled tasks to finish after {@link #shutdown()}.
     *
     * @return true if all tasks terminated, false if timeout elapsed
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) {
        try {
            return executor.awaitTermination(timeout, unit);
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for dispatcher {} termination", name);
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Returns whether this dispatcher has been shut down.
     *
     * @return true if shutdown has been initiated
     */
    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Returns the name of this dispatcher.
     *
     * @return The dispatcher name
     */
    public String getName() {
        return name;
    }
}
