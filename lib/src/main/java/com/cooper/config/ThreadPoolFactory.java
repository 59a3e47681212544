package com.cooper.config;

import com.cooper.dispatcher.Dispatcher;

/**
 * Factory for the threads used in the actor system.
 * Centralizes creation of the cooperative dispatcher pool and of the dedicated
 * threads used by thread-backed actors, making it easier to tune resource usage.
 */
public class ThreadPoolFactory {
    // Default values
    private static final int DEFAULT_POOL_SIZE = Runtime.getRuntime().availableProcessors();
    private static final int DEFAULT_ACTOR_BATCH_SIZE = 64;
    private static final int DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 10;

    // Dispatcher configuration
    private ThreadPoolType executorType = ThreadPoolType.FORK_JOIN;
    private int poolSize = DEFAULT_POOL_SIZE;
    private boolean useNamedThreads = true;

    // Actor execution configuration
    private boolean daemonActorThreads = true;
    private int actorBatchSize = DEFAULT_ACTOR_BATCH_SIZE;
    private int shutdownTimeoutSeconds = DEFAULT_SHUTDOWN_TIMEOUT_SECONDS;

    /**
     * Enum defining the types of thread pools the dispatcher can use.
     */
    public enum ThreadPoolType {
        /**
         * ForkJoinPool in async (FIFO) mode.
         * Best for many actors with short activations.
         */
        FORK_JOIN,

        /**
         * Fixed pool of platform threads.
         * Good when a known, stable thread count is wanted.
         */
        FIXED
    }

    /**
     * Creates a new ThreadPoolFactory with default settings.
     */
    public ThreadPoolFactory() {
        // Use defaults
    }

    /**
     * Creates the dispatcher shared by cooperative actors.
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new dispatcher
     */
    public Dispatcher createDispatcher(String poolName) {
        switch (executorType) {
            case FORK_JOIN:
                return Dispatcher.forkJoinDispatcher(useNamedThreads ? poolName : "ForkJoinPool", poolSize);
            case FIXED:
                return Dispatcher.fixedThreadPoolDispatcher(poolSize, useNamedThreads ? poolName : "pool");
            default:
                throw new IllegalStateException("Unknown executor type: " + executorType);
        }
    }

    /**
     * Creates the unstarted dedicated thread of a thread-backed actor.
     *
     * @param actorId The actor the thread runs
     * @param loop The processor loop
     * @return A new, unstarted thread
     */
    public Thread createActorThread(String actorId, Runnable loop) {
        Thread thread = useNamedThreads ? new Thread(loop, "actor-" + actorId) : new Thread(loop);
        thread.setDaemon(daemonActorThreads);
        return thread;
    }

    // Getters and setters

    public ThreadPoolType getExecutorType() {
        return executorType;
    }

    public ThreadPoolFactory setExecutorType(ThreadPoolType executorType) {
        if (executorType == null) {
            throw new IllegalArgumentException("Executor type cannot be null");
        }
        this.executorType = executorType;
        return this;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public ThreadPoolFactory setPoolSize(int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1, got: " + poolSize);
        }
        this.poolSize = poolSize;
        return this;
    }

    public boolean isUseNamedThreads() {
        return useNamedThreads;
    }

    public ThreadPoolFactory setUseNamedThreads(boolean useNamedThreads) {
        this.useNamedThreads = useNamedThreads;
        return this;
    }

    public boolean isDaemonActorThreads() {
        return daemonActorThreads;
    }

    public ThreadPoolFactory setDaemonActorThreads(boolean daemonActorThreads) {
        this.daemonActorThreads = daemonActorThreads;
        return this;
    }

    public int getActorBatchSize() {
        return actorBatchSize;
    }

    /**
     * Sets how many envelopes a cooperative actor runs per activation before yielding its worker.
     */
    public ThreadPoolFactory setActorBatchSize(int actorBatchSize) {
        this.actorBatchSize = Math.max(1, actorBatchSize);
        return this;
    }

    public int getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public ThreadPoolFactory setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        return this;
    }
}
