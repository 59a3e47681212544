package com.cooper;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The pending answer to a call.
 * Provides three tiers of API:
 * 1. Simple: get() - just blocks and returns value
 * 2. Safe: await() - returns Result for explicit error handling
 * 3. Advanced: future() - a CompletableFuture for composition
 *
 * A Reply is read-only: nothing done through it can complete the actor's side of the channel.
 */
public interface Reply<T> {

    // ========== TIER 1: SIMPLE API ==========

    /**
     * Blocks until the reply is available and returns the value.
     * {@link ActorException}s ({@link ActorGoneException}, {@link OperationFailedException},
     * {@link EnqueueFailedException}) are rethrown as is; anything else is wrapped in
     * {@link ReplyException}.
     */
    T get();

    /**
     * Blocks until the reply is available or the timeout expires.
     * @throws TimeoutException if timeout expires before reply
     */
    T get(Duration timeout) throws TimeoutException;

    // ========== TIER 2: SAFE API ==========

    /**
     * Blocks until the reply is available and returns a Result. Never throws.
     */
    Result<T> await();

    /**
     * Blocks until the reply is available or the timeout expires.
     * Returns Result with TimeoutException on timeout.
     */
    Result<T> await(Duration timeout);

    /**
     * Non-blocking check if the reply is available.
     * Returns empty Optional if not yet complete.
     */
    Optional<Result<T>> poll();

    /**
     * @return true once the reply has a value or an error
     */
    boolean isDone();

    // ========== TIER 3: ADVANCED API ==========

    /**
     * A future completing with the reply. Completing it has no effect on the actor.
     */
    CompletableFuture<T> future();

    // ========== MONADIC OPERATIONS ==========

    /**
     * Transform the reply value when it arrives.
     */
    <U> Reply<U> map(Function<T, U> fn);

    /**
     * Chain another reply, e.g. a call on a second actor.
     */
    <U> Reply<U> flatMap(Function<T, Reply<U>> fn);

    /**
     * Provide a fallback value if the call fails.
     */
    Reply<T> recover(Function<Throwable, T> fn);

    // ========== CALLBACK API ==========

    /**
     * Register callbacks for success and failure.
     * Non-blocking.
     */
    void onComplete(Consumer<T> onSuccess, Consumer<Throwable> onFailure);

    /**
     * Register callback for success only.
     * Non-blocking.
     */
    void onSuccess(Consumer<T> onSuccess);

    /**
     * Register callback for failure only.
     * Non-blocking.
     */
    void onFailure(Consumer<Throwable> onFailure);

    // ========== FACTORY METHODS ==========

    /**
     * Create a Reply from a CompletableFuture.
     */
    static <T> Reply<T> from(CompletableFuture<T> future) {
        return new PendingReply<>(future);
    }

    /**
     * Create an already-completed successful Reply.
     */
    static <T> Reply<T> completed(T value) {
        return new PendingReply<>(CompletableFuture.completedFuture(value));
    }

    /**
     * Create an already-failed Reply.
     */
    static <T> Reply<T> failed(Throwable error) {
        return new PendingReply<>(CompletableFuture.failedFuture(error));
    }
}
