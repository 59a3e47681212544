package com.cooper;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Implementation of Reply backed by CompletableFuture.
 */
record PendingReply<T>(CompletableFuture<T> source) implements Reply<T> {

    // ========== TIER 1: SIMPLE API ==========

    @Override
    public T get() {
        try {
            return source.get();
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        } catch (CancellationException e) {
            throw new ReplyException("Reply was cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReplyException("Interrupted while waiting for reply", e);
        }
    }

    @Override
    public T get(Duration timeout) throws TimeoutException {
        try {
            return source.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        } catch (CancellationException e) {
            throw new ReplyException("Reply was cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReplyException("Interrupted while waiting for reply", e);
        }
    }

    // ========== TIER 2: SAFE API ==========

    @Override
    public Result<T> await() {
        try {
            return Result.success(source.get());
        } catch (ExecutionException e) {
            return Result.failure(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(e);
        } catch (Exception e) {
            return Result.failure(e);
        }
    }

    @Override
    public Result<T> await(Duration timeout) {
        try {
            return Result.success(source.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (ExecutionException e) {
            return Result.failure(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(e);
        } catch (Exception e) {
            return Result.failure(e);
        }
    }

    @Override
    public Optional<Result<T>> poll() {
        if (!source.isDone()) {
            return Optional.empty();
        }
        return Optional.of(await());
    }

    @Override
    public boolean isDone() {
        return source.isDone();
    }

    // ========== TIER 3: ADVANCED API ==========

    @Override
    public CompletableFuture<T> future() {
        return source.copy();
    }

    // ========== MONADIC OPERATIONS ==========

    @Override
    public <U> Reply<U> map(Function<T, U> fn) {
        return new PendingReply<>(source.thenApply(fn));
    }

    @Override
    public <U> Reply<U> flatMap(Function<T, Reply<U>> fn) {
        CompletableFuture<U> composed = source.thenCompose(value ->
            fn.apply(value).future()
        );
        return new PendingReply<>(composed);
    }

    @Override
    public Reply<T> recover(Function<Throwable, T> fn) {
        return new PendingReply<>(source.exceptionally(error -> fn.apply(unwrap(error))));
    }

    // ========== CALLBACK API ==========

    @Override
    public void onComplete(Consumer<T> onSuccess, Consumer<Throwable> onFailure) {
        source.whenComplete((value, error) -> {
            if (error != null) {
                onFailure.accept(unwrap(error));
            } else {
                onSuccess.accept(value);
            }
        });
    }

    @Override
    public void onSuccess(Consumer<T> onSuccess) {
        source.thenAccept(onSuccess);
    }

    @Override
    public void onFailure(Consumer<Throwable> onFailure) {
        source.whenComplete((value, error) -> {
            if (error != null) {
                onFailure.accept(unwrap(error));
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null
            ? error.getCause()
            : error;
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof ActorException ae) {
            return ae;
        }
        return new ReplyException("Call failed", cause);
    }
}
