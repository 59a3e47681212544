package com.cooper;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Result type for explicit, non-throwing error handling.
 * Sealed to ensure exhaustive handling.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * Successful result containing a value.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElse(Function<Throwable, T> fn) {
            return value;
        }
    }

    /**
     * Failed result containing an error.
     */
    record Failure<T>(Throwable error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            if (error instanceof RuntimeException re) {
                throw re;
            }
            if (error instanceof Error err) {
                throw err;
            }
            throw new ReplyException("Operation failed", error);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElse(Function<Throwable, T> fn) {
            return fn.apply(error);
        }
    }

    // Common operations
    boolean isSuccess();
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElse(Function<Throwable, T> fn);

    default boolean isFailure() {
        return !isSuccess();
    }

    // Monadic operations
    default <U> Result<U> map(Function<T, U> fn) {
        if (this instanceof Success<T> s) {
            try {
                return new Success<>(fn.apply(s.value()));
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }
        return new Failure<>(((Failure<T>) this).error());
    }

    default <U> Result<U> flatMap(Function<T, Result<U>> fn) {
        if (this instanceof Success<T> s) {
            try {
                return fn.apply(s.value());
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }
        return new Failure<>(((Failure<T>) this).error());
    }

    default Result<T> recover(Function<Throwable, T> fn) {
        if (this instanceof Failure<T> f) {
            try {
                return new Success<>(fn.apply(f.error()));
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }
        return this;
    }

    default void ifSuccess(Consumer<T> consumer) {
        if (this instanceof Success<T> s) {
            consumer.accept(s.value());
        }
    }

    default void ifFailure(Consumer<Throwable> consumer) {
        if (this instanceof Failure<T> f) {
            consumer.accept(f.error());
        }
    }

    // Factory methods
    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Throwable error) {
        return new Failure<>(error);
    }

    /**
     * Execute code that might throw and wrap in Result.
     */
    static <T> Result<T> attempt(ThrowingSupplier<T> supplier) {
        try {
            return new Success<>(supplier.get());
        } catch (Exception e) {
            return new Failure<>(e);
        }
    }

    @FunctionalInterface
    interface ThrowingSupplier<T> {
        T get() throws Exception;
    }
}
