package com.cooper;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * A unit of work travelling through an actor's mailbox: an operation body with the
 * result type erased, plus the reply channel when the caller waits for an answer.
 *
 * @param <S> the state type of the target actor
 */
public final class Envelope<S> {

    private enum Kind { CAST, CALL, WAKE_UP }

    private static final Envelope<?> WAKE_UP = new Envelope<>(Kind.WAKE_UP, state -> null, null);

    private final Kind kind;
    private final AsyncCommand<S> body;
    private final CompletableFuture<Object> reply;

    private Envelope(Kind kind, AsyncCommand<S> body, CompletableFuture<Object> reply) {
        this.kind = kind;
        this.body = body;
        this.reply = reply;
    }

    /**
     * Wraps a fire-and-forget command.
     */
    public static <S> Envelope<S> cast(AsyncCommand<S> command) {
        Objects.requireNonNull(command, "command");
        return new Envelope<>(Kind.CAST, command, null);
    }

    /**
     * Wraps an operation whose result completes {@code reply}.
     */
    @SuppressWarnings("unchecked")
    public static <S, R> Envelope<S> call(AsyncOperation<S, R> operation, CompletableFuture<R> reply) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(reply, "reply");
        CompletableFuture<Object> erased = (CompletableFuture<Object>) (CompletableFuture<?>) reply;
        return new Envelope<>(Kind.CALL, operation::execute, erased);
    }

    @SuppressWarnings("unchecked")
    static <S> Envelope<S> wakeUp() {
        return (Envelope<S>) WAKE_UP;
    }

    /**
     * Runs the body against the state. The returned future completes when the body's
     * stage does; it never throws, failures are carried in the future.
     */
    CompletableFuture<Object> invoke(S state) {
        CompletableFuture<Object> outcome = new CompletableFuture<>();
        try {
            CompletionStage<?> stage = body.execute(state);
            if (stage == null) {
                outcome.complete(null);
            } else {
                stage.whenComplete((value, error) -> {
                    if (error != null) {
                        outcome.completeExceptionally(unwrap(error));
                    } else {
                        outcome.complete(value);
                    }
                });
            }
        } catch (Throwable t) {
            outcome.completeExceptionally(t);
        }
        return outcome;
    }

    void complete(Object value) {
        if (reply != null) {
            reply.complete(value);
        }
    }

    void fail(Throwable error) {
        if (reply != null) {
            reply.completeExceptionally(error);
        }
    }

    /**
     * Resolves the reply with {@link ActorGoneException}; the body never runs.
     */
    void abandon(String actorId) {
        fail(new ActorGoneException(actorId));
    }

    public boolean expectsReply() {
        return kind == Kind.CALL;
    }

    public boolean isWakeUp() {
        return kind == Kind.WAKE_UP;
    }

    static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
    }

    @Override
    public String toString() {
        return "Envelope{" + kind + "}";
    }
}
