package com.cooper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.lang.ref.Reference;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A producer-side reference to an actor.
 *
 * Every operation on the state goes through a handle: {@link #cast} to fire and forget,
 * {@link #call} to get a result, {@link #flush} to wait for earlier work. Handles never
 * hold the state. {@link #copy()} creates another handle to the same actor; the actor
 * terminates when every handle has been closed.
 *
 * A handle that becomes unreachable without being closed is released by a {@link Cleaner}.
 * Relying on that delays termination until the next garbage collection; close handles explicitly,
 * typically with try-with-resources.
 *
 * <pre>{@code
 * try (ActorHandle<List<Integer>> list = system.actorOf(new ArrayList<Integer>()).spawn()) {
 *     list.cast(l -> l.add(1));
 *     int size = list.call(List::size).get();
 * }
 * }</pre>
 *
 * @param <S> the state type
 */
public final class ActorHandle<S> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ActorHandle.class);
    private static final Cleaner CLEANER = Cleaner.create();

    private final ActorMailbox<S> mailbox;
    private final Release release;
    private final Cleaner.Cleanable cleanable;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a handle registered as a new producer on the mailbox.
     *
     * @param mailbox the actor's mailbox
     */
    public ActorHandle(ActorMailbox<S> mailbox) {
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox");
        this.release = new Release(mailbox.getActorId(), mailbox.register());
        this.cleanable = CLEANER.register(this, release);
    }

    // ========== CAST ==========

    /**
     * Queues a command and returns without waiting for it to run.
     *
     * @return success once queued, or a failure holding {@link EnqueueFailedException}
     */
    public Result<Void> cast(Command<S> command) {
        Objects.requireNonNull(command, "command");
        return castAsync(state -> {
            command.execute(state);
            return null;
        });
    }

    /**
     * Queues a command that may suspend. The actor runs nothing else until the
     * command's stage completes.
     *
     * @return success once queued, or a failure holding {@link EnqueueFailedException}
     */
    public Result<Void> castAsync(AsyncCommand<S> command) {
        Objects.requireNonNull(command, "command");
        try {
            enqueue(Envelope.cast(command));
            return Result.success(null);
        } catch (EnqueueFailedException e) {
            return Result.failure(e);
        }
    }

    // ========== CALL ==========

    /**
     * Queues an operation and returns a reply for its result.
     *
     * The reply fails with {@link OperationFailedException} if the operation throws, and with
     * {@link ActorGoneException} if the actor terminates before running it.
     */
    public <R> Reply<R> call(Operation<S, R> operation) {
        Objects.requireNonNull(operation, "operation");
        return callAsync(state -> CompletableFuture.completedFuture(operation.execute(state)));
    }

    /**
     * Queues an operation that may suspend. The reply completes with the value of the
     * stage the operation returns.
     */
    public <R> Reply<R> callAsync(AsyncOperation<S, R> operation) {
        Objects.requireNonNull(operation, "operation");
        CompletableFuture<R> reply = new CompletableFuture<>();
        try {
            enqueue(Envelope.call(operation, reply));
        } catch (EnqueueFailedException e) {
            if (e.getReason() == EnqueueFailedException.Reason.ACTOR_TERMINATED) {
                return Reply.failed(new ActorGoneException(e.getActorId(), e));
            }
            return Reply.failed(e);
        }
        return Reply.from(reply);
    }

    /**
     * Returns a reply that completes once everything queued earlier through this handle has run.
     * Gives no ordering against other handles enqueueing concurrently.
     */
    public Reply<Void> flush() {
        return call(state -> null);
    }

    private void enqueue(Envelope<S> envelope) {
        try {
            if (closed.get()) {
                throw new EnqueueFailedException(mailbox.getActorId(), EnqueueFailedException.Reason.HANDLE_CLOSED);
            }
            mailbox.enqueue(envelope);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    // ========== HANDLE LIFECYCLE ==========

    /**
     * Creates another handle to the same actor and state.
     *
     * @throws IllegalStateException if this handle is closed
     */
    public ActorHandle<S> copy() {
        if (closed.get()) {
            throw new IllegalStateException("Handle for actor " + mailbox.getActorId() + " is closed");
        }
        return new ActorHandle<>(mailbox);
    }

    /**
     * Releases this handle. Closing the last handle terminates the actor. Idempotent.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            release.explicit = true;
            cleanable.clean();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    // ========== OBSERVERS ==========

    public String id() {
        return mailbox.getActorId();
    }

    public ActorStatus status() {
        return mailbox.status();
    }

    /**
     * @return the number of envelopes queued and not yet started
     */
    public int pendingCount() {
        return mailbox.size();
    }

    /**
     * @return a future completing once the actor has terminated and released its state
     */
    public CompletableFuture<Void> whenTerminated() {
        return mailbox.whenTerminated().copy();
    }

    @Override
    public String toString() {
        return "ActorHandle{id=" + id() + ", status=" + status() + (closed.get() ? ", closed" : "") + "}";
    }

    /**
     * Cleaning action; must not reference the handle.
     */
    private static final class Release implements Runnable {
        private final String actorId;
        private final ActorMailbox.Registration registration;
        private volatile boolean explicit = false;

        private Release(String actorId, ActorMailbox.Registration registration) {
            this.actorId = actorId;
            this.registration = registration;
        }

        @Override
        public void run() {
            if (!explicit) {
                logger.debug("Handle for actor {} was never closed; released by cleaner", actorId);
            }
            registration.release();
        }
    }
}
