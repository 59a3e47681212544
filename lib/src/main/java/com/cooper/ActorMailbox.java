package com.cooper;

import com.cooper.mailbox.Mailbox;
import com.cooper.mailbox.config.OverflowStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The channel between an actor's handles and its processor.
 *
 * Producer side: handles register here and enqueue envelopes. When the last registered
 * producer is released the mailbox closes and every later enqueue fails.
 * Consumer side: exactly one processor polls envelopes and eventually discards whatever
 * is left once the mailbox is closed.
 *
 * Also carries the actor's observable status, so handles never need a reference to the state.
 *
 * @param <S> the state type of the actor
 */
public final class ActorMailbox<S> {

    private static final Logger logger = LoggerFactory.getLogger(ActorMailbox.class);

    private final String actorId;
    private final Mailbox<Envelope<S>> queue;
    private final OverflowStrategy overflowStrategy;

    private final AtomicInteger producers = new AtomicInteger();
    // producers currently between the closed check and the end of their offer
    private final AtomicInteger pendingOffers = new AtomicInteger();
    // envelopes accepted and not yet taken; the close marker is not counted
    private final AtomicInteger queued = new AtomicInteger();
    private final AtomicReference<ActorStatus> status = new AtomicReference<>(ActorStatus.CREATED);
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private volatile boolean closed = false;
    private volatile boolean forceDiscard = false;
    private volatile Runnable signal = () -> { };

    public ActorMailbox(String actorId, Mailbox<Envelope<S>> queue, OverflowStrategy overflowStrategy) {
        this.actorId = Objects.requireNonNull(actorId, "actorId");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.overflowStrategy = Objects.requireNonNull(overflowStrategy, "overflowStrategy");
    }

    public String getActorId() {
        return actorId;
    }

    /**
     * Sets the action run after every successful enqueue and on close.
     */
    public void onSignal(Runnable signal) {
        this.signal = Objects.requireNonNull(signal, "signal");
    }

    // ========== PRODUCER SIDE ==========

    /**
     * Registers one more producer. The returned registration must be released exactly once;
     * extra releases are ignored.
     */
    public Registration register() {
        producers.incrementAndGet();
        return new Registration(this);
    }

    private void releaseProducer() {
        if (producers.decrementAndGet() == 0) {
            close();
        }
    }

    /**
     * Appends an envelope to the tail of the queue.
     *
     * @throws EnqueueFailedException if the mailbox is closed, full under REJECT,
     *                                or the caller was interrupted while waiting for space
     */
    public void enqueue(Envelope<S> envelope) {
        pendingOffers.incrementAndGet();
        try {
            if (closed) {
                throw new EnqueueFailedException(actorId, EnqueueFailedException.Reason.ACTOR_TERMINATED);
            }
            if (overflowStrategy == OverflowStrategy.REJECT || !queue.isBounded()) {
                if (!queue.offer(envelope)) {
                    throw new EnqueueFailedException(actorId, EnqueueFailedException.Reason.MAILBOX_FULL);
                }
                queued.incrementAndGet();
            } else {
                try {
                    queue.put(envelope);
                    queued.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new EnqueueFailedException(actorId, EnqueueFailedException.Reason.INTERRUPTED, e);
                }
            }
        } finally {
            pendingOffers.decrementAndGet();
        }
        signal.run();
    }

    /**
     * Closes the producer side. Idempotent. Queued envelopes stay until the processor
     * runs or discards them, according to its termination policy.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.debug("Mailbox of actor {} closed with {} envelopes queued", actorId, queue.size());
        // wakes a processor blocked in take()
        pendingOffers.incrementAndGet();
        try {
            queue.offer(Envelope.wakeUp());
        } finally {
            pendingOffers.decrementAndGet();
        }
        signal.run();
    }

    /**
     * Closes the mailbox and makes the processor discard queued envelopes whatever
     * its termination policy.
     */
    public void shutdown() {
        forceDiscard = true;
        close();
    }

    public boolean isClosed() {
        return closed;
    }

    boolean isForceDiscard() {
        return forceDiscard;
    }

    // ========== CONSUMER SIDE (processor only) ==========

    public Envelope<S> poll() {
        return taken(queue.poll());
    }

    public Envelope<S> take() throws InterruptedException {
        return taken(queue.take());
    }

    private Envelope<S> taken(Envelope<S> envelope) {
        if (envelope != null && !envelope.isWakeUp()) {
            queued.decrementAndGet();
        }
        return envelope;
    }

    /**
     * @return true when the queue holds nothing at all, the close marker included
     */
    public boolean isQueueEmpty() {
        return queue.isEmpty();
    }

    /**
     * Empties the queue, resolving every pending call with {@link ActorGoneException}.
     * Waits for producers that passed the closed check before the close to finish their offer,
     * so nothing lands in the queue afterwards. Must only be called after {@link #close()}.
     *
     * @return the number of envelopes discarded
     */
    int discardPending() {
        int discarded = 0;
        while (true) {
            Envelope<S> envelope;
            while ((envelope = queue.poll()) != null) {
                if (!envelope.isWakeUp()) {
                    queued.decrementAndGet();
                    envelope.abandon(actorId);
                    discarded++;
                }
            }
            if (pendingOffers.get() == 0 && queue.isEmpty()) {
                return discarded;
            }
            Thread.onSpinWait();
        }
    }

    // ========== OBSERVERS ==========

    /**
     * @return the number of envelopes waiting to run, not counting the marker queued by close
     */
    public int size() {
        // a consumer may take an envelope before its producer counts it
        return Math.max(0, queued.get());
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int producerCount() {
        return producers.get();
    }

    /**
     * DRAINING is reported from the close until termination completes, also while the queue
     * is already empty and the last operation is still running, so the status never moves back.
     */
    public ActorStatus status() {
        ActorStatus current = status.get();
        if (current != ActorStatus.TERMINATED && closed) {
            return ActorStatus.DRAINING;
        }
        return current;
    }

    public CompletableFuture<Void> whenTerminated() {
        return terminated;
    }

    void markRunning() {
        status.compareAndSet(ActorStatus.CREATED, ActorStatus.RUNNING);
    }

    void markTerminated() {
        status.set(ActorStatus.TERMINATED);
        terminated.complete(null);
    }

    @Override
    public String toString() {
        return "ActorMailbox{actorId=" + actorId + ", size=" + size() + ", producers=" + producers.get()
                + ", closed=" + closed + "}";
    }

    /**
     * One producer's claim on the mailbox.
     */
    public static final class Registration {
        private final ActorMailbox<?> mailbox;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Registration(ActorMailbox<?> mailbox) {
            this.mailbox = mailbox;
        }

        /**
         * Releases this producer. Closes the mailbox when it was the last one.
         */
        public void release() {
            if (released.compareAndSet(false, true)) {
                mailbox.releaseProducer();
            }
        }

        public boolean isReleased() {
            return released.get();
        }
    }
}
