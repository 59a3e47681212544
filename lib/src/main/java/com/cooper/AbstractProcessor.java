package com.cooper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * Owns an actor's state and runs envelopes against it, one at a time.
 * Subclasses decide where the loop runs; this class supplies what every backend shares:
 * failure conversion, lifecycle hooks, the termination decision and the termination itself.
 *
 * Only the single consumer of the mailbox may call {@link #execute}, {@link #terminate}
 * and the lifecycle methods.
 *
 * @param <S> the state type
 */
public abstract class AbstractProcessor<S> {

    private static final Logger logger = LoggerFactory.getLogger(AbstractProcessor.class);
    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    protected final String actorId;
    protected final ActorMailbox<S> mailbox;
    private final TerminationPolicy terminationPolicy;
    private final BiConsumer<String, Throwable> failureHandler;
    private final ActorLifecycle<S> lifecycle;

    private volatile S state;
    private volatile boolean preStartDone = false;
    private final AtomicBoolean terminating = new AtomicBoolean(false);
    private final List<Runnable> terminationListeners = new CopyOnWriteArrayList<>();

    /**
     * @param actorId           the actor id, for logging and errors
     * @param state             the initial state; ownership passes to this processor
     * @param mailbox           the mailbox this processor consumes
     * @param terminationPolicy what to do with queued envelopes once the mailbox closes
     * @param failureHandler    receives failed casts, may be null
     * @param lifecycle         preStart/postStop hooks, may be null
     */
    protected AbstractProcessor(
            String actorId,
            S state,
            ActorMailbox<S> mailbox,
            TerminationPolicy terminationPolicy,
            BiConsumer<String, Throwable> failureHandler,
            ActorLifecycle<S> lifecycle) {
        this.actorId = Objects.requireNonNull(actorId, "actorId");
        this.state = Objects.requireNonNull(state, "state");
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox");
        this.terminationPolicy = Objects.requireNonNull(terminationPolicy, "terminationPolicy");
        this.failureHandler = failureHandler;
        this.lifecycle = lifecycle;
    }

    /**
     * Starts consuming the mailbox. Called once, after the first handle exists.
     */
    public abstract void start();

    public final String getActorId() {
        return actorId;
    }

    public final ActorMailbox<S> mailbox() {
        return mailbox;
    }

    public final ActorStatus status() {
        return mailbox.status();
    }

    public final CompletableFuture<Void> whenTerminated() {
        return mailbox.whenTerminated();
    }

    /**
     * Adds an action run during termination, before {@link #whenTerminated()} completes.
     * Listeners must be added before {@link #start()}.
     */
    public final void addTerminationListener(Runnable listener) {
        terminationListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Runs the preStart hook the first time it is called.
     */
    public final void runPreStart() {
        if (preStartDone) {
            return;
        }
        preStartDone = true;
        if (lifecycle != null) {
            try {
                lifecycle.preStart(state);
            } catch (Throwable t) {
                logger.error("Actor {} preStart hook failed", actorId, t);
            }
        }
    }

    /**
     * Runs one envelope against the state.
     *
     * The returned future completes once the envelope's body, including any stage it returned,
     * has finished and its reply has been delivered. It always completes normally.
     */
    public final CompletableFuture<Void> execute(Envelope<S> envelope) {
        if (envelope.isWakeUp()) {
            return DONE;
        }
        return envelope.invoke(state).handle((value, error) -> {
            if (error == null) {
                envelope.complete(value);
            } else {
                handleFailure(envelope, Envelope.unwrap(error));
            }
            return null;
        });
    }

    private void handleFailure(Envelope<S> envelope, Throwable cause) {
        if (envelope.expectsReply()) {
            logger.debug("Actor {} call failed", actorId, cause);
            envelope.fail(new OperationFailedException(actorId, cause));
            return;
        }
        logger.error("Actor {} cast failed", actorId, cause);
        if (failureHandler != null) {
            try {
                failureHandler.accept(actorId, cause);
            } catch (Throwable handlerError) {
                logger.error("Actor {} failure handler failed", actorId, handlerError);
            }
        }
    }

    /**
     * @return true once the mailbox is closed and, unless queued work is being discarded,
     *         nothing is left to run
     */
    public final boolean shouldTerminate() {
        if (!mailbox.isClosed()) {
            return false;
        }
        if (terminationPolicy == TerminationPolicy.DISCARD_PENDING || mailbox.isForceDiscard()) {
            return true;
        }
        return mailbox.isQueueEmpty();
    }

    /**
     * Discards whatever is still queued, runs postStop and releases the state. Runs once.
     */
    public final void terminate() {
        if (!terminating.compareAndSet(false, true)) {
            return;
        }
        mailbox.close();
        int discarded = mailbox.discardPending();
        S finalState = state;
        if (lifecycle != null && finalState != null) {
            try {
                lifecycle.postStop(finalState);
            } catch (Throwable t) {
                logger.error("Actor {} postStop hook failed", actorId, t);
            }
        }
        state = null;
        for (Runnable listener : terminationListeners) {
            try {
                listener.run();
            } catch (Throwable t) {
                logger.error("Actor {} termination listener failed", actorId, t);
            }
        }
        logger.debug("Actor {} terminated, {} pending envelopes discarded", actorId, discarded);
        mailbox.markTerminated();
    }

    protected final void markRunning() {
        mailbox.markRunning();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{actorId=" + actorId + ", status=" + status() + "}";
    }
}
