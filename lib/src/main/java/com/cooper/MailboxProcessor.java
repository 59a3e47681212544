package com.cooper;

import com.cooper.config.ThreadPoolFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Processor that owns a dedicated platform thread.
 * The thread blocks in the mailbox while idle, and blocks on any stage an operation
 * returns, so blocking work never holds up other actors.
 *
 * @param <S> the state type
 */
public class MailboxProcessor<S> extends AbstractProcessor<S> {
    private static final Logger logger = LoggerFactory.getLogger(MailboxProcessor.class);

    private final ThreadPoolFactory threadPoolFactory;
    private volatile Thread thread;

    public MailboxProcessor(
            String actorId,
            S state,
            ActorMailbox<S> mailbox,
            TerminationPolicy terminationPolicy,
            BiConsumer<String, Throwable> failureHandler,
            ActorLifecycle<S> lifecycle,
            ThreadPoolFactory threadPoolFactory) {
        super(actorId, state, mailbox, terminationPolicy, failureHandler, lifecycle);
        this.threadPoolFactory = Objects.requireNonNull(threadPoolFactory, "threadPoolFactory");
    }

    @Override
    public void start() {
        if (thread != null) {
            logger.debug("Actor {} thread already running", actorId);
            return;
        }
        logger.info("Starting actor {} on a dedicated thread", actorId);
        markRunning();
        thread = threadPoolFactory.createActorThread(actorId, this::processMailboxLoop);
        thread.start();
    }

    /**
     * @return the thread running this actor, or null before start
     */
    public Thread getThread() {
        return thread;
    }

    private void processMailboxLoop() {
        try {
            runPreStart();
            while (!shouldTerminate()) {
                Envelope<S> envelope;
                try {
                    envelope = mailbox.take();
                } catch (InterruptedException e) {
                    // only the mailbox closing ends the loop
                    logger.debug("Actor {} interrupted while idle, resuming", actorId);
                    continue;
                }
                execute(envelope).join();
                if (Thread.interrupted()) {
                    logger.debug("Actor {} cleared an interrupt left by an operation", actorId);
                }
            }
        } finally {
            terminate();
        }
    }
}
