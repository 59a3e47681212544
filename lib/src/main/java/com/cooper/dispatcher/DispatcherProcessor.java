package com.cooper.dispatcher;

import com.cooper.AbstractProcessor;
import com.cooper.ActorLifecycle;
import com.cooper.ActorMailbox;
import com.cooper.TerminationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Processor that shares a {@link Dispatcher} thread pool with other actors instead of
 * owning a thread. Each enqueue signals an {@link ActorRunner}, which runs a batch of
 * envelopes and returns the worker thread when the mailbox is empty or an operation suspends.
 *
 * @param <S> The state type
 */
public class DispatcherProcessor<S> extends AbstractProcessor<S> {

    private static final Logger logger = LoggerFactory.getLogger(DispatcherProcessor.class);

    private final ActorRunner<S> runner;
    private volatile boolean started = false;

    /**
     * Creates a new DispatcherProcessor.
     *
     * @param actorId The ID of the actor for logging
     * @param state The initial state
     * @param mailbox The mailbox to consume
     * @param terminationPolicy What to do with queued envelopes after the mailbox closes
     * @param failureHandler Handler for failed casts, may be null
     * @param lifecycle Lifecycle callbacks, may be null
     * @param dispatcher The dispatcher for scheduling actor runs
     * @param throughput Maximum envelopes to process per activation
     */
    public DispatcherProcessor(
            String actorId,
            S state,
            ActorMailbox<S> mailbox,
            TerminationPolicy terminationPolicy,
            BiConsumer<String, Throwable> failureHandler,
            ActorLifecycle<S> lifecycle,
            Dispatcher dispatcher,
            int throughput) {
        super(actorId, state, mailbox, terminationPolicy, failureHandler, lifecycle);
        Objects.requireNonNull(dispatcher, "dispatcher");
        this.runner = new ActorRunner<>(this, dispatcher, throughput);
        logger.debug("Created DispatcherProcessor for actor {} on dispatcher {} with throughput {}",
                actorId, dispatcher.getName(), runner.getThroughput());
    }

    /**
     * Starts the processor. Envelopes enqueued before this call run afterwards, in order.
     */
    @Override
    public void start() {
        if (started) {
            logger.debug("Actor {} dispatcher processor already running", actorId);
            return;
        }
        started = true;
        logger.info("Starting actor {} on dispatcher", actorId);
        markRunning();
        mailbox.onSignal(runner::signal);
        runner.signal();
    }

    ActorRunner<S> getRunner() {
        return runner;
    }
}
