package com.cooper.dispatcher;

import com.cooper.AbstractProcessor;
import com.cooper.ActorMailbox;
import com.cooper.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ActorRunner processes envelopes from an actor's mailbox in batches on a {@link Dispatcher}.
 *
 * Key features:
 * - Batch processing: Processes up to 'throughput' envelopes per activation
 * - Suspension: when an envelope's stage is still pending, the activation ends without
 *   releasing the actor; the stage's completion schedules the next activation
 * - Coalesced execution: the scheduled flag allows at most one activation per actor at a time
 * - Termination: once the processor says so, the runner terminates it from inside an activation,
 *   so termination happens on the mailbox's only consumer
 *
 * @param <S> The state type of the actor
 */
public final class ActorRunner<S> implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ActorRunner.class);

    private final AbstractProcessor<S> processor;
    private final ActorMailbox<S> mailbox;
    private final Dispatcher dispatcher;
    private final int throughput;
    private final AtomicBoolean scheduled = new AtomicBoolean(false);

    /**
     * Creates an ActorRunner.
     *
     * @param processor The processor that owns the state
     * @param dispatcher The dispatcher for (re-)scheduling
     * @param throughput Maximum number of envelopes to process per activation
     */
    public ActorRunner(AbstractProcessor<S> processor, Dispatcher dispatcher, int throughput) {
        this.processor = Objects.requireNonNull(processor, "processor");
        this.mailbox = processor.mailbox();
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.throughput = Math.max(1, throughput);
    }

    /**
     * Requests an activation. Does nothing if one is already scheduled, running or suspended.
     */
    public void signal() {
        if (scheduled.compareAndSet(false, true)) {
            submit();
        }
    }

    /**
     * Processes up to 'throughput' envelopes from the mailbox.
     */
    @Override
    public void run() {
        processor.runPreStart();
        int processed = 0;
        while (processed < throughput) {
            if (processor.shouldTerminate()) {
                processor.terminate();
                return;
            }
            Envelope<S> envelope = mailbox.poll();
            if (envelope == null) {
                break;
            }
            CompletableFuture<Void> done = processor.execute(envelope);
            processed++;
            if (!done.isDone()) {
                logger.trace("Actor {} suspended after {} envelopes", processor.getActorId(), processed);
                // keep the scheduled flag: nothing else may run until this envelope finishes
                done.whenComplete((ignored, error) -> submit());
                return;
            }
        }

        if (processed > 0) {
            logger.trace("Actor {} processed {} envelopes", processor.getActorId(), processed);
        }

        // Clear the flag, then re-check so an envelope offered meanwhile is not missed
        scheduled.set(false);
        if ((!mailbox.isQueueEmpty() || processor.shouldTerminate()) && scheduled.compareAndSet(false, true)) {
            submit();
        }
    }

    /**
     * Schedules the next activation; the caller holds the scheduled flag.
     */
    private void submit() {
        if (!dispatcher.schedule(this)) {
            // No worker will ever run this actor again; terminate here while holding the flag
            processor.terminate();
        }
    }

    /**
     * @return true while an activation is scheduled, running or suspended
     */
    public boolean isScheduled() {
        return scheduled.get();
    }

    /**
     * Gets the throughput (batch size) of this runner.
     *
     * @return The maximum envelopes per activation
     */
    public int getThroughput() {
        return throughput;
    }
}
