package com.cooper;

/**
 * What happens to envelopes still queued when the last handle is closed.
 */
public enum TerminationPolicy {
    /**
     * Queued envelopes are discarded unexecuted. Their calls fail with {@link ActorGoneException}.
     * The envelope running at that moment completes normally.
     */
    DISCARD_PENDING,

    /**
     * Everything already queued runs before the actor terminates.
     */
    DRAIN_PENDING
}
