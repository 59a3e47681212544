package com.cooper;

/**
 * Lifecycle state of an actor instance.
 * Transitions only move forward; nothing leaves TERMINATED.
 */
public enum ActorStatus {
    /** Built but the processor has not run yet. */
    CREATED,
    /** Processing envelopes or idle waiting for one. */
    RUNNING,
    /**
     * All handles are gone. Queued envelopes are being run or discarded; also reported when
     * nothing is queued but the last operation has not finished.
     */
    DRAINING,
    /** The state has been released; every later enqueue fails. */
    TERMINATED
}
