package com.cooper;

/**
 * Execution strategy for an actor's processor.
 */
public enum Backend {
    /** Scheduled on the shared dispatcher pool together with other actors. */
    COOPERATIVE,
    /** Runs on a dedicated platform thread owned by the actor. */
    THREAD
}
