package com.cooper;

/**
 * Thrown, or carried in a failed {@link Result}, when an envelope could not be put
 * into an actor's mailbox.
 */
public class EnqueueFailedException extends ActorException {

    /**
     * Why the enqueue failed.
     */
    public enum Reason {
        /** The actor has terminated or is terminating; its mailbox is closed. */
        ACTOR_TERMINATED,
        /** A bounded mailbox with the REJECT strategy is full. */
        MAILBOX_FULL,
        /** The handle used for the enqueue was already closed. */
        HANDLE_CLOSED,
        /** The producer was interrupted while waiting for space. */
        INTERRUPTED
    }

    private final Reason reason;

    public EnqueueFailedException(String actorId, Reason reason) {
        super("Cannot enqueue to actor " + actorId + ": " + reason, actorId);
        this.reason = reason;
    }

    public EnqueueFailedException(String actorId, Reason reason, Throwable cause) {
        super("Cannot enqueue to actor " + actorId + ": " + reason, cause, actorId);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
