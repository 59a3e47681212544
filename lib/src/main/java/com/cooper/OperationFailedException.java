package com.cooper;

/**
 * An operation threw while running against the actor's state.
 * The operation's own throwable is the cause.
 */
public class OperationFailedException extends ActorException {

    public OperationFailedException(String actorId, Throwable cause) {
        super("Operation failed in actor " + actorId + ": " + cause, cause, actorId);
    }
}
