package com.cooper;

/**
 * The actor stopped before producing the reply a call was waiting for.
 * Recoverable: the caller decides whether to retry against another actor or give up.
 */
public class ActorGoneException extends ActorException {

    public ActorGoneException(String actorId) {
        super("Actor " + actorId + " terminated before replying", actorId);
    }

    public ActorGoneException(String actorId, Throwable cause) {
        super("Actor " + actorId + " terminated before replying", cause, actorId);
    }
}
