package com.cooper;

/**
 * Defines lifecycle callbacks for an actor, run on the actor's processor.
 *
 * @param <S> The type of the actor's state
 */
public interface ActorLifecycle<S> {

    /** Called before the first envelope is processed. */
    default void preStart(S state) {
    }

    /** Called once when the actor terminates, before the state is released. */
    default void postStop(S state) {
    }
}
