package com.cooper;

/**
 * Fire-and-forget logic run with exclusive access to an actor's state.
 *
 * @param <S> the state type
 */
@FunctionalInterface
public interface Command<S> {

    void execute(S state) throws Exception;
}
