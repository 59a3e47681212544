package com.cooper;

/**
 * Synchronous logic run with exclusive access to an actor's state, producing a result.
 *
 * @param <S> the state type
 * @param <R> the result type
 */
@FunctionalInterface
public interface Operation<S, R> {

    R execute(S state) throws Exception;
}
