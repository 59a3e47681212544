package com.cooper;

import java.util.concurrent.CompletionStage;

/**
 * Logic that may suspend while holding an actor's state.
 * The actor runs nothing else until the returned stage completes, so the state
 * may be read and written from its continuations. A null stage counts as a null result.
 *
 * @param <S> the state type
 * @param <R> the result type
 */
@FunctionalInterface
public interface AsyncOperation<S, R> {

    CompletionStage<R> execute(S state) throws Exception;
}
