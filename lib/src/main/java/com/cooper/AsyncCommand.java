package com.cooper;

import java.util.concurrent.CompletionStage;

/**
 * Fire-and-forget logic that may suspend while holding an actor's state.
 *
 * @param <S> the state type
 */
@FunctionalInterface
public interface AsyncCommand<S> {

    CompletionStage<?> execute(S state) throws Exception;
}
