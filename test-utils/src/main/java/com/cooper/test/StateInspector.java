package com.cooper.test;

import com.cooper.ActorHandle;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Inspector for examining an actor's state during testing.
 *
 * The state is never touched from the test thread: every read runs as a call on the actor
 * and returns a snapshot made by the given copy function, so it sees every operation
 * queued before it through the same handle.
 *
 * <p>Usage:
 * <pre>{@code
 * try (StateInspector<List<String>, List<String>> inspector =
 *          StateInspector.create(list, List::copyOf, Duration.ofSeconds(2))) {
 *     list.cast(l -> l.add("a"));
 *     assertEquals(List.of("a"), inspector.current());
 * }
 * }</pre>
 *
 * The inspector holds its own handle, so the actor stays alive until the inspector is closed.
 *
 * @param <S> the state type of the actor
 * @param <V> the snapshot type
 */
public final class StateInspector<S, V> implements AutoCloseable {

    private final ActorHandle<S> handle;
    private final Function<S, V> snapshot;
    private final Duration timeout;

    private StateInspector(ActorHandle<S> handle, Function<S, V> snapshot, Duration timeout) {
        this.handle = handle;
        this.snapshot = snapshot;
        this.timeout = timeout;
    }

    /**
     * Creates an inspector with its own handle to the actor.
     *
     * @param handle a handle to the actor; it stays owned by the caller
     * @param snapshot copies the part of the state to inspect; runs on the actor
     * @param timeout how long each read may wait
     */
    public static <S, V> StateInspector<S, V> create(ActorHandle<S> handle, Function<S, V> snapshot, Duration timeout) {
        Objects.requireNonNull(handle, "handle cannot be null");
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        return new StateInspector<>(handle.copy(), snapshot, timeout);
    }

    /**
     * Gets a snapshot of the current state.
     *
     * @throws AssertionError if the actor does not answer within the timeout
     */
    public V current() {
        return CallTestHelper.call(handle, snapshot::apply, timeout);
    }

    /**
     * Gets the current snapshot as an Optional, empty if the snapshot is null.
     */
    public Optional<V> currentOptional() {
        return Optional.ofNullable(current());
    }

    /**
     * Checks if the snapshot equals the expected value.
     */
    public boolean stateEquals(V expected) {
        return Objects.equals(expected, current());
    }

    /**
     * Gets the number of envelopes queued and not yet started.
     * Useful for verifying processing progress.
     */
    public int pendingCount() {
        return handle.pendingCount();
    }

    @Override
    public void close() {
        handle.close();
    }
}
