package com.cooper.mailbox;

/**
 * The queue behind an actor: many producers append, a single consumer removes.
 * Envelopes leave in the order they were accepted, whichever producer offered them.
 *
 * @param <T> the element type
 */
public interface Mailbox<T> {

    /**
     * Appends without waiting.
     *
     * @return false if the mailbox is at capacity
     */
    boolean offer(T message);

    /**
     * Appends, waiting while the mailbox is at capacity.
     *
     * @throws InterruptedException if interrupted while waiting for space
     */
    void put(T message) throws InterruptedException;

    /**
     * @return the oldest element, or null if there is none
     */
    T poll();

    /**
     * Removes the oldest element, waiting until one arrives. Consumer only.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    T take() throws InterruptedException;

    int size();

    boolean isEmpty();

    /**
     * @return the maximum number of queued elements, Integer.MAX_VALUE when unbounded
     */
    int capacity();

    default boolean isBounded() {
        return capacity() != Integer.MAX_VALUE;
    }
}
