package com.cooper.mailbox;

import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * {@link Mailbox} on a {@link LinkedBlockingQueue}. The default choice: consumers park in
 * {@link #take()} without spinning, which suits actors that own a thread, and a bound makes
 * {@link #put} wait for space.
 *
 * @param <T> the element type
 */
public class LinkedMailbox<T> implements Mailbox<T> {

    private final LinkedBlockingQueue<T> delegate;

    public LinkedMailbox() {
        this(Integer.MAX_VALUE);
    }

    /**
     * @param capacity the bound, or Integer.MAX_VALUE for none
     */
    public LinkedMailbox(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive, got: " + capacity);
        }
        this.delegate = new LinkedBlockingQueue<>(capacity);
    }

    @Override
    public boolean offer(T message) {
        return delegate.offer(Objects.requireNonNull(message, "message"));
    }

    @Override
    public void put(T message) throws InterruptedException {
        delegate.put(Objects.requireNonNull(message, "message"));
    }

    @Override
    public T poll() {
        return delegate.poll();
    }

    @Override
    public T take() throws InterruptedException {
        return delegate.take();
    }

    @Override
    public int size() {
        return delegate.size();
    }

    @Override
    public boolean isEmpty() {
        return delegate.isEmpty();
    }

    @Override
    public int capacity() {
        // LinkedBlockingQueue keeps size + remaining equal to its bound
        int remaining = delegate.remainingCapacity();
        return remaining == Integer.MAX_VALUE ? remaining : remaining + delegate.size();
    }

    @Override
    public String toString() {
        return "LinkedMailbox{size=" + delegate.size() + ", capacity=" + capacity() + "}";
    }
}
