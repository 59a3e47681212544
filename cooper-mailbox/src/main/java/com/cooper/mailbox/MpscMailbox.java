package com.cooper.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.LockSupport;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link Mailbox} on a JCTools multi-producer single-consumer queue. Offers never take a lock;
 * {@link #take()} parks on a condition only when the queue is empty. The optional bound is soft:
 * it is checked against an estimated size before each offer, so racing producers may overshoot it.
 *
 * @param <T> The type of messages
 */
public class MpscMailbox<T> implements Mailbox<T> {

    static final int DEFAULT_CHUNK_SIZE = 128;

    // Upper bound on a single park, so a missed signal only costs latency
    private static final long MAX_PARK_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    private final MpscUnboundedArrayQueue<T> queue;
    private final ReentrantLock lock;
    private final Condition notEmpty;
    private final int chunkSize;
    private final int capacity;
    private volatile boolean hasWaitingConsumers = false;

    private final AtomicLong totalMessagesOffered = new AtomicLong();
    private final AtomicLong totalMessagesRejected = new AtomicLong();

    /**
     * Creates an unbounded MPSC mailbox with the default chunk size (128).
     */
    public MpscMailbox() {
        this(DEFAULT_CHUNK_SIZE);
    }

    /**
     * Creates an unbounded MPSC mailbox with the specified chunk size.
     * The chunk size only controls allocation granularity; the queue grows automatically.
     *
     * @param chunkSize the initial chunk size, rounded up to a power of 2
     */
    public MpscMailbox(int chunkSize) {
        this(chunkSize, Integer.MAX_VALUE);
    }

    /**
     * Creates an MPSC mailbox with a soft bound.
     *
     * @param chunkSize the initial chunk size, rounded up to a power of 2
     * @param capacity the maximum number of queued messages, or Integer.MAX_VALUE for unbounded
     */
    public MpscMailbox(int chunkSize, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got: " + capacity);
        }
        // JCTools requires a chunk of at least 2
        int safeChunk = chunkSize <= 1 ? 2 : chunkSize;
        this.chunkSize = nextPowerOfTwo(safeChunk);
        this.capacity = capacity;
        this.queue = new MpscUnboundedArrayQueue<>(this.chunkSize);
        this.lock = new ReentrantLock();
        this.notEmpty = lock.newCondition();
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");

        totalMessagesOffered.incrementAndGet();

        if (capacity != Integer.MAX_VALUE && queue.size() >= capacity) {
            totalMessagesRejected.incrementAndGet();
            return false;
        }

        boolean added = queue.offer(message);

        if (added) {
            signalNotEmpty();
        }

        return added;
    }

    @Override
    public void put(T message) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        if (capacity == Integer.MAX_VALUE) {
            offer(message);
            return;
        }

        while (!(queue.size() < capacity && queue.offer(message))) {
            waitForSpace();
        }
        totalMessagesOffered.incrementAndGet();
        signalNotEmpty();
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T take() throws InterruptedException {
        // Fast path: try non-blocking poll first
        T message = queue.poll();
        if (message != null) {
            return message;
        }

        lock.lockInterruptibly();
        try {
            hasWaitingConsumers = true;

            while (true) {
                message = queue.poll();
                if (message != null) {
                    return message;
                }

                notEmpty.awaitNanos(MAX_PARK_NANOS);
            }
        } finally {
            hasWaitingConsumers = false;
            lock.unlock();
        }
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    /**
     * @return the chunk size actually used by the underlying queue
     */
    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Returns the total number of messages offered to this mailbox.
     *
     * @return total messages offered (including rejected)
     */
    public long getTotalMessagesOffered() {
        return totalMessagesOffered.get();
    }

    /**
     * Returns the total number of messages rejected because the bound was reached.
     *
     * @return total messages rejected
     */
    public long getTotalMessagesRejected() {
        return totalMessagesRejected.get();
    }

    /**
     * Signals waiting consumers that a message is available.
     * Only acquires the lock if a consumer is actually waiting, to keep offers lock-free.
     */
    private void signalNotEmpty() {
        if (hasWaitingConsumers) {
            lock.lock();
            try {
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }
    }

    private static void waitForSpace() throws InterruptedException {
        LockSupport.parkNanos(50_000);
        if (Thread.interrupted()) {
            throw new InterruptedException("Interrupted while waiting for mailbox space");
        }
    }

    /**
     * Rounds up to the next power of 2.
     */
    private static int nextPowerOfTwo(int value) {
        if (value <= 0) {
            return 1;
        }
        if ((value & (value - 1)) == 0) {
            return value; // Already power of 2
        }
        int result = 1;
        while (result < value) {
            result <<= 1;
        }
        return result;
    }

    @Override
    public String toString() {
        return "MpscMailbox{size=" + queue.size() + ", capacity=" + capacity + ", chunkSize=" + chunkSize + "}";
    }
}
