package com.cooper.mailbox.config;

/**
 * Configuration for actor mailbox settings.
 * The default is an unbounded LINKED mailbox whose producers block when a bound is set.
 */
public class MailboxConfig {
    // Default values for mailbox configuration
    public static final int UNBOUNDED = Integer.MAX_VALUE;
    public static final int DEFAULT_CHUNK_SIZE = 128;
    public static final MailboxType DEFAULT_MAILBOX_TYPE = MailboxType.LINKED;
    public static final OverflowStrategy DEFAULT_OVERFLOW_STRATEGY = OverflowStrategy.BLOCK;

    private MailboxType mailboxType;
    private int capacity;
    private OverflowStrategy overflowStrategy;
    private int chunkSize;

    /**
     * Creates a new MailboxConfig with default values.
     */
    public MailboxConfig() {
        this.mailboxType = DEFAULT_MAILBOX_TYPE;
        this.capacity = UNBOUNDED;
        this.overflowStrategy = DEFAULT_OVERFLOW_STRATEGY;
        this.chunkSize = DEFAULT_CHUNK_SIZE;
    }

    /**
     * Copy constructor.
     *
     * @param other the config to copy
     */
    public MailboxConfig(MailboxConfig other) {
        this.mailboxType = other.mailboxType;
        this.capacity = other.capacity;
        this.overflowStrategy = other.overflowStrategy;
        this.chunkSize = other.chunkSize;
    }

    /**
     * Sets the mailbox type.
     *
     * @param mailboxType The mailbox type (LINKED or MPSC)
     * @return This MailboxConfig instance
     */
    public MailboxConfig setMailboxType(MailboxType mailboxType) {
        if (mailboxType == null) {
            throw new IllegalArgumentException("Mailbox type cannot be null");
        }
        this.mailboxType = mailboxType;
        return this;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    /**
     * Sets the maximum number of queued envelopes.
     * {@link #UNBOUNDED} disables the bound.
     *
     * @param capacity The capacity (must be positive)
     * @return This MailboxConfig instance
     */
    public MailboxConfig setCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        return this;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * @return true if a finite capacity is configured
     */
    public boolean isBounded() {
        return capacity != UNBOUNDED;
    }

    /**
     * Sets the strategy applied when a bounded mailbox is full.
     *
     * @param overflowStrategy The overflow strategy (BLOCK or REJECT)
     * @return This MailboxConfig instance
     */
    public MailboxConfig setOverflowStrategy(OverflowStrategy overflowStrategy) {
        if (overflowStrategy == null) {
            throw new IllegalArgumentException("Overflow strategy cannot be null");
        }
        this.overflowStrategy = overflowStrategy;
        return this;
    }

    public OverflowStrategy getOverflowStrategy() {
        return overflowStrategy;
    }

    /**
     * Sets the allocation chunk size for MPSC mailboxes. Ignored by LINKED.
     *
     * @param chunkSize The chunk size (at least 2, rounded up to a power of two)
     * @return This MailboxConfig instance
     */
    public MailboxConfig setChunkSize(int chunkSize) {
        if (chunkSize < 2) {
            throw new IllegalArgumentException("Chunk size must be at least 2, got: " + chunkSize);
        }
        this.chunkSize = chunkSize;
        return this;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    @Override
    public String toString() {
        return "MailboxConfig{" +
                "type=" + mailboxType +
                ", capacity=" + (isBounded() ? String.valueOf(capacity) : "unbounded") +
                ", overflowStrategy=" + overflowStrategy +
                ", chunkSize=" + chunkSize +
                '}';
    }
}
