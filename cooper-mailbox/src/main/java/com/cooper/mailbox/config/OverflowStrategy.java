package com.cooper.mailbox.config;

/**
 * What a producer does when a bounded mailbox is full.
 */
public enum OverflowStrategy {
    /**
     * Wait until space is available.
     */
    BLOCK,

    /**
     * Fail the enqueue immediately.
     */
    REJECT
}
