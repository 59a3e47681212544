package com.cooper.mailbox.config;

/**
 * Queue implementation backing an actor mailbox.
 */
public enum MailboxType {
    /**
     * {@link com.cooper.mailbox.LinkedMailbox}: blocking queue, exact bound.
     * Good default for actors on a dedicated thread.
     */
    LINKED,

    /**
     * {@link com.cooper.mailbox.MpscMailbox}: lock-free JCTools MPSC queue, approximate bound.
     * Lowest enqueue overhead for dispatcher-scheduled actors.
     */
    MPSC
}
