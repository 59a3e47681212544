package com.cooper.mailbox.config;

import com.cooper.mailbox.Mailbox;

/**
 * Strategy interface for creating a mailbox from configuration.
 * This allows different queue implementations to be plugged in without modifying
 * the core mailbox provider logic.
 *
 * @param <M> The message type
 */
@FunctionalInterface
public interface MailboxCreationStrategy<M> {

    /**
     * Creates a mailbox according to this strategy.
     *
     * @param config The mailbox configuration
     * @return A new mailbox instance
     */
    Mailbox<M> createMailbox(MailboxConfig config);
}
