package com.cooper.mailbox.config;

import com.cooper.mailbox.Mailbox;

/**
 * An interface for providing actor mailboxes.
 * Implementations decide which queue backs a mailbox for a given configuration.
 *
 * @param <M> The type of messages the mailbox will hold.
 */
public interface MailboxProvider<M> {

    /**
     * Creates a mailbox based on the provided configuration.
     *
     * @param config The mailbox configuration; null means defaults
     * @return A {@link Mailbox} instance suitable for an actor's mailbox.
     */
    Mailbox<M> createMailbox(MailboxConfig config);
}
