package com.cooper.mailbox.config;

import com.cooper.mailbox.LinkedMailbox;
import com.cooper.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates a {@link LinkedMailbox}, bounded when the config has a finite capacity.
 *
 * @param <M> The message type
 */
public class LinkedMailboxStrategy<M> implements MailboxCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(LinkedMailboxStrategy.class);

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        if (config.isBounded()) {
            logger.debug("Creating bounded LinkedMailbox with capacity: {}", config.getCapacity());
            return new LinkedMailbox<>(config.getCapacity());
        }
        logger.debug("Creating unbounded LinkedMailbox");
        return new LinkedMailbox<>();
    }
}
