package com.cooper.mailbox.config;

import com.cooper.mailbox.Mailbox;
import com.cooper.mailbox.MpscMailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates a JCTools-backed {@link MpscMailbox}.
 *
 * @param <M> The message type
 */
public class MpscMailboxStrategy<M> implements MailboxCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(MpscMailboxStrategy.class);

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        logger.debug("Creating MpscMailbox with chunk size: {}, capacity: {}",
                config.getChunkSize(), config.getCapacity());
        return new MpscMailbox<>(config.getChunkSize(), config.getCapacity());
    }
}
