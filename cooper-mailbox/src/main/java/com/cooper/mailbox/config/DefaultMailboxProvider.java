package com.cooper.mailbox.config;

import com.cooper.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Default mailbox provider that selects a creation strategy by {@link MailboxType}.
 *
 * - LINKED: LinkedMailbox (blocking queue, exact bound)
 * - MPSC: MpscMailbox (lock-free enqueue, soft bound)
 *
 * Additional strategies can be registered to replace the built-in ones.
 */
public class DefaultMailboxProvider<M> implements MailboxProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxProvider.class);

    private final Map<MailboxType, MailboxCreationStrategy<M>> strategies;

    public DefaultMailboxProvider() {
        this.strategies = new EnumMap<>(MailboxType.class);
        this.strategies.put(MailboxType.LINKED, new LinkedMailboxStrategy<>());
        this.strategies.put(MailboxType.MPSC, new MpscMailboxStrategy<>());
    }

    /**
     * Replaces the strategy used for the given mailbox type.
     *
     * @param type the mailbox type
     * @param strategy the strategy to use
     * @return this provider
     */
    public DefaultMailboxProvider<M> withStrategy(MailboxType type, MailboxCreationStrategy<M> strategy) {
        strategies.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(strategy, "strategy"));
        return this;
    }

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        MailboxConfig effectiveConfig = (config != null) ? config : new MailboxConfig();

        logger.debug("DefaultMailboxProvider creating mailbox - config: {}", effectiveConfig);

        MailboxCreationStrategy<M> strategy = strategies.get(effectiveConfig.getMailboxType());
        return strategy.createMailbox(effectiveConfig);
    }
}
