package com.cooper.builder;

import com.cooper.AbstractProcessor;
import com.cooper.ActorException;
import com.cooper.ActorHandle;
import com.cooper.ActorLifecycle;
import com.cooper.ActorMailbox;
import com.cooper.ActorSystem;
import com.cooper.Backend;
import com.cooper.Envelope;
import com.cooper.MailboxProcessor;
import com.cooper.TerminationPolicy;
import com.cooper.dispatcher.DispatcherProcessor;
import com.cooper.mailbox.Mailbox;
import com.cooper.mailbox.config.MailboxConfig;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Builder for creating actors with a fluent API.
 *
 * @param <S> The type of the actor's state
 */
public class ActorBuilder<S> {

    private final ActorSystem system;
    private final Supplier<S> stateFactory;
    private String id;
    private Backend backend = Backend.COOPERATIVE;
    private MailboxConfig mailboxConfig;
    private TerminationPolicy terminationPolicy = TerminationPolicy.DISCARD_PENDING;
    private BiConsumer<String, Throwable> failureHandler;
    private ActorLifecycle<S> lifecycle;

    /**
     * Creates a new ActorBuilder.
     *
     * @param system The actor system
     * @param stateFactory Creates the initial state when the actor is spawned
     */
    public ActorBuilder(ActorSystem system, Supplier<S> stateFactory) {
        this.system = Objects.requireNonNull(system, "system");
        this.stateFactory = Objects.requireNonNull(stateFactory, "stateFactory");
    }

    /**
     * Sets the ID for the actor. Without one, the system generates an id.
     *
     * @param id The ID for the actor
     * @return This builder for method chaining
     */
    public ActorBuilder<S> withId(String id) {
        this.id = Objects.requireNonNull(id, "id");
        return this;
    }

    /**
     * Sets where the actor's processor runs. Defaults to {@link Backend#COOPERATIVE}.
     *
     * @param backend The backend
     * @return This builder for method chaining
     */
    public ActorBuilder<S> withBackend(Backend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
        return this;
    }

    /**
     * Sets the mailbox configuration. Defaults to the system's.
     *
     * @param mailboxConfig The mailbox configuration
     * @return This builder for method chaining
     */
    public ActorBuilder<S> withMailboxConfig(MailboxConfig mailboxConfig) {
        this.mailboxConfig = new MailboxConfig(Objects.requireNonNull(mailboxConfig, "mailboxConfig"));
        return this;
    }

    /**
     * Sets what happens to queued envelopes after the last handle closes.
     *
     * @param terminationPolicy The termination policy
     * @return This builder for method chaining
     */
    public ActorBuilder<S> withTerminationPolicy(TerminationPolicy terminationPolicy) {
        this.terminationPolicy = Objects.requireNonNull(terminationPolicy, "terminationPolicy");
        return this;
    }

    /**
     * Sets a handler receiving the actor id and the error of every failed cast.
     *
     * @param failureHandler The handler
     * @return This builder for method chaining
     */
    public ActorBuilder<S> withFailureHandler(BiConsumer<String, Throwable> failureHandler) {
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
        return this;
    }

    /**
     * Sets preStart/postStop hooks.
     *
     * @param lifecycle The lifecycle hooks
     * @return This builder for method chaining
     */
    public ActorBuilder<S> withLifecycle(ActorLifecycle<S> lifecycle) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        return this;
    }

    /**
     * Creates and starts the actor with the configured settings.
     *
     * @return The first handle to the actor
     * @throws ActorException if the id is taken, the system is shut down or the state cannot be created
     */
    public ActorHandle<S> spawn() {
        String finalId = id != null ? id : system.generateActorId();

        S state = stateFactory.get();
        if (state == null) {
            throw new ActorException("Initial state must not be null", finalId);
        }

        MailboxConfig mbConfigToUse = mailboxConfig != null ? mailboxConfig : system.getMailboxConfig();
        Mailbox<Envelope<S>> queue = system.<Envelope<S>>getMailboxProvider().createMailbox(mbConfigToUse);
        ActorMailbox<S> mailbox = new ActorMailbox<>(finalId, queue, mbConfigToUse.getOverflowStrategy());

        AbstractProcessor<S> processor;
        if (backend == Backend.THREAD) {
            processor = new MailboxProcessor<>(
                    finalId,
                    state,
                    mailbox,
                    terminationPolicy,
                    failureHandler,
                    lifecycle,
                    system.getThreadPoolFactory()
            );
        } else {
            processor = new DispatcherProcessor<>(
                    finalId,
                    state,
                    mailbox,
                    terminationPolicy,
                    failureHandler,
                    lifecycle,
                    system.getDispatcher(),
                    system.getThreadPoolFactory().getActorBatchSize()
            );
        }

        system.registerActor(processor);
        // the first producer exists before the processor can observe an empty, closed mailbox
        ActorHandle<S> handle = new ActorHandle<>(mailbox);
        processor.start();
        return handle;
    }
}
