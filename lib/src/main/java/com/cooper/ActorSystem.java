package com.cooper;

import com.cooper.builder.ActorBuilder;
import com.cooper.config.ThreadPoolFactory;
import com.cooper.dispatcher.Dispatcher;
import com.cooper.mailbox.config.DefaultMailboxProvider;
import com.cooper.mailbox.config.MailboxConfig;
import com.cooper.mailbox.config.MailboxProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Owns the resources actors run on: the cooperative dispatcher, the default mailbox
 * configuration, the thread factory and the registry of live actors.
 *
 * Actors are not stopped through the system; they terminate when their last handle is closed.
 * {@link #shutdown()} is a resource-level teardown for the end of the program.
 */
public class ActorSystem {
    private static final Logger logger = LoggerFactory.getLogger(ActorSystem.class);

    private static final String DEFAULT_NAME = "cooper";

    private final String name;
    private final ThreadPoolFactory threadPoolFactory;
    private final MailboxConfig mailboxConfig;
    private final MailboxProvider<?> mailboxProvider;
    private final Dispatcher dispatcher;
    private final ConcurrentHashMap<String, AbstractProcessor<?>> actors = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();
    private volatile boolean shutdown = false;

    /**
     * Creates a new ActorSystem with the default configuration.
     */
    public ActorSystem() {
        this(new ThreadPoolFactory());
    }

    /**
     * Creates a new ActorSystem with the specified thread configuration.
     *
     * @param threadPoolFactory The thread pool configuration
     */
    public ActorSystem(ThreadPoolFactory threadPoolFactory) {
        this(threadPoolFactory, new MailboxConfig());
    }

    /**
     * Creates a new ActorSystem with the specified thread and default mailbox configuration.
     *
     * @param threadPoolFactory The thread pool configuration
     * @param mailboxConfig The mailbox configuration used when a builder sets none
     */
    public ActorSystem(ThreadPoolFactory threadPoolFactory, MailboxConfig mailboxConfig) {
        this(DEFAULT_NAME, threadPoolFactory, mailboxConfig, new DefaultMailboxProvider<>());
    }

    /**
     * Creates a new ActorSystem.
     *
     * @param name The system name, used as dispatcher thread prefix and actor id prefix
     * @param threadPoolFactory The thread pool configuration
     * @param mailboxConfig The mailbox configuration used when a builder sets none
     * @param mailboxProvider The provider creating each actor's queue
     */
    public ActorSystem(String name,
                       ThreadPoolFactory threadPoolFactory,
                       MailboxConfig mailboxConfig,
                       MailboxProvider<?> mailboxProvider) {
        this.name = Objects.requireNonNull(name, "name");
        this.threadPoolFactory = Objects.requireNonNull(threadPoolFactory, "threadPoolFactory");
        this.mailboxConfig = new MailboxConfig(Objects.requireNonNull(mailboxConfig, "mailboxConfig"));
        this.mailboxProvider = Objects.requireNonNull(mailboxProvider, "mailboxProvider");
        this.dispatcher = threadPoolFactory.createDispatcher(name + "-dispatcher");
        logger.info("Actor system {} started with {} dispatcher", name, threadPoolFactory.getExecutorType());
    }

    // ========== ACTOR CONSTRUCTION ==========

    /**
     * Starts building an actor around the given initial state.
     * The state must not be used by the caller afterwards.
     *
     * @param initialState The initial state
     * @param <S> The state type
     * @return A builder for the actor
     */
    public <S> ActorBuilder<S> actorOf(S initialState) {
        Objects.requireNonNull(initialState, "initialState");
        return new ActorBuilder<>(this, () -> initialState);
    }

    /**
     * Starts building an actor whose state is created by the supplier at spawn time.
     *
     * @param stateFactory Creates the initial state
     * @param <S> The state type
     * @return A builder for the actor
     */
    public <S> ActorBuilder<S> actorFrom(Supplier<S> stateFactory) {
        Objects.requireNonNull(stateFactory, "stateFactory");
        return new ActorBuilder<>(this, stateFactory);
    }

    /**
     * Starts building an actor whose state is a default-constructed instance of the given class.
     *
     * @param stateClass A class with a public no-argument constructor
     * @param <S> The state type
     * @return A builder for the actor
     * @throws ActorException if the class has no public no-argument constructor
     */
    public <S> ActorBuilder<S> actorWithDefault(Class<S> stateClass) {
        Objects.requireNonNull(stateClass, "stateClass");
        Constructor<S> constructor;
        try {
            constructor = stateClass.getConstructor();
        } catch (NoSuchMethodException e) {
            throw new ActorException("State class " + stateClass.getName()
                    + " has no public no-argument constructor", e);
        }
        return new ActorBuilder<>(this, () -> {
            try {
                return constructor.newInstance();
            } catch (InvocationTargetException e) {
                throw new ActorException("Failed to create default state " + stateClass.getName(), e.getCause());
            } catch (ReflectiveOperationException e) {
                throw new ActorException("Failed to create default state " + stateClass.getName(), e);
            }
        });
    }

    // ========== REGISTRY ==========

    /**
     * Registers a processor under its actor id. The entry is removed when the actor terminates.
     *
     * @param processor The processor to register
     * @throws ActorException if the system is shut down or the id is already in use
     */
    public void registerActor(AbstractProcessor<?> processor) {
        String actorId = processor.getActorId();
        if (shutdown) {
            throw new ActorException("Actor system " + name + " is shut down", actorId);
        }
        if (actors.putIfAbsent(actorId, processor) != null) {
            throw new ActorException("Actor with id " + actorId + " already exists", actorId);
        }
        processor.addTerminationListener(() -> actors.remove(actorId, processor));
        logger.debug("Registered actor {}", actorId);
    }

    /**
     * @return the ids of all live actors
     */
    public Set<String> getActorIds() {
        return Set.copyOf(actors.keySet());
    }

    /**
     * @return the status of a live actor, or empty once it has terminated
     */
    public Optional<ActorStatus> getActorStatus(String actorId) {
        AbstractProcessor<?> processor = actors.get(actorId);
        return processor == null ? Optional.empty() : Optional.of(processor.status());
    }

    /**
     * Generates the next actor id, {@code <system name>-<n>}.
     *
     * @return A new actor id
     */
    public String generateActorId() {
        return name + "-" + idSequence.incrementAndGet();
    }

    // ========== RESOURCES ==========

    public String getName() {
        return name;
    }

    public ThreadPoolFactory getThreadPoolFactory() {
        return threadPoolFactory;
    }

    public MailboxConfig getMailboxConfig() {
        return new MailboxConfig(mailboxConfig);
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    /**
     * Gets the mailbox provider for this actor system with a specific type parameter.
     * This method performs an unchecked cast, which is safe because MailboxProvider
     * implementations are stateless factories.
     *
     * @param <T> The message type
     * @return The mailbox provider cast to the specified type
     */
    @SuppressWarnings("unchecked")
    public <T> MailboxProvider<T> getMailboxProvider() {
        return (MailboxProvider<T>) mailboxProvider;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Shuts the system down.
     * Every live actor's mailbox is closed and its queued envelopes are discarded, so pending
     * calls fail with {@link ActorGoneException} and later enqueues fail. Then the dispatcher
     * is shut down. Operations already running complete normally.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        List<AbstractProcessor<?>> live = new ArrayList<>(actors.values());
        logger.info("Shutting down actor system {} with {} live actors", name, live.size());

        for (AbstractProcessor<?> processor : live) {
            processor.mailbox().shutdown();
        }

        dispatcher.shutdown();
        if (!dispatcher.awaitTermination(threadPoolFactory.getShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
            logger.warn("Dispatcher {} did not terminate within {} seconds",
                    dispatcher.getName(), threadPoolFactory.getShutdownTimeoutSeconds());
        }
        logger.info("Actor system {} shut down", name);
    }
}
