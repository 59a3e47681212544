package examples;

import com.cooper.ActorHandle;
import com.cooper.ActorSystem;
import com.cooper.Backend;
import com.cooper.Reply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out increasing integer ids from a counter owned by an actor on its own thread.
 */
public class UniqueIdGenerator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(UniqueIdGenerator.class);

    /**
     * The actor's state. Needs no synchronization: only the actor thread touches it.
     */
    public static class Sequence {
        private long last;

        long next() {
            return ++last;
        }

        long last() {
            return last;
        }
    }

    private final ActorHandle<Sequence> actor;

    public UniqueIdGenerator(ActorSystem system) {
        this(system.actorWithDefault(Sequence.class)
                .withBackend(Backend.THREAD)
                .spawn());
    }

    private UniqueIdGenerator(ActorHandle<Sequence> actor) {
        this.actor = actor;
    }

    /**
     * @return a generator drawing from the same sequence
     */
    public UniqueIdGenerator share() {
        return new UniqueIdGenerator(actor.copy());
    }

    public Reply<Long> nextId() {
        return actor.call(Sequence::next);
    }

    /**
     * @return the last id handed out, 0 if none
     */
    public Reply<Long> lastId() {
        return actor.call(Sequence::last);
    }

    @Override
    public void close() {
        actor.close();
    }

    public static void main(String[] args) {
        ActorSystem system = new ActorSystem();
        try (UniqueIdGenerator ids = new UniqueIdGenerator(system)) {
            for (int i = 0; i < 3; i++) {
                logger.info("ID: {}", ids.nextId().get());
            }
        } finally {
            system.shutdown();
        }
    }
}
