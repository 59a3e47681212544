package examples;

import com.cooper.ActorHandle;
import com.cooper.ActorSystem;
import com.cooper.Reply;
import com.cooper.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * A key/value map of strings shared between threads without locks.
 * The plain {@link HashMap} is only ever touched by the actor, one operation at a time.
 */
public class SharedKeyValueStore implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SharedKeyValueStore.class);

    private final ActorHandle<Map<String, String>> actor;

    public SharedKeyValueStore(ActorSystem system) {
        this(system.<Map<String, String>>actorFrom(HashMap::new).spawn());
    }

    private SharedKeyValueStore(ActorHandle<Map<String, String>> actor) {
        this.actor = actor;
    }

    /**
     * Returns another view of the same store, usable from another thread and closed independently.
     */
    public SharedKeyValueStore share() {
        return new SharedKeyValueStore(actor.copy());
    }

    /**
     * Queues an insert. Returns before the entry is visible to {@link #get}s issued through other views.
     */
    public Result<Void> put(String key, String value) {
        return actor.cast(map -> map.put(key, value));
    }

    public Reply<Optional<String>> get(String key) {
        return actor.call(map -> Optional.ofNullable(map.get(key)));
    }

    public Reply<Optional<String>> remove(String key) {
        return actor.call(map -> Optional.ofNullable(map.remove(key)));
    }

    public Reply<Integer> size() {
        return actor.call(Map::size);
    }

    /**
     * @return a copy of the current entries
     */
    public Reply<Map<String, String>> snapshot() {
        return actor.call(Map::copyOf);
    }

    @Override
    public void close() {
        actor.close();
    }

    public static void main(String[] args) throws Exception {
        ActorSystem system = new ActorSystem();
        ExecutorService writers = Executors.newFixedThreadPool(4);
        try (SharedKeyValueStore store = new SharedKeyValueStore(system)) {
            logger.info("Inserting entry 'city'...");
            store.put("city", "Boston");
            logger.info("Got: {}", store.get("city").get().orElse("<no entry>"));

            for (int w = 0; w < 4; w++) {
                SharedKeyValueStore view = store.share();
                int writer = w;
                writers.submit(() -> {
                    try (view) {
                        for (int i = 0; i < 25; i++) {
                            view.put("writer-" + writer + "-" + i, String.valueOf(i));
                        }
                        view.actor.flush().get();
                    }
                });
            }
            writers.shutdown();
            writers.awaitTermination(10, TimeUnit.SECONDS);

            logger.info("Store holds {} entries", store.size().get());
        } finally {
            system.shutdown();
        }
    }
}
