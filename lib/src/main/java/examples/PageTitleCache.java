package examples;

import com.cooper.ActorHandle;
import com.cooper.ActorSystem;
import com.cooper.Reply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Caches page titles. A lookup of an unknown page suspends the actor on the HTTP fetch,
 * so concurrent lookups of the same page fetch it once: the second one runs after the first
 * has filled the cache.
 */
public class PageTitleCache implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PageTitleCache.class);
    private static final Pattern TITLE = Pattern.compile("<title[^>]*>(.*?)</title>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    static final class State {
        private final PageFetcher fetcher;
        private final Map<URI, String> titles = new HashMap<>();
        private int fetches;

        State(PageFetcher fetcher) {
            this.fetcher = fetcher;
        }
    }

    private final ActorHandle<State> actor;

    public PageTitleCache(ActorSystem system, PageFetcher fetcher) {
        this.actor = system.actorOf(new State(fetcher)).spawn();
    }

    /**
     * Returns the title of the page, fetching it on first use.
     * Pages without a title element map to an empty string.
     */
    public Reply<String> title(URI uri) {
        return actor.callAsync(state -> {
            String cached = state.titles.get(uri);
            if (cached != null) {
                return CompletableFuture.completedFuture(cached);
            }
            state.fetches++;
            logger.debug("Fetching {}", uri);
            return state.fetcher.fetch(uri).thenApply(body -> {
                String title = extractTitle(body);
                state.titles.put(uri, title);
                return title;
            });
        });
    }

    /**
     * @return the number of fetches started so far
     */
    public Reply<Integer> fetchCount() {
        return actor.call(state -> state.fetches);
    }

    public Reply<Void> evict(URI uri) {
        return actor.call(state -> {
            state.titles.remove(uri);
            return null;
        });
    }

    static String extractTitle(String html) {
        Matcher matcher = TITLE.matcher(html);
        return matcher.find() ? matcher.group(1).strip() : "";
    }

    @Override
    public void close() {
        actor.close();
    }

    public static void main(String[] args) {
        URI uri = URI.create(args.length > 0 ? args[0] : "https://example.com/");
        ActorSystem system = new ActorSystem();
        try (PageTitleCache cache = new PageTitleCache(system, new HttpPageFetcher())) {
            logger.info("Title: {}", cache.title(uri).get());
            logger.info("Cached: {} (fetches: {})", cache.title(uri).get(), cache.fetchCount().get());
        } finally {
            system.shutdown();
        }
    }
}
