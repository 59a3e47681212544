package examples;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronously downloads a page body.
 */
@FunctionalInterface
public interface PageFetcher {

    CompletableFuture<String> fetch(URI uri);
}
