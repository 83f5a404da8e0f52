package tech.streamingenhancement.platforms.support;

import org.jboss.logging.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Deduplicates concurrent work per key.
 *
 * <p>The first caller for a key (the leader) runs the supplier on its own thread. Callers that
 * arrive while it runs wait for the same outcome, value or exception. The entry is removed
 * when the leader finishes, successfully or not, so the next call starts fresh work.
 */
public class SingleFlight<K, V> {

    private static final Logger LOG = Logger.getLogger(SingleFlight.class);

    private final ConcurrentMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    public V execute(K key, Supplier<V> work) {
        CompletableFuture<V> future = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, future);
        if (existing != null) {
            LOG.debugf("Joining in-flight work for %s", key);
            return await(existing);
        }

        try {
            V value = work.get();
            future.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            future.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, future);
        }
    }

    public boolean isInFlight(K key) {
        return inFlight.containsKey(key);
    }

    public int size() {
        return inFlight.size();
    }

    private V await(CompletableFuture<V> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
