package tech.streamingenhancement.platforms.client;

import java.time.Duration;

/**
 * Blocking pause used for throttling and retry backoff.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleeper backed by {@link Thread#sleep(long)}.
     */
    static Sleeper system() {
        return duration -> {
            long millis = duration.toMillis();
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }
}
