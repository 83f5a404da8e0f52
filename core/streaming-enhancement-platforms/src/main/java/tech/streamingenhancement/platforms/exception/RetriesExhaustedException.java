package tech.streamingenhancement.platforms.exception;

import java.util.Map;

/**
 * Thrown when a request kept failing with retryable responses until no attempts were left.
 */
public class RetriesExhaustedException extends PlatformException {

    private final int attempts;

    public RetriesExhaustedException(String method, String url, int attempts, int lastStatusCode) {
        super(String.format("Request failed after maximum retry attempts (%d): %s %s, last status %d",
                attempts, method, url, lastStatusCode),
            lastStatusCode, null, Map.of("attempts", attempts));
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
