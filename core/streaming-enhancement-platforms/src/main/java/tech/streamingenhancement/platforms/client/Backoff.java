package tech.streamingenhancement.platforms.client;

import java.time.Duration;

/**
 * Retry delays for {@link RestClient}.
 *
 * <p>Server errors and network errors use different exponents for the same attempt number:
 * a 5xx on attempt N waits {@code min(1000 * 2^N, 8000)} ms while a network failure on
 * attempt N waits {@code min(1000 * 2^(N-1), 8000)} ms.
 */
public final class Backoff {

    static final long BASE_MILLIS = 1000;
    static final long MAX_MILLIS = 8000;

    /**
     * Fixed wait after an HTTP 429 response.
     */
    public static final Duration RATE_LIMITED = Duration.ofMillis(5000);

    private Backoff() {}

    /**
     * Delay before retrying after a 5xx response on the given (1-based) attempt.
     */
    public static Duration serverError(int attempt) {
        return exponential(attempt);
    }

    /**
     * Delay before retrying after a network failure on the given (1-based) attempt.
     */
    public static Duration networkError(int attempt) {
        return exponential(attempt - 1);
    }

    private static Duration exponential(int exponent) {
        int bounded = Math.max(0, Math.min(exponent, 16));
        return Duration.ofMillis(Math.min(BASE_MILLIS << bounded, MAX_MILLIS));
    }
}
