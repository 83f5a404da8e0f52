package tech.streamingenhancement.platforms.exception;

import tech.streamingenhancement.platforms.Platform;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Base exception for streaming platform integration errors.
 *
 * <p>Failures tied to one platform carry it, and its id is also recorded in the context
 * map under {@code platform} so log lines and error payloads can report it without a cast.
 */
public class PlatformException extends RuntimeException {

    private final Platform platform;
    private final int statusCode;
    private final Map<String, Object> context;

    public PlatformException(String message) {
        this(null, message, 0, null, Map.of());
    }

    public PlatformException(String message, int statusCode) {
        this(null, message, statusCode, null, Map.of());
    }

    public PlatformException(String message, Throwable cause) {
        this(null, message, 0, cause, Map.of());
    }

    public PlatformException(String message, int statusCode, Throwable cause, Map<String, Object> context) {
        this(null, message, statusCode, cause, context);
    }

    public PlatformException(Platform platform, String message, int statusCode, Throwable cause,
                             Map<String, Object> context) {
        super(message, cause);
        this.platform = platform;
        this.statusCode = statusCode;
        this.context = withPlatform(platform, context);
    }

    private static Map<String, Object> withPlatform(Platform platform, Map<String, Object> context) {
        if (platform == null) {
            return context != null ? Map.copyOf(context) : Map.of();
        }
        Map<String, Object> merged = new HashMap<>();
        if (context != null) {
            merged.putAll(context);
        }
        merged.put("platform", platform.id());
        return Map.copyOf(merged);
    }

    /**
     * Platform the failure belongs to, empty for transport and request-level errors.
     */
    public Optional<Platform> getPlatform() {
        return Optional.ofNullable(platform);
    }

    /**
     * HTTP status associated with the failure, or 0 when there is none.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
