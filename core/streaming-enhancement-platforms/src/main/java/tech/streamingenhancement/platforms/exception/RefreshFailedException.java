package tech.streamingenhancement.platforms.exception;

import tech.streamingenhancement.platforms.Platform;

import java.util.Map;

/**
 * Thrown when an access token could not be refreshed.
 *
 * <p>The stored token set is left untouched when this is thrown.
 */
public class RefreshFailedException extends PlatformException {

    public RefreshFailedException(Platform platform, String username, String message, Throwable cause) {
        super(platform, message, 0, cause, Map.of("username", username));
    }

    public static RefreshFailedException noRefreshToken(Platform platform, String username) {
        return new RefreshFailedException(platform, username,
            "No refresh token available for user " + username + " on platform " + platform.id()
                + ". User must re-authenticate.",
            null
        );
    }

    public static RefreshFailedException wrap(Platform platform, String username, Throwable cause) {
        return new RefreshFailedException(platform, username,
            "Failed to refresh access token for user " + username + " on platform " + platform.id()
                + ": " + cause.getMessage(),
            cause
        );
    }
}
