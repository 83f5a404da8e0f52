package tech.streamingenhancement.platforms.exception;

import tech.streamingenhancement.platforms.Platform;

import java.util.Map;

/**
 * Thrown when no token is stored for a user on a platform.
 */
public class TokenNotFoundException extends PlatformException {

    private final String username;

    public TokenNotFoundException(Platform platform, String username) {
        super(platform, "No token found for user " + username + " on platform " + platform.id(),
            404, null, Map.of("username", username));
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
