package tech.streamingenhancement.platforms.exception;

import tech.streamingenhancement.platforms.Platform;

import java.util.Map;

/**
 * Thrown when required platform configuration is missing or invalid.
 */
public class ConfigurationException extends PlatformException {

    public ConfigurationException(String message) {
        super(message);
    }

    private ConfigurationException(Platform platform, String message) {
        super(platform, message, 0, null, Map.of());
    }

    public static ConfigurationException missingCredentials(Platform platform) {
        return new ConfigurationException(platform,
            platform.displayName() + " OAuth credentials not found. Please add client credentials first."
        );
    }
}
