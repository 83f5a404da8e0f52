package tech.streamingenhancement.platforms;

import tech.streamingenhancement.platforms.exception.ConfigurationException;

import java.util.Locale;

/**
 * Streaming platforms supported by the daemon.
 */
public enum Platform {

    TWITCH("twitch", "Twitch"),
    KICK("kick", "Kick"),
    YOUTUBE("youtube", "YouTube");

    private final String id;
    private final String displayName;

    Platform(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    /**
     * Lower-case identifier used in storage keys and configuration.
     */
    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Parse a platform id, case-insensitively.
     *
     * @throws ConfigurationException if the id names no supported platform
     */
    public static Platform fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (Platform platform : values()) {
                if (platform.id.equals(normalized)) {
                    return platform;
                }
            }
        }
        throw new ConfigurationException("Invalid platform: " + id + ". Must be one of: twitch, kick, youtube");
    }
}
