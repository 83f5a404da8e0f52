package tech.streamingenhancement.platforms.twitch;

/**
 * Twitch user from the Helix users endpoint.
 */
public record TwitchUser(String id, String login, String displayName) {
}
