package tech.streamingenhancement.platforms.kick;

/**
 * Kick channel owner as returned by the channel lookup.
 *
 * @param displayName null when the channel has none
 */
public record KickUser(String id, String username, String displayName) {
}
