package tech.streamingenhancement.platforms.auth;

/**
 * Authorization redirect for a user to follow, and the state that correlates the callback.
 */
public record AuthorizationRequest(String url, String state) {
}
