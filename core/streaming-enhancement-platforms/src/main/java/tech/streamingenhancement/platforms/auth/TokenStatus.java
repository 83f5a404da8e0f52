package tech.streamingenhancement.platforms.auth;

import tech.streamingenhancement.platforms.Platform;

import java.time.Instant;
import java.util.List;

/**
 * Token metadata reported for a user; never carries the tokens themselves.
 */
public record TokenStatus(
    String username,
    Platform platform,
    State state,
    Instant expiresAt,
    Instant refreshAt,
    List<String> scope,
    boolean refreshable
) {

    public enum State {
        VALID,
        EXPIRED
    }

    public static TokenStatus of(String username, Platform platform, TokenSet tokenSet, Instant now) {
        return new TokenStatus(
            username,
            platform,
            tokenSet.isExpired(now) ? State.EXPIRED : State.VALID,
            tokenSet.expiresAt(),
            tokenSet.refreshAt(),
            tokenSet.scope(),
            tokenSet.isRefreshable()
        );
    }
}
