package tech.streamingenhancement.platforms.auth;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * OAuth credentials held for one user on one platform.
 *
 * <p>Stored as JSON with snake_case keys and ISO-8601 instants. {@code refreshAt} is five
 * minutes before {@code expiresAt}, clamped to the moment the set was issued for short
 * lifetimes. It is always strictly before {@code expiresAt}.
 */
public record TokenSet(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("refresh_token") @JsonInclude(JsonInclude.Include.NON_NULL) String refreshToken,
    @JsonProperty("expires_at") Instant expiresAt,
    @JsonProperty("refresh_at") Instant refreshAt,
    @JsonProperty("scope") List<String> scope
) {

    public static final Duration REFRESH_BUFFER = Duration.ofMinutes(5);
    public static final Duration DEFAULT_LIFETIME = Duration.ofHours(24);

    public TokenSet {
        Objects.requireNonNull(accessToken, "access_token is required");
        Objects.requireNonNull(expiresAt, "expires_at is required");
        Objects.requireNonNull(refreshAt, "refresh_at is required");
        if (!refreshAt.isBefore(expiresAt)) {
            throw new IllegalArgumentException(
                "refresh_at " + refreshAt + " must be before expires_at " + expiresAt);
        }
        scope = scope != null ? List.copyOf(scope) : List.of();
    }

    /**
     * Build the token set for a fresh token endpoint response.
     */
    public static TokenSet fromResponse(TokenResponse response, Instant now) {
        Duration lifetime = response.expiresIn() != null
            ? Duration.ofSeconds(Math.max(0, response.expiresIn()))
            : DEFAULT_LIFETIME;
        Instant expiresAt = now.plus(lifetime);
        Instant refreshAt = expiresAt.minus(REFRESH_BUFFER);
        if (refreshAt.isBefore(now)) {
            refreshAt = now;
        }
        // a lifetime of zero leaves no room after now
        if (!refreshAt.isBefore(expiresAt)) {
            refreshAt = expiresAt.minusNanos(1);
        }
        return new TokenSet(response.accessToken(), response.refreshToken(), expiresAt, refreshAt, response.scope());
    }

    public boolean needsRefresh(Instant now) {
        return !now.isBefore(refreshAt);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @JsonIgnore
    public boolean isRefreshable() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    public TokenSet withRefreshToken(String refreshToken) {
        return new TokenSet(accessToken, refreshToken, expiresAt, refreshAt, scope);
    }

    @Override
    public String toString() {
        return "TokenSet[expiresAt=" + expiresAt + ", refreshAt=" + refreshAt + ", scope=" + scope
            + ", refreshable=" + isRefreshable() + "]";
    }
}
