package tech.streamingenhancement.platforms.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jboss.logging.Logger;
import tech.streamingenhancement.platforms.Platform;
import tech.streamingenhancement.platforms.exception.PlatformException;
import tech.streamingenhancement.platforms.exception.RefreshFailedException;
import tech.streamingenhancement.platforms.exception.TokenNotFoundException;
import tech.streamingenhancement.platforms.store.SecretStore;
import tech.streamingenhancement.platforms.support.FormEncoding;
import tech.streamingenhancement.platforms.support.SingleFlight;
import tech.streamingenhancement.platforms.support.StateGenerator;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authorization code flow and token lifecycle for one platform.
 *
 * <p>Token sets are kept in the {@link SecretStore} under {@code oauth:<platform>:<username>}.
 * {@link #getAccessToken(String)} hands out the stored token and refreshes it once it is
 * within five minutes of expiry.
 *
 * <p>Refreshes are single-flight per (platform, username) across the whole process: while one
 * refresh runs, other callers for the same user wait for its outcome instead of calling the
 * provider again.
 */
public abstract class OAuthFlow {

    private static final Logger LOG = Logger.getLogger(OAuthFlow.class);

    private static final SingleFlight<String, TokenSet> REFRESHES = new SingleFlight<>();

    protected final SecretStore secretStore;
    protected final Clock clock;
    private final ObjectMapper objectMapper;

    protected OAuthFlow(SecretStore secretStore, Clock clock) {
        this.secretStore = secretStore;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public abstract Platform platform();

    protected abstract String authorizationEndpoint();

    protected abstract String clientId();

    protected abstract String redirectUri();

    protected abstract List<String> scopes();

    /**
     * Exchange an authorization code. {@code state} is the value the redirect carried.
     */
    protected abstract TokenResponse exchangeCodeForTokens(String code, String state);

    protected abstract TokenResponse refreshAccessToken(String refreshToken);

    /**
     * Provider specific query parameters appended after the standard ones.
     */
    protected Map<String, String> extraAuthParams(String state) {
        return Map.of();
    }

    public AuthorizationRequest generateAuthorizationUrl() {
        return generateAuthorizationUrl(StateGenerator.generate());
    }

    public AuthorizationRequest generateAuthorizationUrl(String state) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("client_id", clientId());
        params.put("redirect_uri", redirectUri());
        params.put("response_type", "code");
        params.put("state", state);

        List<String> scopes = scopes();
        if (!scopes.isEmpty()) {
            params.put("scope", String.join(" ", scopes));
        }
        extraAuthParams(state).forEach(params::putIfAbsent);

        return new AuthorizationRequest(authorizationEndpoint() + "?" + FormEncoding.encode(params), state);
    }

    /**
     * Complete the authorization code flow for {@code username}.
     */
    public TokenSet handleOAuthCallback(String code, String state, String username) {
        TokenResponse response = exchangeCodeForTokens(code, state);
        return processAccessToken(username, response);
    }

    /**
     * Build a token set from a token response and replace whatever was stored for the user.
     */
    public TokenSet processAccessToken(String username, TokenResponse response) {
        TokenSet tokenSet = TokenSet.fromResponse(response, clock.instant());
        store(username, tokenSet);
        LOG.infof("OAuth tokens stored for user %s on platform %s", username, platform().id());
        return tokenSet;
    }

    /**
     * Current token set for the user, refreshed first if it is due.
     *
     * @throws TokenNotFoundException if nothing is stored for the user
     * @throws RefreshFailedException if a due refresh fails
     */
    public TokenSet getAccessToken(String username) {
        TokenSet current = findTokenSet(username)
            .orElseThrow(() -> new TokenNotFoundException(platform(), username));
        if (!current.needsRefresh(clock.instant())) {
            return current;
        }
        LOG.debugf("Refreshing token for user %s on platform %s", username, platform().id());
        return refresh(username, current, false);
    }

    /**
     * Refresh the user's token regardless of its expiry.
     */
    public TokenSet refreshToken(String username) {
        TokenSet current = findTokenSet(username)
            .orElseThrow(() -> new TokenNotFoundException(platform(), username));
        return refresh(username, current, true);
    }

    public boolean hasToken(String username) {
        return findTokenSet(username).isPresent();
    }

    /**
     * Stored token set; unreadable or corrupt records are logged and reported as absent.
     */
    public Optional<TokenSet> findTokenSet(String username) {
        Optional<String> raw;
        try {
            raw = secretStore.get(SecretStore.NAMESPACE, storageKey(username));
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to retrieve token for user %s on platform %s", username, platform().id());
            return Optional.empty();
        }
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw.get(), TokenSet.class));
        } catch (JsonProcessingException e) {
            LOG.warnf("Stored token for user %s on platform %s is unreadable: %s",
                username, platform().id(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public boolean deleteTokens(String username) {
        boolean deleted = secretStore.delete(SecretStore.NAMESPACE, storageKey(username));
        if (deleted) {
            LOG.infof("OAuth tokens deleted for user %s on platform %s", username, platform().id());
        }
        return deleted;
    }

    public String storageKey(String username) {
        return "oauth:" + platform().id() + ":" + username;
    }

    private TokenSet refresh(String username, TokenSet observed, boolean forced) {
        return REFRESHES.execute(platform().id() + ":" + username, () -> {
            TokenSet stored = findTokenSet(username)
                .orElseThrow(() -> new TokenNotFoundException(platform(), username));

            // Another caller refreshed (or replaced) the record after we read it
            if (!stored.equals(observed) || (!forced && !stored.needsRefresh(clock.instant()))) {
                LOG.debugf("Token for user %s on platform %s already refreshed", username, platform().id());
                return stored;
            }

            if (!stored.isRefreshable()) {
                throw RefreshFailedException.noRefreshToken(platform(), username);
            }

            TokenSet refreshed;
            try {
                TokenResponse response = refreshAccessToken(stored.refreshToken());
                refreshed = TokenSet.fromResponse(response, clock.instant());
            } catch (RuntimeException e) {
                LOG.errorf("Failed to refresh token for user %s on platform %s: %s",
                    username, platform().id(), e.getMessage());
                throw RefreshFailedException.wrap(platform(), username, e);
            }

            if (refreshed.refreshToken() == null) {
                refreshed = refreshed.withRefreshToken(stored.refreshToken());
            }
            store(username, refreshed);
            LOG.infof("Token refreshed for user %s on platform %s", username, platform().id());
            return refreshed;
        });
    }

    private void store(String username, TokenSet tokenSet) {
        String json;
        try {
            json = objectMapper.writeValueAsString(tokenSet);
        } catch (JsonProcessingException e) {
            throw new PlatformException("Failed to serialize token set for user " + username, e);
        }
        secretStore.set(SecretStore.NAMESPACE, storageKey(username), json);
    }
}
