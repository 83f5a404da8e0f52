package tech.streamingenhancement.platforms.auth;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.streamingenhancement.platforms.Platform;
import tech.streamingenhancement.platforms.config.PlatformsConfig;

import java.time.Duration;
import java.util.Optional;

/**
 * Remembers which user started an authorization, keyed by (platform, state).
 *
 * <p>Entries expire after {@code streaming-enhancement.oauth.state-ttl} (default 5 minutes).
 */
@ApplicationScoped
public class OAuthStateManager {

    private static final Logger LOG = Logger.getLogger(OAuthStateManager.class);

    private final Cache<String, String> states;

    @Inject
    public OAuthStateManager(PlatformsConfig config) {
        this(config.oauth().stateTtl(), Ticker.systemTicker());
    }

    OAuthStateManager(Duration ttl, Ticker ticker) {
        this.states = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .ticker(ticker)
            .build();
    }

    public void store(Platform platform, String state, String username) {
        states.put(key(platform, state), username);
        LOG.debugf("Stored OAuth state for user %s on platform %s", username, platform.id());
    }

    /**
     * Username the state was issued for, empty when unknown or expired.
     */
    public Optional<String> find(Platform platform, String state) {
        if (state == null || state.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(states.getIfPresent(key(platform, state)));
    }

    public void clear(Platform platform, String state) {
        states.invalidate(key(platform, state));
    }

    private static String key(Platform platform, String state) {
        return platform.id() + ":" + state;
    }
}
