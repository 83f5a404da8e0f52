package tech.streamingenhancement.platforms.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.streamingenhancement.platforms.Platform;
import tech.streamingenhancement.platforms.exception.ConfigurationException;
import tech.streamingenhancement.platforms.exception.InvalidStateException;
import tech.streamingenhancement.platforms.exception.OAuthCallbackException;
import tech.streamingenhancement.platforms.kick.KickOAuth;
import tech.streamingenhancement.platforms.twitch.TwitchOAuth;
import tech.streamingenhancement.platforms.youtube.YouTubeOAuth;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for the OAuth endpoints: start an authorization, complete the callback, report
 * and revoke stored tokens.
 */
@ApplicationScoped
public class OAuthService {

    private static final Logger LOG = Logger.getLogger(OAuthService.class);

    private final Map<Platform, OAuthFlow> flows;
    private final OAuthStateManager stateManager;
    private final Clock clock;

    @Inject
    public OAuthService(TwitchOAuth twitch, KickOAuth kick, YouTubeOAuth youtube, OAuthStateManager stateManager) {
        this(List.of(twitch, kick, youtube), stateManager, Clock.systemUTC());
    }

    public OAuthService(List<? extends OAuthFlow> flows, OAuthStateManager stateManager, Clock clock) {
        this.flows = new EnumMap<>(Platform.class);
        flows.forEach(flow -> this.flows.put(flow.platform(), flow));
        this.stateManager = stateManager;
        this.clock = clock;
    }

    /**
     * Begin an authorization for {@code username}; the returned state is valid for the
     * configured state TTL.
     *
     * @throws ConfigurationException if the platform has no client credentials
     */
    public AuthorizationRequest startAuthorization(Platform platform, String username) {
        AuthorizationRequest request = flow(platform).generateAuthorizationUrl();
        stateManager.store(platform, request.state(), username);
        LOG.infof("Started OAuth authorization for user %s on platform %s", username, platform.id());
        return request;
    }

    /**
     * Complete an authorization from the provider redirect.
     *
     * @return the user the authorization was started for
     */
    public String handleCallback(Platform platform, String state, String code, String error, String errorDescription) {
        if (error != null && !error.isBlank()) {
            LOG.warnf("OAuth provider returned error on platform %s: %s", platform.id(), error);
            throw OAuthCallbackException.providerError(error, errorDescription);
        }
        if (code == null || code.isBlank()) {
            throw OAuthCallbackException.missingCode();
        }

        String username = stateManager.find(platform, state)
            .orElseThrow(() -> InvalidStateException.unknown(platform.id()));

        flow(platform).handleOAuthCallback(code, state, username);
        stateManager.clear(platform, state);
        LOG.infof("Completed OAuth authorization for user %s on platform %s", username, platform.id());
        return username;
    }

    public Optional<TokenStatus> getStatus(Platform platform, String username) {
        return flow(platform).findTokenSet(username)
            .map(tokenSet -> TokenStatus.of(username, platform, tokenSet, clock.instant()));
    }

    /**
     * Delete the stored tokens. Nothing is sent to the provider.
     *
     * @return true if tokens were stored
     */
    public boolean revoke(Platform platform, String username) {
        return flow(platform).deleteTokens(username);
    }

    public TokenSet getAccessToken(Platform platform, String username) {
        return flow(platform).getAccessToken(username);
    }

    public OAuthFlow flow(Platform platform) {
        OAuthFlow flow = flows.get(platform);
        if (flow == null) {
            throw new ConfigurationException("No OAuth flow registered for platform " + platform.id());
        }
        return flow;
    }
}
