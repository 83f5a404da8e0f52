package tech.streamingenhancement.platforms.twitch;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.streamingenhancement.platforms.Platform;
import tech.streamingenhancement.platforms.auth.ProviderOAuthFlow;
import tech.streamingenhancement.platforms.auth.TokenEndpointClient;
import tech.streamingenhancement.platforms.config.PlatformsConfig;
import tech.streamingenhancement.platforms.credentials.CredentialRepository;
import tech.streamingenhancement.platforms.store.SecretStore;

import java.time.Clock;

/**
 * Twitch OAuth2 authorization code flow.
 */
@ApplicationScoped
public class TwitchOAuth extends ProviderOAuthFlow {

    static final String AUTHORIZE_URL = "https://id.twitch.tv/oauth2/authorize";
    static final String TOKEN_URL = "https://id.twitch.tv/oauth2/token";

    @Inject
    public TwitchOAuth(PlatformsConfig config, CredentialRepository credentials, SecretStore secretStore) {
        this(credentials, secretStore,
            TokenEndpointClient.forUrl(Platform.TWITCH, TOKEN_URL, config.rest()),
            config.oauth().redirectUri(), Clock.systemUTC());
    }

    public TwitchOAuth(CredentialRepository credentials, SecretStore secretStore,
                       TokenEndpointClient tokenEndpoint, String redirectUri, Clock clock) {
        super(credentials, secretStore, tokenEndpoint, redirectUri, clock);
    }

    @Override
    public Platform platform() {
        return Platform.TWITCH;
    }

    @Override
    protected String authorizationEndpoint() {
        return AUTHORIZE_URL;
    }

    /**
     * Client id of the registered Twitch application, sent as {@code Client-ID} on Helix calls.
     */
    @Override
    public String clientId() {
        return super.clientId();
    }
}
