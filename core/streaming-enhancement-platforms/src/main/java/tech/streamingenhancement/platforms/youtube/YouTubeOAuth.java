package tech.streamingenhancement.platforms.youtube;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.streamingenhancement.platforms.Platform;
import tech.streamingenhancement.platforms.auth.ProviderOAuthFlow;
import tech.streamingenhancement.platforms.auth.TokenEndpointClient;
import tech.streamingenhancement.platforms.config.PlatformsConfig;
import tech.streamingenhancement.platforms.credentials.CredentialRepository;
import tech.streamingenhancement.platforms.store.SecretStore;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Google OAuth2 flow for YouTube.
 *
 * <p>Google only issues a refresh token with {@code access_type=offline}, and only on the first
 * consent unless {@code prompt=consent} forces the consent screen again.
 */
@ApplicationScoped
public class YouTubeOAuth extends ProviderOAuthFlow {

    static final String AUTHORIZE_URL = "https://accounts.google.com/o/oauth2/v2/auth";
    static final String TOKEN_URL = "https://oauth2.googleapis.com/token";

    @Inject
    public YouTubeOAuth(PlatformsConfig config, CredentialRepository credentials, SecretStore secretStore) {
        this(credentials, secretStore,
            TokenEndpointClient.forUrl(Platform.YOUTUBE, TOKEN_URL, config.rest()),
            config.oauth().redirectUri(), Clock.systemUTC());
    }

    public YouTubeOAuth(CredentialRepository credentials, SecretStore secretStore,
                        TokenEndpointClient tokenEndpoint, String redirectUri, Clock clock) {
        super(credentials, secretStore, tokenEndpoint, redirectUri, clock);
    }

    @Override
    public Platform platform() {
        return Platform.YOUTUBE;
    }

    @Override
    protected String authorizationEndpoint() {
        return AUTHORIZE_URL;
    }

    @Override
    protected Map<String, String> extraAuthParams(String state) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("access_type", "offline");
        params.put("include_granted_scopes", "true");
        params.put("prompt", "consent");
        return params;
    }
}
