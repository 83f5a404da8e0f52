package tech.streamingenhancement.platforms.kick;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.streamingenhancement.platforms.Platform;
import tech.streamingenhancement.platforms.auth.PkceManager;
import tech.streamingenhancement.platforms.auth.ProviderOAuthFlow;
import tech.streamingenhancement.platforms.auth.TokenEndpointClient;
import tech.streamingenhancement.platforms.auth.TokenResponse;
import tech.streamingenhancement.platforms.config.PlatformsConfig;
import tech.streamingenhancement.platforms.credentials.CredentialRepository;
import tech.streamingenhancement.platforms.exception.InvalidStateException;
import tech.streamingenhancement.platforms.store.SecretStore;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Kick OAuth2 flow. Kick requires PKCE: every authorization URL carries an S256 code
 * challenge and the matching verifier must accompany the code exchange.
 */
@ApplicationScoped
public class KickOAuth extends ProviderOAuthFlow {

    private static final Logger LOG = Logger.getLogger(KickOAuth.class);

    static final String AUTHORIZE_URL = "https://id.kick.com/oauth/authorize";
    static final String TOKEN_URL = "https://id.kick.com/oauth/token";

    private final PkceManager pkceManager;

    @Inject
    public KickOAuth(PlatformsConfig config, CredentialRepository credentials, SecretStore secretStore,
                     PkceManager pkceManager) {
        this(credentials, secretStore,
            TokenEndpointClient.forUrl(Platform.KICK, TOKEN_URL, config.rest()),
            pkceManager, config.oauth().redirectUri(), Clock.systemUTC());
    }

    public KickOAuth(CredentialRepository credentials, SecretStore secretStore, TokenEndpointClient tokenEndpoint,
                     PkceManager pkceManager, String redirectUri, Clock clock) {
        super(credentials, secretStore, tokenEndpoint, redirectUri, clock);
        this.pkceManager = pkceManager;
    }

    @Override
    public Platform platform() {
        return Platform.KICK;
    }

    @Override
    protected String authorizationEndpoint() {
        return AUTHORIZE_URL;
    }

    @Override
    protected Map<String, String> extraAuthParams(String state) {
        String verifier = pkceManager.generateVerifier();
        pkceManager.store(state, verifier);

        Map<String, String> params = new LinkedHashMap<>();
        params.put("code_challenge", pkceManager.challenge(verifier));
        params.put("code_challenge_method", PkceManager.CHALLENGE_METHOD);
        return params;
    }

    @Override
    protected TokenResponse exchangeCodeForTokens(String code, String state) {
        String verifier = pkceManager.find(state)
            .orElseThrow(() -> new InvalidStateException(
                "Unable to retrieve code_verifier for state. OAuth flow may have expired."));

        TokenResponse response = tokenEndpoint.exchangeCode(credential(), code, redirectUri(), verifier);
        pkceManager.clear(state);
        LOG.debugf("PKCE verifier consumed for Kick authorization");
        return response;
    }
}
