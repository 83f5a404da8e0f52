package tech.streamingenhancement.platforms.auth;

import tech.streamingenhancement.platforms.credentials.CredentialRepository;
import tech.streamingenhancement.platforms.credentials.OAuthCredential;
import tech.streamingenhancement.platforms.store.SecretStore;

import java.time.Clock;
import java.util.List;

/**
 * {@link OAuthFlow} for providers whose client registration lives in the
 * {@link CredentialRepository} and whose token endpoint takes the client secret in the form body.
 *
 * <p>Credentials are looked up on every use so they can be added while the daemon runs; a
 * missing registration fails with {@code ConfigurationException}.
 */
public abstract class ProviderOAuthFlow extends OAuthFlow {

    protected final CredentialRepository credentials;
    protected final TokenEndpointClient tokenEndpoint;
    private final String redirectUri;

    protected ProviderOAuthFlow(CredentialRepository credentials, SecretStore secretStore,
                                TokenEndpointClient tokenEndpoint, String redirectUri, Clock clock) {
        super(secretStore, clock);
        this.credentials = credentials;
        this.tokenEndpoint = tokenEndpoint;
        this.redirectUri = redirectUri;
    }

    protected OAuthCredential credential() {
        return credentials.requireCredential(platform());
    }

    @Override
    protected String clientId() {
        return credential().clientId();
    }

    @Override
    protected String redirectUri() {
        return redirectUri;
    }

    @Override
    protected List<String> scopes() {
        return credential().scopes();
    }

    @Override
    protected TokenResponse exchangeCodeForTokens(String code, String state) {
        return tokenEndpoint.exchangeCode(credential(), code, redirectUri, null);
    }

    @Override
    protected TokenResponse refreshAccessToken(String refreshToken) {
        return tokenEndpoint.refresh(credential(), refreshToken);
    }
}
