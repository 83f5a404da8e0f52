package tech.streamingenhancement.platforms.auth;

import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;
import tech.streamingenhancement.platforms.Platform;
import tech.streamingenhancement.platforms.client.RestClient;
import tech.streamingenhancement.platforms.config.PlatformsConfig;
import tech.streamingenhancement.platforms.credentials.OAuthCredential;
import tech.streamingenhancement.platforms.exception.InvalidResponseException;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Form-encoded calls against a provider's OAuth2 token endpoint.
 *
 * <p>Requests go through a {@link RestClient}, so they share its throttle and retry policy.
 * Provider errors surface as {@code RequestFailedException} carrying the OAuth {@code error}
 * code (see {@code isInvalidGrant()}).
 */
public class TokenEndpointClient {

    private static final Logger LOG = Logger.getLogger(TokenEndpointClient.class);

    private final Platform platform;
    private final RestClient restClient;
    private final String tokenPath;

    public TokenEndpointClient(Platform platform, RestClient restClient, String tokenPath) {
        this.platform = platform;
        this.restClient = restClient;
        this.tokenPath = tokenPath;
    }

    /**
     * Token endpoint client for an absolute token URL, using the shared REST settings.
     */
    public static TokenEndpointClient forUrl(Platform platform, String tokenUrl, PlatformsConfig.RestConfig config) {
        URI uri = URI.create(tokenUrl);
        String origin = uri.getScheme() + "://" + uri.getAuthority();
        return new TokenEndpointClient(platform, RestClient.builder(origin, config).build(), uri.getRawPath());
    }

    /**
     * {@code authorization_code} grant.
     *
     * @param codeVerifier PKCE verifier, or null when the flow does not use PKCE
     */
    public TokenResponse exchangeCode(OAuthCredential credential, String code, String redirectUri, String codeVerifier) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("client_id", credential.clientId());
        form.put("client_secret", credential.clientSecret());
        form.put("code", code);
        form.put("redirect_uri", redirectUri);
        if (codeVerifier != null) {
            form.put("code_verifier", codeVerifier);
        }
        TokenResponse response = post(form);
        LOG.debugf("Exchanged authorization code on %s (refresh token: %s, expires in: %s)",
            platform.id(), response.refreshToken() != null, response.expiresIn());
        return response;
    }

    /**
     * {@code refresh_token} grant.
     */
    public TokenResponse refresh(OAuthCredential credential, String refreshToken) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("client_id", credential.clientId());
        form.put("client_secret", credential.clientSecret());
        form.put("refresh_token", refreshToken);
        TokenResponse response = post(form);
        LOG.debugf("Refreshed access token on %s (new refresh token: %s, expires in: %s)",
            platform.id(), response.refreshToken() != null, response.expiresIn());
        return response;
    }

    private TokenResponse post(Map<String, String> form) {
        JsonNode body = restClient.postForm(tokenPath, form);
        if (body == null || !body.isObject()) {
            throw new InvalidResponseException("Token response from " + platform.displayName() + " is not a JSON object");
        }
        TokenResponse response = TokenResponse.fromJson(body);
        if (response.accessToken() == null) {
            throw InvalidResponseException.missingAccessToken(platform.displayName());
        }
        return response;
    }
}
