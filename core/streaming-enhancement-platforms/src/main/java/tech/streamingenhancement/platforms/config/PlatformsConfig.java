package tech.streamingenhancement.platforms.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration for streaming platform integrations.
 *
 * <p>Configure in application.properties:
 * <pre>
 * streaming-enhancement.oauth.redirect-uri=http://localhost:3000/callback
 * streaming-enhancement.credentials.twitch.client-id=your_client_id
 * streaming-enhancement.credentials.twitch.client-secret=your_client_secret
 * streaming-enhancement.credentials.twitch.scopes=user:read:email,chat:read
 * </pre>
 */
@ConfigMapping(prefix = "streaming-enhancement")
public interface PlatformsConfig {

    /**
     * OAuth flow configuration.
     */
    OAuthConfig oauth();

    /**
     * REST client configuration shared by all platform clients.
     */
    RestConfig rest();

    /**
     * Kick API settings.
     */
    ApiConfig kick();

    /**
     * Twitch Helix API settings.
     */
    ApiConfig twitch();

    /**
     * Static OAuth client credentials keyed by platform id (twitch, kick, youtube).
     */
    Map<String, CredentialConfig> credentials();

    interface OAuthConfig {
        /**
         * Redirect URI registered with every provider.
         */
        @WithName("redirect-uri")
        @WithDefault("http://localhost:3000/callback")
        String redirectUri();

        /**
         * How long an issued authorization state stays valid.
         */
        @WithName("state-ttl")
        @WithDefault("5m")
        Duration stateTtl();

        /**
         * How long a PKCE code verifier is kept for its state.
         */
        @WithName("pkce-ttl")
        @WithDefault("10m")
        Duration pkceTtl();
    }

    interface RestConfig {
        /**
         * Timeout for a single HTTP attempt.
         */
        @WithDefault("30s")
        Duration timeout();

        /**
         * Minimum spacing between the start of two requests on one client.
         */
        @WithName("min-request-interval")
        @WithDefault("1s")
        Duration minRequestInterval();

        /**
         * Maximum attempts for one logical request.
         */
        @WithName("max-attempts")
        @WithDefault("4")
        int maxAttempts();

        /**
         * Value of the User-Agent header.
         */
        @WithName("user-agent")
        @WithDefault("streaming-daemon/1.0")
        String userAgent();
    }

    interface ApiConfig {
        @WithName("api-base-url")
        String apiBaseUrl();
    }

    interface CredentialConfig {
        @WithName("client-id")
        String clientId();

        @WithName("client-secret")
        String clientSecret();

        Optional<List<String>> scopes();
    }
}
