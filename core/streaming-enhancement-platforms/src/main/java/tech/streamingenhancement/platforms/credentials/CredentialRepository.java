package tech.streamingenhancement.platforms.credentials;

import tech.streamingenhancement.platforms.Platform;
import tech.streamingenhancement.platforms.exception.ConfigurationException;

import java.util.Optional;

/**
 * Source of per-platform OAuth client credentials.
 */
public interface CredentialRepository {

    /**
     * Look up the client credentials registered for a platform.
     *
     * @return The credential, or empty when none is registered
     */
    Optional<OAuthCredential> getCredential(Platform platform);

    /**
     * Look up the client credentials registered for a platform.
     *
     * @throws ConfigurationException if none is registered
     */
    default OAuthCredential requireCredential(Platform platform) {
        return getCredential(platform)
            .orElseThrow(() -> ConfigurationException.missingCredentials(platform));
    }
}
