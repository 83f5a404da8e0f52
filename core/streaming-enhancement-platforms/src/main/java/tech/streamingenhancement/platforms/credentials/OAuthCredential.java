package tech.streamingenhancement.platforms.credentials;

import tech.streamingenhancement.platforms.Platform;

import java.util.List;

/**
 * Static OAuth client registration for one platform.
 */
public record OAuthCredential(
    Platform platform,
    String clientId,
    String clientSecret,
    List<String> scopes
) {

    public OAuthCredential {
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
    }
}
