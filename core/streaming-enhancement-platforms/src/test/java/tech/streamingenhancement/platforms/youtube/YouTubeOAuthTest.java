package tech.streamingenhancement.platforms.youtube;

import org.junit.jupiter.api.Test;
import tech.streamingenhancement.platforms.Platform;
import tech.streamingenhancement.platforms.auth.AuthorizationRequest;
import tech.streamingenhancement.platforms.auth.TokenEndpointClient;
import tech.streamingenhancement.platforms.client.RestClient;
import tech.streamingenhancement.platforms.credentials.CredentialRepository;
import tech.streamingenhancement.platforms.credentials.OAuthCredential;
import tech.streamingenhancement.platforms.store.InMemorySecretStore;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class YouTubeOAuthTest {

    @Test
    void shouldRequestOfflineAccessWithForcedConsent() {
        // Given
        CredentialRepository credentials = platform -> Optional.of(new OAuthCredential(
            Platform.YOUTUBE, "yt-client", "yt-secret", List.of("https://www.googleapis.com/auth/youtube.readonly")));
        YouTubeOAuth oauth = new YouTubeOAuth(credentials, new InMemorySecretStore(),
            new TokenEndpointClient(Platform.YOUTUBE, RestClient.builder("http://localhost").build(), "/token"),
            "http://localhost:3000/callback", Clock.systemUTC());

        // When
        AuthorizationRequest request = oauth.generateAuthorizationUrl("s1");

        // Then
        assertThat(request.url())
            .startsWith("https://accounts.google.com/o/oauth2/v2/auth?client_id=yt-client&")
            .endsWith("&state=s1&scope=https%3A%2F%2Fwww.googleapis.com%2Fauth%2Fyoutube.readonly"
                + "&access_type=offline&include_granted_scopes=true&prompt=consent");
        assertEquals(Platform.YOUTUBE, oauth.platform());
    }
}
