package tech.streamingenhancement.platforms.twitch;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.streamingenhancement.platforms.Platform;
import tech.streamingenhancement.platforms.auth.TokenEndpointClient;
import tech.streamingenhancement.platforms.auth.TokenResponse;
import tech.streamingenhancement.platforms.client.RestClient;
import tech.streamingenhancement.platforms.credentials.OAuthCredential;
import tech.streamingenhancement.platforms.store.InMemorySecretStore;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TwitchApiTest {

    private WireMockServer server;
    private TwitchApi api;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();
        RestClient.Builder builder = RestClient.builder(server.baseUrl())
            .minRequestInterval(Duration.ZERO)
            .sleeper(duration -> { });
        TwitchOAuth oauth = new TwitchOAuth(
            platform -> Optional.of(new OAuthCredential(Platform.TWITCH, "twitch-client", "secret", List.of())),
            new InMemorySecretStore(),
            new TokenEndpointClient(Platform.TWITCH, builder.build(), "/oauth2/token"),
            "http://localhost:3000/callback", Clock.systemUTC());
        oauth.processAccessToken("streamer", TokenResponse.of("user-token", "refresh", 14400L, List.of()));
        api = TwitchApi.forUser(builder, oauth, "streamer");
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void shouldAuthenticateHelixCalls() {
        // Given
        server.stubFor(get(urlEqualTo("/users?login=shroud")).willReturn(okJson(
            "{\"data\":[{\"id\":\"37402112\",\"login\":\"shroud\",\"display_name\":\"shroud\"}]}")));

        // When
        TwitchUser user = api.getUser("shroud").orElseThrow();

        // Then
        assertEquals(new TwitchUser("37402112", "shroud", "shroud"), user);
        server.verify(getRequestedFor(urlEqualTo("/users?login=shroud"))
            .withHeader("Client-ID", equalTo("twitch-client"))
            .withHeader("Authorization", equalTo("Bearer user-token")));
    }

    @Test
    void shouldReturnEmptyWhenNoUserMatches() {
        server.stubFor(get(urlEqualTo("/users?login=nobody")).willReturn(okJson("{\"data\":[]}")));

        assertTrue(api.getUser("nobody").isEmpty());
    }
}
