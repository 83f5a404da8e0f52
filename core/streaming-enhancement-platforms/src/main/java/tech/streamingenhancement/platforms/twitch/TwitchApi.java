package tech.streamingenhancement.platforms.twitch;

import com.fasterxml.jackson.databind.JsonNode;
import tech.streamingenhancement.platforms.client.RestClient;
import tech.streamingenhancement.platforms.config.PlatformsConfig;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Helix API access on behalf of one authenticated Twitch user.
 *
 * <p>Every attempt carries {@code Client-ID} and the user's bearer token, fetched through
 * {@link TwitchOAuth#getAccessToken(String)} so an expiring token is refreshed first.
 */
public class TwitchApi {

    private final RestClient restClient;

    public TwitchApi(RestClient restClient) {
        this.restClient = restClient;
    }

    public static TwitchApi forUser(PlatformsConfig config, TwitchOAuth oauth, String username) {
        return forUser(RestClient.builder(config.twitch().apiBaseUrl(), config.rest()), oauth, username);
    }

    static TwitchApi forUser(RestClient.Builder builder, TwitchOAuth oauth, String username) {
        return new TwitchApi(builder
            .defaultHeaders(() -> {
                Map<String, String> headers = new LinkedHashMap<>();
                headers.put("Client-ID", oauth.clientId());
                headers.put("Authorization", "Bearer " + oauth.getAccessToken(username).accessToken());
                return headers;
            })
            .build());
    }

    /**
     * User by login name; empty when Twitch returns no match.
     */
    public Optional<TwitchUser> getUser(String login) {
        JsonNode body = restClient.get("/users", Map.of("login", login));
        JsonNode data = body.path("data");
        if (!data.isArray() || data.isEmpty()) {
            return Optional.empty();
        }
        JsonNode user = data.get(0);
        return Optional.of(new TwitchUser(
            user.path("id").asText(),
            user.path("login").asText(),
            user.path("display_name").asText(null)
        ));
    }

    public RestClient restClient() {
        return restClient;
    }
}
