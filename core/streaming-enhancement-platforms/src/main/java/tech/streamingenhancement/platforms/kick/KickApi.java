package tech.streamingenhancement.platforms.kick;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.streamingenhancement.platforms.client.RestClient;
import tech.streamingenhancement.platforms.config.PlatformsConfig;
import tech.streamingenhancement.platforms.exception.PlatformException;
import tech.streamingenhancement.platforms.exception.RequestFailedException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lookups against the public Kick v2 channel API.
 */
@ApplicationScoped
public class KickApi {

    private static final Logger LOG = Logger.getLogger(KickApi.class);

    private final RestClient restClient;

    @Inject
    public KickApi(PlatformsConfig config) {
        this(RestClient.builder(config.kick().apiBaseUrl(), config.rest()).build());
    }

    public KickApi(RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * Channel owner by username; empty when the channel does not exist.
     */
    public Optional<KickUser> getUser(String username) {
        JsonNode data;
        try {
            data = restClient.get("/api/v2/channels/" + segment(username));
        } catch (RequestFailedException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }

        JsonNode id = data.get("id");
        if (id == null || id.isNull()) {
            return Optional.empty();
        }
        JsonNode displayName = data.get("display_name");
        return Optional.of(new KickUser(
            id.asText(),
            data.path("username").asText(null),
            displayName != null && !displayName.isNull() && !displayName.asText().isEmpty() ? displayName.asText() : null
        ));
    }

    /**
     * Current livestream of a channel; empty when the channel is unknown.
     */
    public Optional<JsonNode> getChannelLivestream(String channel) {
        try {
            JsonNode data = restClient.get("/api/v2/channels/" + segment(channel) + "/livestream");
            return data.isNull() ? Optional.empty() : Optional.of(data);
        } catch (RequestFailedException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    /**
     * Resolve several usernames, in order. Unknown users and failed lookups are skipped.
     */
    public List<KickUser> getUsersByUsername(List<String> usernames) {
        List<KickUser> users = new ArrayList<>();
        for (String username : usernames) {
            try {
                getUser(username).ifPresent(users::add);
            } catch (PlatformException e) {
                LOG.warnf("Failed to fetch Kick user %s: %s", username, e.getMessage());
            }
        }
        return users;
    }

    private static String segment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
