package tech.streamingenhancement.platforms.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jboss.logging.Logger;
import tech.streamingenhancement.platforms.config.PlatformsConfig;
import tech.streamingenhancement.platforms.exception.InvalidResponseException;
import tech.streamingenhancement.platforms.exception.NetworkException;
import tech.streamingenhancement.platforms.exception.PlatformException;
import tech.streamingenhancement.platforms.exception.RequestFailedException;
import tech.streamingenhancement.platforms.exception.RetriesExhaustedException;
import tech.streamingenhancement.platforms.support.FormEncoding;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/**
 * JSON REST client for a single platform API.
 *
 * <p>Every logical request passes the {@link RequestThrottle} once and is then attempted up to
 * {@code maxAttempts} times:
 * <ul>
 *   <li>429: wait {@link Backoff#RATE_LIMITED} and try again</li>
 *   <li>5xx: exponential backoff ({@link Backoff#serverError(int)})</li>
 *   <li>network failure or timeout: exponential backoff ({@link Backoff#networkError(int)})</li>
 *   <li>any other non-2xx status: {@link RequestFailedException}, no retry</li>
 * </ul>
 * When the attempts run out on 429/5xx a {@link RetriesExhaustedException} is thrown; a network
 * failure on the last attempt surfaces as {@link NetworkException}.
 *
 * <p>Example usage:
 * <pre>{@code
 * RestClient client = RestClient.builder("https://kick.com").build();
 * JsonNode channel = client.get("/api/v2/channels/xqc");
 * }</pre>
 */
public class RestClient {

    private static final Logger LOG = Logger.getLogger(RestClient.class);

    static final String JSON = "application/json";
    static final String FORM = "application/x-www-form-urlencoded";

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RequestThrottle throttle;
    private final Sleeper sleeper;
    private final Duration timeout;
    private final int maxAttempts;
    private final String userAgent;
    private final Supplier<Map<String, String>> defaultHeaders;

    private RestClient(Builder builder) {
        this.baseUrl = builder.baseUrl.replaceAll("/$", "");
        this.timeout = builder.timeout;
        this.maxAttempts = builder.maxAttempts;
        this.userAgent = builder.userAgent;
        this.defaultHeaders = builder.defaultHeaders;
        this.sleeper = builder.sleeper;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : defaultObjectMapper();
        this.throttle = builder.throttle != null
            ? builder.throttle
            : new RequestThrottle(builder.minRequestInterval, builder.sleeper, () -> System.nanoTime() / 1_000_000);
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(builder.timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    public static Builder builder(String baseUrl) {
        return new Builder(baseUrl);
    }

    /**
     * Builder preloaded with the shared REST settings.
     */
    public static Builder builder(String baseUrl, PlatformsConfig.RestConfig config) {
        return new Builder(baseUrl)
            .timeout(config.timeout())
            .minRequestInterval(config.minRequestInterval())
            .maxAttempts(config.maxAttempts())
            .userAgent(config.userAgent());
    }

    static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public JsonNode get(String path) {
        return get(path, Map.of());
    }

    /**
     * GET with query parameters. {@link Iterable} values repeat the key once per element.
     */
    public JsonNode get(String path, Map<String, ?> queryParams) {
        return execute("GET", buildUrl(path, queryParams), null);
    }

    /**
     * GET mapped onto {@code type} with the client's {@link ObjectMapper}.
     */
    public <T> T get(String path, Map<String, ?> queryParams, Class<T> type) {
        JsonNode node = get(path, queryParams);
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new InvalidResponseException("Failed to map response of GET " + path + " to " + type.getSimpleName(), e);
        }
    }

    public JsonNode post(String path) {
        return post(path, null);
    }

    /**
     * POST with a JSON body; a null body sends no body at all.
     */
    public JsonNode post(String path, Object body) {
        return execute("POST", buildUrl(path, Map.of()), jsonPayload(body));
    }

    public JsonNode put(String path) {
        return put(path, null);
    }

    public JsonNode put(String path, Object body) {
        return execute("PUT", buildUrl(path, Map.of()), jsonPayload(body));
    }

    public JsonNode delete(String path) {
        return execute("DELETE", buildUrl(path, Map.of()), null);
    }

    /**
     * POST an {@code application/x-www-form-urlencoded} body, as OAuth token endpoints expect.
     */
    public JsonNode postForm(String path, Map<String, String> form) {
        return execute("POST", buildUrl(path, Map.of()), new Payload(FORM, FormEncoding.encode(form)));
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    String buildUrl(String path, Map<String, ?> queryParams) {
        String url = path.startsWith("http://") || path.startsWith("https://") ? path : baseUrl + path;
        if (queryParams == null || queryParams.isEmpty()) {
            return url;
        }
        String query = FormEncoding.encode(queryParams);
        if (query.isEmpty()) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + query;
    }

    private Payload jsonPayload(Object body) {
        if (body == null) {
            return null;
        }
        try {
            return new Payload(JSON, objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new PlatformException("Failed to serialize request body", e);
        }
    }

    private JsonNode execute(String method, String url, Payload payload) {
        throttle.acquire();

        int attempt = 0;
        int lastStatus = 0;
        while (attempt < maxAttempts) {
            attempt++;
            HttpResponse<String> response;
            try {
                LOG.debugf("%s %s (attempt %d/%d)", method, url, attempt, maxAttempts);
                response = httpClient.send(buildRequest(method, url, payload), HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                if (attempt < maxAttempts) {
                    Duration delay = Backoff.networkError(attempt);
                    LOG.warnf("%s %s failed: %s, retrying in %dms (attempt %d/%d)",
                        method, url, e.toString(), delay.toMillis(), attempt, maxAttempts);
                    pause(delay);
                    continue;
                }
                throw new NetworkException(
                    String.format("%s %s failed after %d attempts: %s", method, url, attempt, e), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NetworkException("Interrupted during " + method + " " + url, e);
            }

            int status = response.statusCode();
            lastStatus = status;

            if (status == 429) {
                if (attempt < maxAttempts) {
                    LOG.warnf("Rate limited on %s %s, waiting %dms (attempt %d/%d)",
                        method, url, Backoff.RATE_LIMITED.toMillis(), attempt, maxAttempts);
                    pause(Backoff.RATE_LIMITED);
                }
                continue;
            }

            if (status >= 500) {
                if (attempt < maxAttempts) {
                    Duration delay = Backoff.serverError(attempt);
                    LOG.warnf("Server error %d on %s %s, retrying in %dms (attempt %d/%d)",
                        status, method, url, delay.toMillis(), attempt, maxAttempts);
                    pause(delay);
                }
                continue;
            }

            if (status < 200 || status >= 300) {
                throw requestFailed(method, url, response);
            }

            return parseBody(method, url, response.body());
        }

        LOG.errorf("%s %s failed after %d attempts, last status %d", method, url, attempt, lastStatus);
        throw new RetriesExhaustedException(method, url, attempt, lastStatus);
    }

    private HttpRequest buildRequest(String method, String url, Payload payload) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Content-Type", payload != null ? payload.contentType() : JSON)
            .header("Accept", JSON)
            .header("User-Agent", userAgent)
            .timeout(timeout);

        if (defaultHeaders != null) {
            defaultHeaders.get().forEach(builder::header);
        }

        if (payload != null) {
            builder.method(method, HttpRequest.BodyPublishers.ofString(payload.content()));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }

    private JsonNode parseBody(String method, String url, String body) {
        if (body == null || body.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidResponseException("Failed to parse response of " + method + " " + url, e);
        }
    }

    /**
     * Provider message: {@code message}, then {@code error_description}, then {@code error};
     * the reason phrase when the body has none of them or is not JSON.
     */
    private RequestFailedException requestFailed(String method, String url, HttpResponse<String> response) {
        int status = response.statusCode();
        String message = null;
        String errorCode = null;

        String body = response.body();
        if (body != null && !body.isBlank()) {
            try {
                JsonNode json = objectMapper.readTree(body);
                message = text(json, "message");
                if (message == null) {
                    message = text(json, "error_description");
                }
                errorCode = text(json, "error");
                if (message == null) {
                    message = errorCode;
                }
            } catch (JsonProcessingException e) {
                LOG.debugf("Error body of %s %s is not JSON", method, url);
            }
        }
        if (message == null) {
            message = HttpStatusText.of(status);
        }

        LOG.warnf("%s %s failed with %d: %s", method, url, status, message);
        return new RequestFailedException(status, message, errorCode);
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        return node != null && node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }

    private void pause(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformException("Interrupted while waiting to retry", e);
        }
    }

    private record Payload(String contentType, String content) {}

    public static final class Builder {

        private final String baseUrl;
        private Duration timeout = Duration.ofSeconds(30);
        private Duration minRequestInterval = Duration.ofMillis(1000);
        private int maxAttempts = 4;
        private String userAgent = "streaming-daemon/1.0";
        private Supplier<Map<String, String>> defaultHeaders;
        private Sleeper sleeper = Sleeper.system();
        private RequestThrottle throttle;
        private ObjectMapper objectMapper;

        private Builder(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder minRequestInterval(Duration minRequestInterval) {
            this.minRequestInterval = minRequestInterval;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        /**
         * Headers added to every attempt, evaluated per attempt so rotating tokens are picked up.
         */
        public Builder defaultHeaders(Supplier<Map<String, String>> defaultHeaders) {
            this.defaultHeaders = defaultHeaders;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder throttle(RequestThrottle throttle) {
            this.throttle = throttle;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public RestClient build() {
            return new RestClient(this);
        }
    }
}
