package tech.streamingenhancement.platforms.auth;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Result of a token endpoint call, normalized across providers.
 *
 * @param accessToken  the issued access token, null if the provider returned none
 * @param refreshToken the refresh token, null when not issued
 * @param expiresIn    lifetime in seconds, null when the provider omitted it
 * @param scope        granted scopes in provider order, never null
 * @param tokenType    usually {@code bearer}, may be null
 */
public record TokenResponse(
    String accessToken,
    String refreshToken,
    Long expiresIn,
    List<String> scope,
    String tokenType
) {

    public TokenResponse {
        scope = scope != null ? List.copyOf(scope) : List.of();
    }

    public static TokenResponse of(String accessToken, String refreshToken, Long expiresIn, List<String> scope) {
        return new TokenResponse(accessToken, refreshToken, expiresIn, scope, "bearer");
    }

    /**
     * Read a token endpoint body. {@code expires_in} may be a number or a numeric string (Kick),
     * {@code scope} a JSON array (Twitch) or a space separated string (RFC 6749).
     */
    public static TokenResponse fromJson(JsonNode json) {
        return new TokenResponse(
            text(json, "access_token"),
            text(json, "refresh_token"),
            expiresIn(json.get("expires_in")),
            scope(json.get("scope")),
            text(json, "token_type")
        );
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isEmpty() ? null : value;
    }

    private static Long expiresIn(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static List<String> scope(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isArray()) {
            List<String> scopes = new ArrayList<>();
            node.forEach(element -> scopes.add(element.asText()));
            return scopes;
        }
        return Arrays.stream(node.asText().trim().split("\\s+"))
            .filter(s -> !s.isEmpty())
            .toList();
    }
}
