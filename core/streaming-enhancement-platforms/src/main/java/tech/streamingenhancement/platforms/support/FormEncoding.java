package tech.streamingenhancement.platforms.support;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

/**
 * {@code application/x-www-form-urlencoded} serialization, used for query strings and token
 * request bodies. Spaces become {@code +}.
 */
public final class FormEncoding {

    private FormEncoding() {}

    /**
     * Encode parameters in map iteration order. Null values are skipped and {@link Iterable}
     * values repeat the key once per element.
     */
    public static String encode(Map<String, ?> params) {
        StringJoiner joiner = new StringJoiner("&");
        params.forEach((key, value) -> {
            if (value instanceof Iterable<?> values) {
                for (Object element : values) {
                    joiner.add(pair(key, element));
                }
            } else if (value != null) {
                joiner.add(pair(key, value));
            }
        });
        return joiner.toString();
    }

    private static String pair(String key, Object value) {
        return URLEncoder.encode(key, StandardCharsets.UTF_8) + "="
            + URLEncoder.encode(String.valueOf(value), StandardCharsets.UTF_8);
    }
}
