package tech.streamingenhancement.platforms.exception;

import java.util.HashMap;
import java.util.Map;

/**
 * Thrown when a platform API answers with a non-retryable HTTP error.
 */
public class RequestFailedException extends PlatformException {

    private final String providerMessage;
    private final String errorCode;

    public RequestFailedException(int statusCode, String providerMessage, String errorCode) {
        super("Request failed: " + statusCode + " " + providerMessage, statusCode, null, context(providerMessage, errorCode));
        this.providerMessage = providerMessage;
        this.errorCode = errorCode;
    }

    /**
     * Message reported by the provider, or the HTTP reason phrase when the body carried none.
     */
    public String getProviderMessage() {
        return providerMessage;
    }

    /**
     * OAuth style {@code error} code from the response body, may be null.
     */
    public String getErrorCode() {
        return errorCode;
    }

    public boolean isNotFound() {
        return getStatusCode() == 404;
    }

    public boolean isInvalidGrant() {
        return "invalid_grant".equals(errorCode);
    }

    public boolean isInvalidClient() {
        return "invalid_client".equals(errorCode);
    }

    private static Map<String, Object> context(String providerMessage, String errorCode) {
        Map<String, Object> context = new HashMap<>();
        if (providerMessage != null) {
            context.put("message", providerMessage);
        }
        if (errorCode != null) {
            context.put("error", errorCode);
        }
        return context;
    }
}
