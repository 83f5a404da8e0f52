package tech.streamingenhancement.platforms.exception;

/**
 * Thrown when an OAuth redirect reports an error or lacks the authorization code.
 */
public class OAuthCallbackException extends PlatformException {

    public OAuthCallbackException(String message) {
        super(message, 400);
    }

    public static OAuthCallbackException providerError(String error, String description) {
        return new OAuthCallbackException("OAuth Error: " + error + (description != null ? " - " + description : ""));
    }

    public static OAuthCallbackException missingCode() {
        return new OAuthCallbackException("Missing authorization code");
    }
}
