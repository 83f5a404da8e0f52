package tech.streamingenhancement.platforms.exception;

/**
 * Thrown when a provider response cannot be understood.
 */
public class InvalidResponseException extends PlatformException {

    public InvalidResponseException(String message) {
        super(message);
    }

    public InvalidResponseException(String message, Throwable cause) {
        super(message, cause);
    }

    public static InvalidResponseException missingAccessToken(String platform) {
        return new InvalidResponseException("Token response from " + platform + " did not contain an access_token");
    }
}
