package tech.streamingenhancement.platforms.exception;

/**
 * Thrown when an OAuth callback carries a state that was never issued or has expired.
 */
public class InvalidStateException extends PlatformException {

    public InvalidStateException(String message) {
        super(message, 400);
    }

    public static InvalidStateException unknown(String platform) {
        return new InvalidStateException("Invalid or expired OAuth state for platform " + platform);
    }
}
