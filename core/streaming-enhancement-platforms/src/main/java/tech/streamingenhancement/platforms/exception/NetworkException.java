package tech.streamingenhancement.platforms.exception;

/**
 * Thrown when the transport failed (connection refused, timeout, DNS) on the final attempt.
 */
public class NetworkException extends PlatformException {

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
