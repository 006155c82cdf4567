package app.walkupmusic.sdk;

/**
 * A response body did not have the shape the SDK expects.
 */
public final class InvalidResponseException extends SpotifyException {

    private static final long serialVersionUID = 1L;

    public InvalidResponseException(String message) {
        super(message);
    }

    public InvalidResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
