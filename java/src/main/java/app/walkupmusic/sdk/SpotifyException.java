package app.walkupmusic.sdk;

/**
 * Base exception thrown by the walk-up music SDK.
 */
public class SpotifyException extends Exception {

    private static final long serialVersionUID = 1L;

    public SpotifyException(String message) {
        super(message);
    }

    public SpotifyException(String message, Throwable cause) {
        super(message, cause);
    }
}
