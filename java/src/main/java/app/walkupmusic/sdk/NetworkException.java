package app.walkupmusic.sdk;

/**
 * Transport-level failure: no HTTP response was received (connection refused, timeout, interruption).
 */
public final class NetworkException extends SpotifyException {

    private static final long serialVersionUID = 1L;

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
