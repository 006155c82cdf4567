package app.walkupmusic.sdk;

/**
 * An explicit refresh was requested but no refresh token is stored.
 */
public final class NoRefreshTokenException extends SpotifyException {

    private static final long serialVersionUID = 1L;

    public NoRefreshTokenException() {
        super("No refresh token available");
    }
}
