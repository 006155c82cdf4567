package app.walkupmusic.sdk;

/**
 * The {@code state} returned on the OAuth callback does not match the one stored at login.
 */
public final class CsrfException extends SpotifyException {

    private static final long serialVersionUID = 1L;

    public CsrfException() {
        super("Invalid state parameter. Possible CSRF attack.");
    }
}
