package app.walkupmusic.sdk;

/**
 * The PKCE code verifier stored at login is gone (expired or cleared) by the time the callback arrives.
 */
public final class MissingVerifierException extends SpotifyException {

    private static final long serialVersionUID = 1L;

    public MissingVerifierException() {
        super("Code verifier not found. Please restart the login process.");
    }
}
