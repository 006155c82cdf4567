package app.walkupmusic.sdk;

/**
 * Raised when an API call needs a bearer token and none can be obtained.
 */
public class AuthenticationException extends SpotifyException {

    private static final long serialVersionUID = 1L;

    public AuthenticationException(String message) {
        super(message);
    }
}
