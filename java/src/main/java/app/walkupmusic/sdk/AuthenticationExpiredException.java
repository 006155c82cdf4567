package app.walkupmusic.sdk;

/**
 * Spotify rejected the bearer token (HTTP 401). Never retried locally.
 */
public final class AuthenticationExpiredException extends SpotifyApiException {

    private static final long serialVersionUID = 1L;

    public AuthenticationExpiredException() {
        super(401, "Spotify authentication expired. Please log in again.");
    }
}
