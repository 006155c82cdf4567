package app.walkupmusic.sdk;

/**
 * Spotify refused the request (HTTP 403), usually because the account lacks Premium.
 */
public final class ForbiddenException extends SpotifyApiException {

    private static final long serialVersionUID = 1L;

    public ForbiddenException() {
        super(403, "Access forbidden. Please check your Spotify Premium subscription.");
    }
}
