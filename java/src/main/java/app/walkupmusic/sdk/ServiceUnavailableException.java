package app.walkupmusic.sdk;

/**
 * Spotify kept answering with a 5xx status after every retry.
 */
public final class ServiceUnavailableException extends SpotifyApiException {

    private static final long serialVersionUID = 1L;

    public ServiceUnavailableException(int statusCode) {
        super(statusCode, "Spotify service is temporarily unavailable. Please try again later.");
    }
}
