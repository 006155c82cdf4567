package app.walkupmusic.sdk;

/**
 * Exception representing a non-2xx response from a Spotify endpoint. Subclasses narrow the status classes the
 * SDK treats specially; any other client error surfaces as this type with the server-provided message.
 */
public class SpotifyApiException extends SpotifyException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public SpotifyApiException(int statusCode, String message) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode) : message);
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status code returned by Spotify.
     */
    public int getStatusCode() {
        return statusCode;
    }

    private static String defaultMessage(int status) {
        return "Spotify API error: " + status;
    }
}
