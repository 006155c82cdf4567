package app.walkupmusic.sdk;

import java.time.Duration;

/**
 * Spotify answered HTTP 429. Retried internally; only reaches callers once the retry budget is spent.
 */
public final class RateLimitExceededException extends SpotifyApiException {

    private static final long serialVersionUID = 1L;

    private final transient Duration retryAfter;

    public RateLimitExceededException(Duration retryAfter) {
        super(429, "Too many requests to Spotify API. Please try again later.");
        this.retryAfter = retryAfter;
    }

    /**
     * @return delay requested by the {@code Retry-After} header, or {@code null} when absent.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
