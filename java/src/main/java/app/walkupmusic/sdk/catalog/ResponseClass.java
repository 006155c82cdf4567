package app.walkupmusic.sdk.catalog;

/**
 * Status classes the retry policy distinguishes.
 */
public enum ResponseClass {
    SUCCESS(false),
    UNAUTHORIZED(false),
    FORBIDDEN(false),
    RATE_LIMITED(true),
    SERVER_ERROR(true),
    CLIENT_ERROR(false),
    NETWORK_FAILURE(true);

    private final boolean retryable;

    ResponseClass(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static ResponseClass of(int statusCode) {
        if (statusCode >= 200 && statusCode < 300) {
            return SUCCESS;
        }
        if (statusCode == 401) {
            return UNAUTHORIZED;
        }
        if (statusCode == 403) {
            return FORBIDDEN;
        }
        if (statusCode == 429) {
            return RATE_LIMITED;
        }
        if (statusCode >= 500) {
            return SERVER_ERROR;
        }
        return CLIENT_ERROR;
    }
}
