package app.walkupmusic.sdk.store;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Lifetime and scope attributes attached to a stored value. Defaults are {@code path=/}, {@code sameSite=STRICT},
 * {@code secure=true} and no expiry (lives for the session).
 *
 * <p>When both {@code maxAge} and {@code expiresAt} are set, {@code maxAge} wins, matching browser cookie rules.</p>
 */
public record CookieAttributes(Duration maxAge, Instant expiresAt, String path, SameSite sameSite, boolean secure) {

    public static final String DEFAULT_PATH = "/";

    public CookieAttributes {
        path = path == null || path.isBlank() ? DEFAULT_PATH : path;
        sameSite = sameSite == null ? SameSite.STRICT : sameSite;
    }

    public static CookieAttributes defaults() {
        return new CookieAttributes(null, null, DEFAULT_PATH, SameSite.STRICT, true);
    }

    public CookieAttributes withMaxAge(Duration maxAge) {
        return new CookieAttributes(maxAge, expiresAt, path, sameSite, secure);
    }

    public CookieAttributes withExpiresAt(Instant expiresAt) {
        return new CookieAttributes(maxAge, expiresAt, path, sameSite, secure);
    }

    public CookieAttributes withPath(String path) {
        return new CookieAttributes(maxAge, expiresAt, path, sameSite, secure);
    }

    public CookieAttributes withSameSite(SameSite sameSite) {
        return new CookieAttributes(maxAge, expiresAt, path, sameSite, secure);
    }

    public CookieAttributes withSecure(boolean secure) {
        return new CookieAttributes(maxAge, expiresAt, path, sameSite, secure);
    }

    /**
     * Resolves the absolute expiry for a value written at {@code now}; {@code null} means no expiry.
     */
    Instant expiryFrom(Instant now) {
        Objects.requireNonNull(now, "now");
        if (maxAge != null) {
            return now.plus(maxAge);
        }
        return expiresAt;
    }
}
