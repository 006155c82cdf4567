package app.walkupmusic.sdk.store;

import java.time.Instant;

/**
 * A persisted value together with the attributes it was written with.
 */
record StoredEntry(String value, Instant expiresAt, String path, SameSite sameSite, boolean secure) {

    static StoredEntry of(String value, CookieAttributes attributes, Instant now) {
        return new StoredEntry(value, attributes.expiryFrom(now), attributes.path(), attributes.sameSite(), attributes.secure());
    }

    boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
