package app.walkupmusic.sdk.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The single source of truth for an authenticated session. Validity is always derived from {@code expiresAt},
 * never cached.
 */
public record CredentialRecord(String accessToken, String refreshToken, Instant expiresAt, String scope) {

    public CredentialRecord {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(expiresAt, "expiresAt");
        scope = scope == null ? "" : scope;
        refreshToken = refreshToken == null || refreshToken.isBlank() ? null : refreshToken;
    }

    /**
     * @return {@code true} while {@code now + buffer} is still before the expiry, i.e. no refresh is due yet.
     */
    public boolean isFresh(Instant now, Duration buffer) {
        return now.plus(buffer).isBefore(expiresAt);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null;
    }

    @Override
    public String toString() {
        return "CredentialRecord[expiresAt=" + expiresAt + ", scope=" + scope + ", refreshable=" + hasRefreshToken() + "]";
    }
}
