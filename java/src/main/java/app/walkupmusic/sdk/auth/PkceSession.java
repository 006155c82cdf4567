package app.walkupmusic.sdk.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Verifier and state minted at login, alive until the callback is handled or {@link #TTL} elapses.
 */
public record PkceSession(String verifier, String state, Instant createdAt) {

    public static final Duration TTL = Duration.ofMinutes(10);

    public PkceSession {
        Objects.requireNonNull(verifier, "verifier");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public static PkceSession create(PkceGenerator generator, Instant now) {
        return new PkceSession(generator.generateCodeVerifier(), generator.generateState(), now);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(createdAt.plus(TTL));
    }

    @Override
    public String toString() {
        return "PkceSession[createdAt=" + createdAt + "]";
    }
}
