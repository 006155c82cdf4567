package app.walkupmusic.sdk.auth;

import app.walkupmusic.sdk.store.CookieAttributes;
import app.walkupmusic.sdk.store.CredentialStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Offline {@link AuthManager} for local development: logging in succeeds immediately without talking to Spotify.
 *
 * <p>The authenticated flag is kept in the credential store so it survives restarts like a real session would.
 * An optional session TTL makes expiry paths reproducible in tests.</p>
 */
public final class MockAuthManager implements AuthManager {

    private static final Logger LOGGER = Logger.getLogger(MockAuthManager.class.getName());

    static final String AUTH_STATE_KEY = "mock_auth_state";
    public static final String MOCK_ACCESS_TOKEN = "mock-access-token-12345";
    public static final AccountProfile MOCK_USER =
        new AccountProfile("mock-user-123", "Mock User", "mock@example.com", AccountProfile.PREMIUM);

    private final CredentialStore store;
    private final Duration sessionTtl;
    private final Clock clock;

    public MockAuthManager(CredentialStore store) {
        this(store, null, Clock.systemUTC());
    }

    /**
     * @param sessionTtl how long a mock login lasts; {@code null} or non-positive for no expiry.
     */
    public MockAuthManager(CredentialStore store, Duration sessionTtl, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.sessionTtl = sessionTtl == null || sessionTtl.isZero() || sessionTtl.isNegative() ? null : sessionTtl;
        this.clock = Objects.requireNonNull(clock, "clock");
        if (isAuthenticated()) {
            LOGGER.info("[walkup-sdk] mock auth: restored authenticated state");
        }
    }

    @Override
    public void login() {
        authenticate();
        LOGGER.info("[walkup-sdk] mock auth: user logged in");
    }

    @Override
    public void handleCallback(String code, String state) {
        authenticate();
        LOGGER.info("[walkup-sdk] mock auth: handled callback, user authenticated");
    }

    @Override
    public Optional<String> getAccessToken() {
        return isAuthenticated() ? Optional.of(MOCK_ACCESS_TOKEN) : Optional.empty();
    }

    @Override
    public void refreshToken() {
        // mock tokens never need refreshing
    }

    @Override
    public void logout() {
        store.delete(AUTH_STATE_KEY);
        LOGGER.info("[walkup-sdk] mock auth: user logged out");
    }

    @Override
    public boolean isAuthenticated() {
        return store.get(AUTH_STATE_KEY).isPresent();
    }

    @Override
    public Optional<AccountProfile> currentUser() {
        return isAuthenticated() ? Optional.of(MOCK_USER) : Optional.empty();
    }

    private void authenticate() {
        CookieAttributes attributes = CookieAttributes.defaults();
        if (sessionTtl != null) {
            Instant expiresAt = clock.instant().plus(sessionTtl);
            attributes = attributes.withExpiresAt(expiresAt);
        }
        store.set(AUTH_STATE_KEY, "true", attributes);
    }
}
