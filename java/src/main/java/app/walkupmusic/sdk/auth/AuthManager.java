package app.walkupmusic.sdk.auth;

import app.walkupmusic.sdk.SpotifyException;

import java.util.Optional;

/**
 * Authentication state machine shared by every Spotify consumer in the app.
 *
 * <p>{@link #getAccessToken()} and {@link #refreshToken()} deliberately have different error contracts: the former
 * never throws and logs the user out when an implicit refresh fails, the latter surfaces the failure so a UI can
 * prompt for a new login.</p>
 */
public interface AuthManager {

    /**
     * Mints a PKCE session, persists it and navigates to the authorization server.
     *
     * @throws SpotifyException when the session cannot be persisted or navigation fails; nothing is opened then.
     */
    void login() throws SpotifyException;

    /**
     * Completes the authorization-code flow.
     *
     * @throws app.walkupmusic.sdk.CsrfException when {@code state} does not match the stored one.
     * @throws app.walkupmusic.sdk.MissingVerifierException when the stored verifier is gone.
     * @throws app.walkupmusic.sdk.PremiumRequiredException when the account is not Premium; no credential is kept.
     */
    void handleCallback(String code, String state) throws SpotifyException;

    /**
     * @return a bearer token valid beyond the refresh buffer, refreshing first when needed; empty when logged out
     *     or when the refresh failed (which also logs the user out).
     */
    Optional<String> getAccessToken();

    /**
     * Forces a refresh and throws on failure without logging out.
     *
     * @throws app.walkupmusic.sdk.NoRefreshTokenException when no refresh token is stored.
     */
    void refreshToken() throws SpotifyException;

    /**
     * Clears every stored credential. Idempotent.
     */
    void logout();

    /**
     * Pure check over the in-memory credential; performs no I/O.
     */
    boolean isAuthenticated();

    /**
     * @return the logged-in account, or empty when logged out or when Spotify no longer accepts the token.
     */
    Optional<AccountProfile> currentUser() throws SpotifyException;
}
