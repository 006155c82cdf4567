package app.walkupmusic.sdk.store;

/**
 * Cross-site sending policy for a stored credential.
 */
public enum SameSite {
    STRICT,
    LAX,
    NONE
}
