package app.walkupmusic.sdk.auth;

/**
 * Subset of the Spotify {@code /me} profile the app relies on.
 */
public record AccountProfile(String id, String displayName, String email, String product) {

    public static final String PREMIUM = "premium";

    public boolean isPremium() {
        return PREMIUM.equals(product);
    }
}
