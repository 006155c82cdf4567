package app.walkupmusic.sdk;

/**
 * The authenticated Spotify account is not on the Premium tier.
 */
public final class PremiumRequiredException extends SpotifyException {

    private static final long serialVersionUID = 1L;

    private final String product;

    public PremiumRequiredException(String product) {
        super("Spotify Premium subscription is required to use this application");
        this.product = product;
    }

    /**
     * @return the subscription tier Spotify reported, e.g. {@code free} or {@code open}.
     */
    public String getProduct() {
        return product;
    }
}
