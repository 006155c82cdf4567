package app.walkupmusic.sdk.store;

import java.util.Optional;

/**
 * Durable key/value storage for PKCE artifacts and OAuth tokens, modelled on browser cookies: every value carries
 * an expiry and a path scope. Implementations must be safe for concurrent use; a value may disappear between two
 * calls because another component logged out.
 */
public interface CredentialStore {

    void set(String name, String value, CookieAttributes attributes);

    default void set(String name, String value) {
        set(name, value, CookieAttributes.defaults());
    }

    /**
     * @return the stored value, or empty when absent or expired.
     */
    Optional<String> get(String name);

    /**
     * Removes {@code name} if it was stored under {@code path}. Deleting an absent value is not an error.
     */
    void delete(String name, String path);

    default void delete(String name) {
        delete(name, CookieAttributes.DEFAULT_PATH);
    }

    /**
     * Performs a write/read/delete round trip with a throwaway key.
     *
     * @return {@code false} when the backing medium rejects persistence.
     */
    boolean isAvailable();
}
