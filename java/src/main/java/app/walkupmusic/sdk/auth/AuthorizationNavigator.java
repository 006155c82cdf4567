package app.walkupmusic.sdk.auth;

import java.io.IOException;
import java.net.URI;

/**
 * Sends the user to the Spotify authorization page. The navigation ends the login call; the flow resumes when
 * the host application receives the redirect and calls {@link AuthManager#handleCallback(String, String)}.
 */
@FunctionalInterface
public interface AuthorizationNavigator {

    void navigate(URI authorizationUri) throws IOException;
}
