package app.walkupmusic.sdk.auth;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;
import java.util.logging.Logger;

/**
 * Opens the authorization page in the system browser, or logs the URL when no desktop is available.
 */
public final class DesktopNavigator implements AuthorizationNavigator {

    private static final Logger LOGGER = Logger.getLogger(DesktopNavigator.class.getName());

    @Override
    public void navigate(URI authorizationUri) throws IOException {
        if (!GraphicsEnvironment.isHeadless()
            && Desktop.isDesktopSupported()
            && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
            Desktop.getDesktop().browse(authorizationUri);
            return;
        }
        LOGGER.info(() -> "[walkup-sdk] open this URL to log in to Spotify: " + authorizationUri);
    }
}
