package app.walkupmusic.sdk;

import app.walkupmusic.sdk.auth.AuthManager;
import app.walkupmusic.sdk.auth.AuthorizationNavigator;
import app.walkupmusic.sdk.auth.DesktopNavigator;
import app.walkupmusic.sdk.auth.MockAuthManager;
import app.walkupmusic.sdk.auth.SpotifyAuthManager;
import app.walkupmusic.sdk.catalog.MockTrackCatalog;
import app.walkupmusic.sdk.catalog.SearchTrack;
import app.walkupmusic.sdk.catalog.SpotifyCatalogClient;
import app.walkupmusic.sdk.catalog.TrackCatalog;
import app.walkupmusic.sdk.store.CredentialStore;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point wiring Spotify authentication and catalog search together. Construct one instance at
 * application start and pass it (or its {@link #auth()} and {@link #catalog()} views) to every consumer; there is
 * no global instance. Tests build their own isolated client per case.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>{@link Config#isMockMode()} swaps in {@link MockAuthManager} and {@link MockTrackCatalog} so the app runs
 *       without Spotify credentials.</li>
 *   <li>All operations are thread-safe. The {@code *Async} variants run on a client-owned executor; cancelling
 *       the returned future does not interrupt a search that is mid-retry.</li>
 * </ul>
 */
public final class WalkupClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(WalkupClient.class.getName());

    private final Config config;
    private final CredentialStore store;
    private final AuthManager authManager;
    private final TrackCatalog catalog;
    private final ExecutorService executor;

    public WalkupClient(Config config, CredentialStore store) {
        this(config, store, new DesktopNavigator());
    }

    /**
     * @param config    caller-supplied configuration; defaults are applied again so a partially built config is safe
     * @param store     where PKCE artifacts and tokens persist
     * @param navigator how the login redirect reaches the user; ignored in mock mode
     */
    public WalkupClient(Config config, CredentialStore store, AuthorizationNavigator navigator) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.store = Objects.requireNonNull(store, "store");
        Objects.requireNonNull(navigator, "navigator");

        if (this.config.isMockMode()) {
            LOGGER.info("[walkup-sdk] mock mode enabled; Spotify will not be contacted");
            this.authManager = new MockAuthManager(store);
            this.catalog = new MockTrackCatalog();
        } else {
            this.authManager = new SpotifyAuthManager(this.config, store, navigator);
            this.catalog = new SpotifyCatalogClient(this.config, authManager);
        }
        this.executor = Executors.newCachedThreadPool(new SdkThreadFactory());
    }

    public Config config() {
        return config;
    }

    public CredentialStore store() {
        return store;
    }

    public AuthManager auth() {
        return authManager;
    }

    public TrackCatalog catalog() {
        return catalog;
    }

    public List<SearchTrack> searchTracks(String query) throws SpotifyException {
        return catalog.searchTracks(query);
    }

    public List<SearchTrack> searchTracks(String query, int limit) throws SpotifyException {
        return catalog.searchTracks(query, limit);
    }

    public CompletableFuture<List<SearchTrack>> searchTracksAsync(String query, int limit) {
        CompletableFuture<List<SearchTrack>> future = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                future.complete(catalog.searchTracks(query, limit));
            } catch (SpotifyException | RuntimeException ex) {
                future.completeExceptionally(ex);
            }
        });
        return future;
    }

    public CompletableFuture<Void> handleCallbackAsync(String code, String state) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                authManager.handleCallback(code, state);
                future.complete(null);
            } catch (SpotifyException | RuntimeException ex) {
                future.completeExceptionally(ex);
            }
        });
        return future;
    }

    /**
     * Stops accepting async work. Tasks already running complete normally.
     */
    @Override
    public void close() {
        executor.shutdown();
    }

    private static final class SdkThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "walkup-sdk-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
