package app.walkupmusic.sdk.catalog;

import app.walkupmusic.sdk.AuthenticationException;
import app.walkupmusic.sdk.AuthenticationExpiredException;
import app.walkupmusic.sdk.Config;
import app.walkupmusic.sdk.ForbiddenException;
import app.walkupmusic.sdk.InvalidResponseException;
import app.walkupmusic.sdk.NetworkException;
import app.walkupmusic.sdk.NoRefreshTokenException;
import app.walkupmusic.sdk.RateLimitExceededException;
import app.walkupmusic.sdk.ServiceUnavailableException;
import app.walkupmusic.sdk.SpotifyApiException;
import app.walkupmusic.sdk.SpotifyException;
import app.walkupmusic.sdk.auth.AccountProfile;
import app.walkupmusic.sdk.auth.AuthManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SpotifyCatalogClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String TRACK_RESPONSE = "{\"tracks\":{\"items\":[{"
        + "\"id\":\"2KH16WveTQWT6KOG9Rg6e2\","
        + "\"name\":\"Eye of the Tiger\","
        + "\"artists\":[{\"name\":\"Survivor\"},{\"name\":\"Frankie Sullivan\"}],"
        + "\"album\":{\"name\":\"Eye of the Tiger\",\"images\":["
        + "{\"url\":\"https://i.scdn.co/640\",\"height\":640,\"width\":640},"
        + "{\"url\":\"https://i.scdn.co/300\",\"height\":300,\"width\":300},"
        + "{\"url\":\"https://i.scdn.co/64\",\"height\":64,\"width\":64}]},"
        + "\"preview_url\":null,"
        + "\"duration_ms\":245000,"
        + "\"uri\":\"spotify:track:2KH16WveTQWT6KOG9Rg6e2\"}]}}";

    private HttpServer server;
    private URI baseUri;
    private ExecutorService serverExecutor;
    private final AtomicInteger searchCalls = new AtomicInteger();
    private final AtomicReference<HttpHandler> searchHandler = new AtomicReference<>();
    private final AtomicReference<Map<String, String>> lastQuery = new AtomicReference<>();
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.createContext("/v1/search", exchange -> {
            searchCalls.incrementAndGet();
            lastQuery.set(parseForm(exchange.getRequestURI().getRawQuery()));
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            searchHandler.get().handle(exchange);
        });
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
        searchHandler.set(exchange -> respond(exchange, 200, TRACK_RESPONSE));
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
        serverExecutor.shutdownNow();
    }

    @Test
    void blankQueryMakesNoRequest() throws Exception {
        SpotifyCatalogClient client = newClient(configBuilder().build(), new StubAuthManager(null));

        assertEquals(List.of(), client.searchTracks(""));
        assertEquals(List.of(), client.searchTracks("   ", 5));
        assertEquals(0, searchCalls.get());
    }

    @Test
    void sendsClampedSearchRequestAndMapsTracks() throws Exception {
        SpotifyCatalogClient client = newClient(configBuilder().build(), new StubAuthManager("token-1"));

        List<SearchTrack> tracks = client.searchTracks("eye of the tiger", 100);

        Map<String, String> query = lastQuery.get();
        assertEquals("eye of the tiger", query.get("q"));
        assertEquals("track", query.get("type"));
        assertEquals("US", query.get("market"));
        assertEquals("50", query.get("limit"));
        assertEquals("Bearer token-1", lastAuthorization.get());

        assertEquals(1, tracks.size());
        SearchTrack track = tracks.get(0);
        assertEquals("2KH16WveTQWT6KOG9Rg6e2", track.id());
        assertEquals("Eye of the Tiger", track.name());
        assertEquals(List.of("Survivor", "Frankie Sullivan"), track.artists());
        assertEquals("Eye of the Tiger", track.album());
        assertEquals("https://i.scdn.co/300", track.albumArt());
        assertEquals("", track.previewUrl());
        assertEquals(245000, track.durationMs());
        assertEquals("spotify:track:2KH16WveTQWT6KOG9Rg6e2", track.uri());
    }

    @Test
    void usesDefaultLimit() throws Exception {
        SpotifyCatalogClient client = newClient(configBuilder().build(), new StubAuthManager("token-1"));

        client.searchTracks("queen");

        assertEquals("20", lastQuery.get().get("limit"));
    }

    @Test
    void failsWithoutAccessToken() {
        SpotifyCatalogClient client = newClient(configBuilder().build(), new StubAuthManager(null));

        AuthenticationException ex = assertThrows(AuthenticationException.class, () -> client.searchTracks("queen"));
        assertEquals("No valid access token available", ex.getMessage());
        assertEquals(0, searchCalls.get());
    }

    @Test
    void honoursRetryAfterOnRateLimit() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        searchHandler.set(exchange -> {
            if (attempts.incrementAndGet() == 1) {
                exchange.getResponseHeaders().add("Retry-After", "1");
                respond(exchange, 429, "{\"error\":{\"status\":429,\"message\":\"API rate limit exceeded\"}}");
                return;
            }
            respond(exchange, 200, TRACK_RESPONSE);
        });
        SpotifyCatalogClient client = newClient(
            configBuilder().retryDelay(Duration.ofMillis(10)).build(), new StubAuthManager("token-1"));

        long start = System.nanoTime();
        List<SearchTrack> tracks = client.searchTracks("tiger");
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(1, tracks.size());
        assertEquals(2, searchCalls.get());
        assertTrue(elapsedMillis >= 1000, "elapsed " + elapsedMillis + "ms");
    }

    @Test
    void rateLimitSurfacesOnceRetriesAreSpent() {
        searchHandler.set(exchange -> {
            exchange.getResponseHeaders().add("Retry-After", "2");
            respond(exchange, 429, "{}");
        });
        SpotifyCatalogClient client = newClient(
            configBuilder().maxRetries(0).build(), new StubAuthManager("token-1"));

        RateLimitExceededException ex = assertThrows(RateLimitExceededException.class,
            () -> client.searchTracks("tiger"));
        assertEquals(429, ex.getStatusCode());
        assertEquals(Duration.ofSeconds(2), ex.getRetryAfter());
        assertEquals(1, searchCalls.get());
    }

    @Test
    void retriesServerErrorsUntilExhausted() {
        searchHandler.set(exchange -> respond(exchange, 503, "{\"error\":{\"status\":503,\"message\":\"down\"}}"));
        SpotifyCatalogClient client = newClient(
            configBuilder().maxRetries(2).retryDelay(Duration.ofMillis(10)).build(), new StubAuthManager("token-1"));

        ServiceUnavailableException ex = assertThrows(ServiceUnavailableException.class,
            () -> client.searchTracks("tiger"));
        assertEquals(503, ex.getStatusCode());
        assertEquals(3, searchCalls.get());
    }

    @Test
    void recoversFromTransientServerError() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        searchHandler.set(exchange -> {
            if (attempts.incrementAndGet() < 3) {
                respond(exchange, 502, "");
                return;
            }
            respond(exchange, 200, TRACK_RESPONSE);
        });
        SpotifyCatalogClient client = newClient(
            configBuilder().retryDelay(Duration.ofMillis(10)).build(), new StubAuthManager("token-1"));

        assertEquals(1, client.searchTracks("tiger").size());
        assertEquals(3, searchCalls.get());
    }

    @Test
    void unauthorizedIsNotRetriedButRefreshesCredentials() {
        searchHandler.set(exchange -> respond(exchange, 401, "{\"error\":{\"status\":401,\"message\":\"expired\"}}"));
        StubAuthManager auth = new StubAuthManager("token-1");
        SpotifyCatalogClient client = newClient(configBuilder().build(), auth);

        AuthenticationExpiredException ex = assertThrows(AuthenticationExpiredException.class,
            () -> client.searchTracks("tiger"));
        assertEquals("Spotify authentication expired. Please log in again.", ex.getMessage());
        assertEquals(1, searchCalls.get());
        assertEquals(1, auth.refreshCalls.get());
    }

    @Test
    void unauthorizedStillSurfacesWhenRefreshFails() {
        searchHandler.set(exchange -> respond(exchange, 401, "{}"));
        StubAuthManager auth = new StubAuthManager("token-1");
        auth.failRefresh = true;
        SpotifyCatalogClient client = newClient(configBuilder().build(), auth);

        assertThrows(AuthenticationExpiredException.class, () -> client.searchTracks("tiger"));
        assertEquals(1, auth.refreshCalls.get());
        assertEquals(1, searchCalls.get());
    }

    @Test
    void forbiddenIsNotRetried() {
        searchHandler.set(exchange -> respond(exchange, 403, "{}"));
        StubAuthManager auth = new StubAuthManager("token-1");
        SpotifyCatalogClient client = newClient(configBuilder().build(), auth);

        assertThrows(ForbiddenException.class, () -> client.searchTracks("tiger"));
        assertEquals(1, searchCalls.get());
        assertEquals(0, auth.refreshCalls.get());
    }

    @Test
    void serverErrorHonoursRetryAfter() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        searchHandler.set(exchange -> {
            if (attempts.incrementAndGet() == 1) {
                exchange.getResponseHeaders().add("Retry-After", "1");
                respond(exchange, 503, "{}");
                return;
            }
            respond(exchange, 200, TRACK_RESPONSE);
        });
        SpotifyCatalogClient client = newClient(
            configBuilder().retryDelay(Duration.ofMillis(10)).build(), new StubAuthManager("token-1"));

        long start = System.nanoTime();
        assertEquals(1, client.searchTracks("tiger").size());
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(2, searchCalls.get());
        assertTrue(elapsedMillis >= 1000, "elapsed " + elapsedMillis + "ms");
    }

    @Test
    void dropsDuplicateTracksKeepingFirstOccurrence() throws Exception {
        searchHandler.set(exchange -> respond(exchange, 200, "{\"tracks\":{\"items\":["
            + "{\"id\":\"same\",\"name\":\"First\",\"artists\":[],\"album\":{\"images\":[]}},"
            + "{\"id\":\"other\",\"name\":\"Other\",\"artists\":[],\"album\":{\"images\":[]}},"
            + "{\"id\":\"same\",\"name\":\"Second\",\"artists\":[],\"album\":{\"images\":[]}}]}}"));
        SpotifyCatalogClient client = newClient(configBuilder().build(), new StubAuthManager("token-1"));

        List<SearchTrack> tracks = client.searchTracks("same");

        assertEquals(List.of("First", "Other"), tracks.stream().map(SearchTrack::name).toList());
    }

    @Test
    void otherClientErrorsCarryDecodedMessage() {
        searchHandler.set(exchange ->
            respond(exchange, 400, "{\"error\":{\"status\":400,\"message\":\"No search query\"}}"));
        SpotifyCatalogClient client = newClient(configBuilder().build(), new StubAuthManager("token-1"));

        SpotifyApiException ex = assertThrows(SpotifyApiException.class, () -> client.searchTracks("tiger"));
        assertEquals(400, ex.getStatusCode());
        assertEquals("Spotify API error: No search query", ex.getMessage());
        assertEquals(1, searchCalls.get());
    }

    @Test
    void networkFailuresAreRetriedThenSurfaced() throws Exception {
        HttpServer closed = HttpServer.create(new InetSocketAddress(0), 0);
        int port = closed.getAddress().getPort();
        closed.stop(0);

        Config config = configBuilder()
            .apiBaseUrl("http://localhost:" + port + "/v1")
            .maxRetries(1)
            .retryDelay(Duration.ofMillis(10))
            .build();
        SpotifyCatalogClient client = newClient(config, new StubAuthManager("token-1"));

        assertThrows(NetworkException.class, () -> client.searchTracks("tiger"));
    }

    @Test
    void rejectsMalformedResponses() {
        SpotifyCatalogClient client = newClient(configBuilder().build(), new StubAuthManager("token-1"));

        searchHandler.set(exchange -> respond(exchange, 200, "{not json"));
        assertThrows(InvalidResponseException.class, () -> client.searchTracks("tiger"));

        searchHandler.set(exchange -> respond(exchange, 200, "{\"artists\":{}}"));
        InvalidResponseException missing = assertThrows(InvalidResponseException.class,
            () -> client.searchTracks("tiger"));
        assertTrue(missing.getMessage().contains("tracks"));

        searchHandler.set(exchange -> respond(exchange, 200, "{\"tracks\":{\"items\":{}}}"));
        assertThrows(InvalidResponseException.class, () -> client.searchTracks("tiger"));
    }

    @Test
    void emptyResultIsNotAnError() throws Exception {
        searchHandler.set(exchange -> respond(exchange, 200, "{\"tracks\":{\"items\":[]}}"));
        SpotifyCatalogClient client = newClient(configBuilder().build(), new StubAuthManager("token-1"));

        assertTrue(client.searchTracks("zzzz").isEmpty());
    }

    @Test
    void concurrentSearchesShareRateLimit() throws Exception {
        SpotifyCatalogClient client = newClient(
            configBuilder().maxRequestsPerSecond(2).build(), new StubAuthManager("token-1"));

        ExecutorService callers = Executors.newFixedThreadPool(3);
        long start = System.nanoTime();
        try {
            List<Future<List<SearchTrack>>> results = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                results.add(callers.submit(() -> client.searchTracks("tiger")));
            }
            for (Future<List<SearchTrack>> result : results) {
                assertEquals(1, result.get(10, TimeUnit.SECONDS).size());
            }
        } finally {
            callers.shutdownNow();
        }
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(3, searchCalls.get());
        assertTrue(elapsedMillis >= 950, "elapsed " + elapsedMillis + "ms");
    }

    @Test
    void selectsAlbumArtClosestToThreeHundredPixels() throws Exception {
        assertEquals("https://img/300", SpotifyCatalogClient.selectAlbumArt(MAPPER.readTree(
            "[{\"url\":\"https://img/640\",\"height\":640},{\"url\":\"https://img/300\",\"height\":300},"
                + "{\"url\":\"https://img/64\",\"height\":64}]")));
        assertEquals("https://img/400", SpotifyCatalogClient.selectAlbumArt(MAPPER.readTree(
            "[{\"url\":\"https://img/200\",\"height\":200},{\"url\":\"https://img/400\",\"height\":400}]")));
        assertEquals("https://img/w320", SpotifyCatalogClient.selectAlbumArt(MAPPER.readTree(
            "[{\"url\":\"https://img/640\",\"height\":640},{\"url\":\"https://img/w320\",\"height\":null,\"width\":320}]")));
        assertEquals("https://img/unknown", SpotifyCatalogClient.selectAlbumArt(MAPPER.readTree(
            "[{\"url\":\"https://img/unknown\"}]")));
        assertEquals("", SpotifyCatalogClient.selectAlbumArt(MAPPER.readTree("[]")));
        assertEquals("", SpotifyCatalogClient.selectAlbumArt(MAPPER.missingNode()));
    }

    private SpotifyCatalogClient newClient(Config config, AuthManager authManager) {
        return new SpotifyCatalogClient(config, authManager);
    }

    private Config.Builder configBuilder() {
        return Config.builder()
            .clientId("client-id")
            .apiBaseUrl(baseUri.resolve("/v1").toString())
            .httpClient(HttpClient.newHttpClient())
            .httpTimeout(Duration.ofSeconds(5));
    }

    private static final class StubAuthManager implements AuthManager {
        private final String token;
        private final AtomicInteger refreshCalls = new AtomicInteger();
        private volatile boolean failRefresh;

        private StubAuthManager(String token) {
            this.token = token;
        }

        @Override
        public void login() {
        }

        @Override
        public void handleCallback(String code, String state) {
        }

        @Override
        public Optional<String> getAccessToken() {
            return Optional.ofNullable(token);
        }

        @Override
        public void refreshToken() throws SpotifyException {
            refreshCalls.incrementAndGet();
            if (failRefresh) {
                throw new NoRefreshTokenException();
            }
        }

        @Override
        public void logout() {
        }

        @Override
        public boolean isAuthenticated() {
            return token != null;
        }

        @Override
        public Optional<AccountProfile> currentUser() {
            return Optional.empty();
        }
    }

    private static Map<String, String> parseForm(String body) {
        Map<String, String> params = new HashMap<>();
        if (body == null || body.isEmpty()) {
            return params;
        }
        Arrays.stream(body.split("&"))
            .filter(part -> !part.isEmpty())
            .forEach(part -> {
                String[] pieces = part.split("=", 2);
                String key = URLDecoder.decode(pieces[0], StandardCharsets.UTF_8);
                String value = pieces.length > 1 ? URLDecoder.decode(pieces[1], StandardCharsets.UTF_8) : "";
                params.put(key, value);
            });
        return params;
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] payload = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length == 0 ? -1 : payload.length);
        if (payload.length == 0) {
            exchange.close();
            return;
        }
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
    }
}
