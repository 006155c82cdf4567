package app.walkupmusic.sdk.catalog;

import app.walkupmusic.sdk.AuthenticationException;
import app.walkupmusic.sdk.AuthenticationExpiredException;
import app.walkupmusic.sdk.Config;
import app.walkupmusic.sdk.ForbiddenException;
import app.walkupmusic.sdk.InvalidResponseException;
import app.walkupmusic.sdk.NetworkException;
import app.walkupmusic.sdk.RateLimitExceededException;
import app.walkupmusic.sdk.ServiceUnavailableException;
import app.walkupmusic.sdk.SpotifyApiException;
import app.walkupmusic.sdk.SpotifyException;
import app.walkupmusic.sdk.auth.AuthManager;
import app.walkupmusic.sdk.internal.ApiErrorDecoder;
import app.walkupmusic.sdk.internal.HttpUtil;
import app.walkupmusic.sdk.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TrackCatalog} backed by the Spotify Web API search endpoint.
 *
 * <p>Every attempt, retries included, passes through one shared {@link RateLimiter}. Failures are classified by
 * {@link ResponseClass} and the {@link RetryPolicy} decides whether to try again; callers only see an error once
 * the retry budget is spent. The bearer token is captured once per search, so a logout racing an in-flight search
 * does not abort it. A 401 is never retried, but it triggers a credential refresh so the following search does
 * not reuse the rejected token.</p>
 */
public final class SpotifyCatalogClient implements TrackCatalog {

    private static final Logger LOGGER = Logger.getLogger(SpotifyCatalogClient.class.getName());

    static final String MARKET = "US";
    static final int ALBUM_ART_TARGET_PX = 300;

    private final AuthManager authManager;
    private final HttpClient httpClient;
    private final String apiBaseUrl;
    private final Duration requestTimeout;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;

    public SpotifyCatalogClient(Config config, AuthManager authManager) {
        this(config, authManager,
            new RateLimiter(config.getMaxRequestsPerSecond()),
            new RetryPolicy(config.getMaxRetries(), config.getRetryDelay()));
    }

    public SpotifyCatalogClient(Config config, AuthManager authManager, RateLimiter rateLimiter, RetryPolicy retryPolicy) {
        Objects.requireNonNull(config, "config");
        this.authManager = Objects.requireNonNull(authManager, "authManager");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.httpClient = config.getHttpClient();
        this.apiBaseUrl = config.getApiBaseUrl();
        this.requestTimeout = config.getHttpTimeout();
    }

    @Override
    public List<SearchTrack> searchTracks(String query, int limit) throws SpotifyException {
        if (query == null || query.isBlank()) {
            return List.of();
        }

        String bearer = authManager.getAccessToken()
            .orElseThrow(() -> new AuthenticationException("No valid access token available"));

        HttpResponse<byte[]> response = execute(searchUrl(query, TrackCatalog.clampLimit(limit)), bearer);
        JsonNode root;
        try {
            root = Json.mapper().readTree(response.body());
        } catch (IOException ex) {
            throw new InvalidResponseException("decode search response: " + ex.getMessage(), ex);
        }
        return parseSearchResponse(root);
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    String searchUrl(String query, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("type", "track");
        params.put("market", MARKET);
        params.put("limit", Integer.toString(limit));
        return apiBaseUrl + "/search?" + HttpUtil.formEncode(params);
    }

    private HttpResponse<byte[]> execute(String url, String bearer) throws SpotifyException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .GET()
            .header("Authorization", "Bearer " + bearer)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .timeout(requestTimeout)
            .build();

        int retries = 0;
        while (true) {
            acquireSlot();

            HttpResponse<byte[]> response = null;
            IOException transportFailure = null;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new NetworkException("search request interrupted", ex);
            } catch (IOException ex) {
                transportFailure = ex;
            }

            ResponseClass outcome = response == null ? ResponseClass.NETWORK_FAILURE : ResponseClass.of(response.statusCode());
            if (outcome == ResponseClass.SUCCESS) {
                return response;
            }

            Duration retryAfter = null;
            if (response != null) {
                retryAfter = RetryPolicy.parseRetryAfter(
                    response.headers().firstValue("Retry-After").orElse(null), Instant.now());
            }

            Optional<Duration> delay = retryPolicy.nextDelay(outcome, retries, retryAfter);
            if (delay.isEmpty()) {
                if (outcome == ResponseClass.UNAUTHORIZED) {
                    refreshAfterRejection();
                }
                throw failure(outcome, response, transportFailure, retryAfter);
            }

            int attempt = retries + 1;
            LOGGER.fine(() -> String.format(Locale.ROOT,
                "[walkup-sdk] search attempt %d failed (%s); retrying in %dms",
                attempt, outcome, delay.get().toMillis()));
            pause(delay.get());
            retries++;
        }
    }

    /**
     * The token was rejected before its local expiry, so ask for a new one now; the next search picks it up.
     * The 401 is still reported to the caller.
     */
    private void refreshAfterRejection() {
        try {
            authManager.refreshToken();
            LOGGER.info("[walkup-sdk] access token rejected by Spotify; refreshed for the next request");
        } catch (SpotifyException ex) {
            LOGGER.log(Level.WARNING, "[walkup-sdk] access token rejected by Spotify and refresh failed: "
                + ex.getMessage(), ex);
        }
    }

    private void acquireSlot() throws NetworkException {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new NetworkException("interrupted while waiting for rate limiter", ex);
        }
    }

    private static void pause(Duration delay) throws NetworkException {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new NetworkException("interrupted while waiting to retry", ex);
        }
    }

    private static SpotifyException failure(
        ResponseClass outcome,
        HttpResponse<byte[]> response,
        IOException transportFailure,
        Duration retryAfter
    ) {
        switch (outcome) {
            case UNAUTHORIZED:
                return new AuthenticationExpiredException();
            case FORBIDDEN:
                return new ForbiddenException();
            case RATE_LIMITED:
                return new RateLimitExceededException(retryAfter);
            case SERVER_ERROR:
                return new ServiceUnavailableException(response.statusCode());
            case NETWORK_FAILURE:
                return new NetworkException("search request: " + transportFailure.getMessage(), transportFailure);
            default:
                String message = ApiErrorDecoder.message(response.body());
                return new SpotifyApiException(response.statusCode(),
                    message == null ? null : "Spotify API error: " + message);
        }
    }

    static List<SearchTrack> parseSearchResponse(JsonNode root) throws InvalidResponseException {
        if (root == null || !root.isObject()) {
            throw new InvalidResponseException("Invalid search response: must be an object");
        }
        JsonNode tracks = root.path("tracks");
        if (!tracks.isObject()) {
            throw new InvalidResponseException("Invalid search response: missing tracks object");
        }
        JsonNode items = tracks.path("items");
        if (!items.isArray()) {
            throw new InvalidResponseException("Invalid search response: tracks.items must be an array");
        }

        // first occurrence of each id wins
        Map<String, SearchTrack> unique = new LinkedHashMap<>();
        for (JsonNode item : items) {
            if (item == null || item.isNull()) {
                continue;
            }
            SearchTrack track = toSearchTrack(item);
            unique.putIfAbsent(track.id(), track);
        }
        return new ArrayList<>(unique.values());
    }

    static SearchTrack toSearchTrack(JsonNode item) {
        List<String> artists = new ArrayList<>();
        for (JsonNode artist : item.path("artists")) {
            String name = artist.path("name").asText("");
            if (!name.isBlank()) {
                artists.add(name);
            }
        }

        JsonNode album = item.path("album");
        JsonNode previewUrl = item.path("preview_url");

        return new SearchTrack(
            item.path("id").asText(""),
            item.path("name").asText(""),
            artists,
            album.path("name").asText(""),
            selectAlbumArt(album.path("images")),
            previewUrl.isTextual() ? previewUrl.asText() : "",
            item.path("duration_ms").asLong(0L),
            item.path("uri").asText("")
        );
    }

    /**
     * Picks the image whose height (width when height is unknown) is closest to 300px, preferring the larger image
     * on a tie.
     */
    static String selectAlbumArt(JsonNode images) {
        String best = "";
        long bestDistance = Long.MAX_VALUE;
        long bestSize = -1;
        for (JsonNode image : images) {
            String url = image.path("url").asText("");
            if (url.isBlank()) {
                continue;
            }
            long size = image.path("height").canConvertToLong()
                ? image.path("height").asLong()
                : image.path("width").asLong(-1L);
            long distance = size < 0 ? Long.MAX_VALUE - 1 : Math.abs(size - ALBUM_ART_TARGET_PX);
            if (distance < bestDistance || (distance == bestDistance && size > bestSize)) {
                best = url;
                bestDistance = distance;
                bestSize = size;
            }
        }
        return best;
    }
}
