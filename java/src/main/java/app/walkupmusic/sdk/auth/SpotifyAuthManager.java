package app.walkupmusic.sdk.auth;

import app.walkupmusic.sdk.AuthenticationException;
import app.walkupmusic.sdk.AuthenticationExpiredException;
import app.walkupmusic.sdk.Config;
import app.walkupmusic.sdk.CsrfException;
import app.walkupmusic.sdk.InvalidResponseException;
import app.walkupmusic.sdk.MissingVerifierException;
import app.walkupmusic.sdk.NetworkException;
import app.walkupmusic.sdk.NoRefreshTokenException;
import app.walkupmusic.sdk.PremiumRequiredException;
import app.walkupmusic.sdk.SpotifyApiException;
import app.walkupmusic.sdk.SpotifyException;
import app.walkupmusic.sdk.ValidationException;
import app.walkupmusic.sdk.internal.ApiErrorDecoder;
import app.walkupmusic.sdk.internal.HttpUtil;
import app.walkupmusic.sdk.internal.Json;
import app.walkupmusic.sdk.store.CookieAttributes;
import app.walkupmusic.sdk.store.CredentialStore;
import app.walkupmusic.sdk.store.SameSite;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link AuthManager} performing the Spotify authorization-code flow with PKCE.
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Credentials live in one {@link CredentialRecord} held in memory and mirrored to the {@link CredentialStore};
 *       a record found in the store at construction time is restored.</li>
 *   <li>Refreshes are funnelled through a single lock so concurrent callers of {@link #getAccessToken()} share one
 *       token-endpoint call.</li>
 *   <li>A record is swapped in with compare-and-set, so a refresh finishing after a concurrent {@link #logout()}
 *       never resurrects the session.</li>
 * </ul>
 */
public final class SpotifyAuthManager implements AuthManager {

    private static final Logger LOGGER = Logger.getLogger(SpotifyAuthManager.class.getName());

    static final String ACCESS_TOKEN_KEY = "spotify_access_token";
    static final String REFRESH_TOKEN_KEY = "spotify_refresh_token";
    static final String EXPIRES_AT_KEY = "spotify_expires_at";
    static final String SCOPE_KEY = "spotify_scope";
    static final String CODE_VERIFIER_KEY = "spotify_code_verifier";
    static final String STATE_KEY = "spotify_state";
    static final List<String> ALL_KEYS = List.of(
        ACCESS_TOKEN_KEY, REFRESH_TOKEN_KEY, EXPIRES_AT_KEY, SCOPE_KEY, CODE_VERIFIER_KEY, STATE_KEY);

    static final Duration REFRESH_TOKEN_LIFETIME = Duration.ofDays(30);

    private final Config config;
    private final CredentialStore store;
    private final AuthorizationNavigator navigator;
    private final PkceGenerator pkce;
    private final Clock clock;
    private final HttpClient httpClient;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicReference<CredentialRecord> credentials = new AtomicReference<>();

    public SpotifyAuthManager(Config config, CredentialStore store, AuthorizationNavigator navigator) {
        this(config, store, navigator, new PkceGenerator(), Clock.systemUTC());
    }

    public SpotifyAuthManager(
        Config config,
        CredentialStore store,
        AuthorizationNavigator navigator,
        PkceGenerator pkce,
        Clock clock
    ) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.navigator = Objects.requireNonNull(navigator, "navigator");
        this.pkce = Objects.requireNonNull(pkce, "pkce");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.httpClient = config.getHttpClient();

        if (!store.isAvailable()) {
            LOGGER.warning("[walkup-sdk] credential storage is not available; sessions will not persist");
        }
        restoreFromStore();
    }

    @Override
    public void login() throws SpotifyException {
        PkceSession session = PkceSession.create(pkce, clock.instant());
        String challenge = pkce.generateCodeChallenge(session.verifier());

        CookieAttributes attributes = CookieAttributes.defaults()
            .withMaxAge(PkceSession.TTL)
            .withSameSite(SameSite.LAX)
            .withPath(config.getBasePath())
            .withSecure(config.isSecureCookies());
        try {
            store.set(CODE_VERIFIER_KEY, session.verifier(), attributes);
            store.set(STATE_KEY, session.state(), attributes);
        } catch (UncheckedIOException ex) {
            throw new SpotifyException("persist PKCE session: " + ex.getMessage(), ex);
        }

        URI authorizationUri = authorizationUri(challenge, session.state());
        LOGGER.info("[walkup-sdk] redirecting to Spotify authorization");
        try {
            navigator.navigate(authorizationUri);
        } catch (IOException ex) {
            throw new SpotifyException("open authorization page: " + ex.getMessage(), ex);
        }
    }

    URI authorizationUri(String challenge, String state) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("response_type", "code");
        params.put("client_id", config.getClientId());
        params.put("redirect_uri", config.getRedirectUri());
        params.put("code_challenge", challenge);
        params.put("code_challenge_method", PkceGenerator.CHALLENGE_METHOD);
        params.put("state", state);
        params.put("scope", String.join(" ", config.getScopes()));
        return URI.create(config.getAuthorizeUrl() + "?" + HttpUtil.formEncode(params));
    }

    @Override
    public void handleCallback(String code, String state) throws SpotifyException {
        Optional<String> storedState = store.get(STATE_KEY);
        if (storedState.isEmpty() || state == null || !constantTimeEquals(storedState.get(), state)) {
            throw new CsrfException();
        }

        String path = config.getBasePath();
        try {
            // state is single-use from here on, whatever the outcome
            store.delete(STATE_KEY, path);

            String verifier = store.get(CODE_VERIFIER_KEY).orElseThrow(MissingVerifierException::new);
            if (code == null || code.isBlank()) {
                throw new ValidationException("Authorization code is required");
            }

            TokenResponse tokens = exchangeCode(code, verifier);
            AccountProfile profile = fetchProfile(tokens.accessToken());
            if (!profile.isPremium()) {
                LOGGER.info(() -> "[walkup-sdk] rejecting login for non-premium account (product "
                    + profile.product() + ")");
                throw new PremiumRequiredException(profile.product());
            }

            CredentialRecord record = tokens.toRecord(clock.instant(), null);
            credentials.set(record);
            persist(record);
            LOGGER.info("[walkup-sdk] Spotify login completed");
        } finally {
            deleteQuietly(CODE_VERIFIER_KEY, path);
            deleteQuietly(STATE_KEY, path);
        }
    }

    @Override
    public Optional<String> getAccessToken() {
        CredentialRecord current = credentials.get();
        if (current == null) {
            return Optional.empty();
        }
        if (current.isFresh(clock.instant(), config.getTokenRefreshBuffer())) {
            return Optional.of(current.accessToken());
        }

        refreshLock.lock();
        try {
            current = credentials.get();
            if (current == null) {
                return Optional.empty();
            }
            if (current.isFresh(clock.instant(), config.getTokenRefreshBuffer())) {
                return Optional.of(current.accessToken());
            }

            try {
                return Optional.of(refresh(current).accessToken());
            } catch (SpotifyException ex) {
                LOGGER.log(Level.WARNING, "[walkup-sdk] token refresh failed, logging out: " + ex.getMessage(), ex);
                logout();
                return Optional.empty();
            }
        } finally {
            refreshLock.unlock();
        }
    }

    @Override
    public void refreshToken() throws SpotifyException {
        refreshLock.lock();
        try {
            CredentialRecord current = credentials.get();
            if (current == null || !current.hasRefreshToken()) {
                throw new NoRefreshTokenException();
            }
            refresh(current);
        } finally {
            refreshLock.unlock();
        }
    }

    @Override
    public void logout() {
        credentials.set(null);
        String path = config.getBasePath();
        for (String key : ALL_KEYS) {
            deleteQuietly(key, path);
        }
        LOGGER.info("[walkup-sdk] logged out of Spotify");
    }

    @Override
    public boolean isAuthenticated() {
        CredentialRecord current = credentials.get();
        return current != null && !current.isExpired(clock.instant());
    }

    @Override
    public Optional<AccountProfile> currentUser() throws SpotifyException {
        if (!isAuthenticated()) {
            return Optional.empty();
        }
        Optional<String> token = getAccessToken();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(fetchProfile(token.get()));
        } catch (AuthenticationExpiredException ex) {
            LOGGER.warning("[walkup-sdk] access token rejected by Spotify, clearing authentication");
            logout();
            return Optional.empty();
        }
    }

    /**
     * Snapshot of the current credential, mainly for diagnostics.
     */
    public Optional<CredentialRecord> credentials() {
        return Optional.ofNullable(credentials.get());
    }

    private CredentialRecord refresh(CredentialRecord current) throws SpotifyException {
        if (!current.hasRefreshToken()) {
            throw new NoRefreshTokenException();
        }

        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", current.refreshToken());
        form.put("client_id", config.getClientId());

        TokenResponse tokens = requestToken(form, true);
        CredentialRecord refreshed = tokens.toRecord(clock.instant(), current.refreshToken());
        if (!credentials.compareAndSet(current, refreshed)) {
            throw new AuthenticationException("Session ended while the token was being refreshed");
        }
        persist(refreshed);
        LOGGER.info(() -> "[walkup-sdk] access token refreshed, valid until " + refreshed.expiresAt());
        return refreshed;
    }

    private TokenResponse exchangeCode(String code, String verifier) throws SpotifyException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("redirect_uri", config.getRedirectUri());
        form.put("client_id", config.getClientId());
        form.put("code_verifier", verifier);
        return requestToken(form, false);
    }

    private TokenResponse requestToken(Map<String, String> form, boolean refreshing) throws SpotifyException {
        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.postForm(httpClient, config.getTokenUrl(), form, config.getHttpTimeout());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new NetworkException("request token interrupted", ex);
        } catch (IOException ex) {
            throw new NetworkException("request token: " + ex.getMessage(), ex);
        }

        try (InputStream body = response.body()) {
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                String message = ApiErrorDecoder.message(body);
                if (refreshing && (status == 400 || status == 401)) {
                    throw new SpotifyApiException(status, "Refresh token is invalid or expired");
                }
                throw new SpotifyApiException(status, message == null ? "Token request failed: " + status : message);
            }
            return TokenResponse.parse(Json.mapper().readTree(body));
        } catch (IOException ex) {
            throw new InvalidResponseException("decode token response: " + ex.getMessage(), ex);
        }
    }

    private AccountProfile fetchProfile(String accessToken) throws SpotifyException {
        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.getJson(httpClient, config.getApiBaseUrl() + "/me", accessToken, config.getHttpTimeout());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new NetworkException("fetch profile interrupted", ex);
        } catch (IOException ex) {
            throw new NetworkException("fetch profile: " + ex.getMessage(), ex);
        }

        try (InputStream body = response.body()) {
            int status = response.statusCode();
            if (status == 401) {
                throw new AuthenticationExpiredException();
            }
            if (status < 200 || status >= 300) {
                String message = ApiErrorDecoder.message(body);
                throw new SpotifyApiException(status, message == null ? "Failed to fetch user profile: " + status : message);
            }

            JsonNode node = Json.mapper().readTree(body);
            String id = node.path("id").asText("");
            if (id.isBlank()) {
                throw new InvalidResponseException("Invalid Spotify user profile: id must be a non-empty string");
            }
            JsonNode product = node.path("product");
            if (!product.isTextual()) {
                throw new InvalidResponseException("Invalid Spotify user profile: product must be a string");
            }
            return new AccountProfile(
                id,
                node.path("display_name").asText(""),
                node.path("email").asText(""),
                product.asText()
            );
        } catch (IOException ex) {
            throw new InvalidResponseException("decode profile response: " + ex.getMessage(), ex);
        }
    }

    private void persist(CredentialRecord record) {
        CookieAttributes attributes = CookieAttributes.defaults()
            .withExpiresAt(record.expiresAt())
            .withPath(config.getBasePath())
            .withSecure(config.isSecureCookies());
        try {
            store.set(ACCESS_TOKEN_KEY, record.accessToken(), attributes);
            store.set(EXPIRES_AT_KEY, Long.toString(record.expiresAt().toEpochMilli()), attributes);
            store.set(SCOPE_KEY, record.scope(), attributes);
            if (record.hasRefreshToken()) {
                store.set(REFRESH_TOKEN_KEY, record.refreshToken(),
                    attributes.withExpiresAt(null).withMaxAge(REFRESH_TOKEN_LIFETIME));
            }
        } catch (UncheckedIOException ex) {
            LOGGER.log(Level.WARNING, "[walkup-sdk] could not persist credentials; session will not survive a restart", ex);
        }
    }

    private void restoreFromStore() {
        try {
            Optional<String> accessToken = store.get(ACCESS_TOKEN_KEY);
            Optional<String> expiresAt = store.get(EXPIRES_AT_KEY);
            Optional<String> scope = store.get(SCOPE_KEY);
            if (accessToken.isEmpty() || expiresAt.isEmpty() || scope.isEmpty()) {
                return;
            }

            long expiresAtMillis;
            try {
                expiresAtMillis = Long.parseLong(expiresAt.get().trim());
            } catch (NumberFormatException ex) {
                LOGGER.fine(() -> "[walkup-sdk] ignoring stored credential with unreadable expiry");
                return;
            }

            CredentialRecord restored = new CredentialRecord(
                accessToken.get(),
                store.get(REFRESH_TOKEN_KEY).orElse(null),
                Instant.ofEpochMilli(expiresAtMillis),
                scope.get()
            );
            credentials.set(restored);
            LOGGER.info(() -> "[walkup-sdk] restored Spotify session valid until " + restored.expiresAt());
        } catch (UncheckedIOException ex) {
            LOGGER.log(Level.WARNING, "[walkup-sdk] could not read stored credentials", ex);
        }
    }

    private void deleteQuietly(String key, String path) {
        try {
            store.delete(key, path);
        } catch (UncheckedIOException ex) {
            LOGGER.log(Level.WARNING, "[walkup-sdk] could not delete stored credential " + key, ex);
        }
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            actual.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Validated token endpoint payload.
     */
    record TokenResponse(String accessToken, String refreshToken, long expiresInSeconds, String scope) {

        static TokenResponse parse(JsonNode node) throws InvalidResponseException {
            if (node == null || !node.isObject()) {
                throw new InvalidResponseException("Invalid Spotify token response: must be an object");
            }
            String accessToken = node.path("access_token").asText("").trim();
            if (accessToken.isEmpty()) {
                throw new InvalidResponseException(
                    "Invalid Spotify token response: access_token must be a non-empty string");
            }
            if (!"Bearer".equals(node.path("token_type").asText(null))) {
                throw new InvalidResponseException("Invalid Spotify token response: token_type must be \"Bearer\"");
            }
            JsonNode scope = node.path("scope");
            if (!scope.isTextual()) {
                throw new InvalidResponseException("Invalid Spotify token response: scope must be a string");
            }
            JsonNode expiresIn = node.path("expires_in");
            if (!expiresIn.canConvertToLong() || expiresIn.asLong() <= 0) {
                throw new InvalidResponseException(
                    "Invalid Spotify token response: expires_in must be a positive number");
            }
            String refreshToken = null;
            JsonNode refresh = node.path("refresh_token");
            if (!refresh.isMissingNode() && !refresh.isNull()) {
                if (!refresh.isTextual() || refresh.asText().isBlank()) {
                    throw new InvalidResponseException(
                        "Invalid Spotify token response: refresh_token must be a non-empty string if provided");
                }
                refreshToken = refresh.asText().trim();
            }
            return new TokenResponse(accessToken, refreshToken, expiresIn.asLong(), scope.asText());
        }

        CredentialRecord toRecord(Instant now, String previousRefreshToken) {
            String refresh = refreshToken == null ? previousRefreshToken : refreshToken;
            return new CredentialRecord(accessToken, refresh, now.plusSeconds(expiresInSeconds), scope);
        }

        @Override
        public String toString() {
            return "TokenResponse[expiresIn=" + expiresInSeconds + ", scope=" + scope + "]";
        }
    }
}
