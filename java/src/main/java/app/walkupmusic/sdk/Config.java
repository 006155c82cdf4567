package app.walkupmusic.sdk;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Immutable configuration container used to bootstrap {@link WalkupClient} instances.
 */
public final class Config {

    public static final String DEFAULT_AUTHORIZE_URL = "https://accounts.spotify.com/authorize";
    public static final String DEFAULT_TOKEN_URL = "https://accounts.spotify.com/api/token";
    public static final String DEFAULT_API_BASE_URL = "https://api.spotify.com/v1";
    public static final String DEFAULT_REDIRECT_URI = "http://127.0.0.1:8000/callback";
    public static final String DEFAULT_BASE_PATH = "/";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_TOKEN_REFRESH_BUFFER_MINUTES = 15;
    public static final int DEFAULT_MAX_REQUESTS_PER_SECOND = 10;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(1000);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final List<String> DEFAULT_SCOPES = List.of(
        "streaming",
        "user-read-email",
        "user-read-private",
        "user-modify-playback-state",
        "user-read-playback-state"
    );

    static final String PROP_CLIENT_ID = "walkup.spotify.client-id";
    static final String PROP_REDIRECT_URI = "walkup.spotify.redirect-uri";
    static final String PROP_REFRESH_BUFFER = "walkup.spotify.token-refresh-buffer-minutes";
    static final String PROP_MAX_REQUESTS = "walkup.spotify.max-requests-per-second";
    static final String PROP_RETRY_DELAY = "walkup.spotify.retry-delay-ms";
    static final String PROP_MAX_RETRIES = "walkup.spotify.max-retries";
    static final String PROP_BASE_PATH = "walkup.base-path";
    static final String PROP_MOCK_MODE = "walkup.mock-mode";

    private final String clientId;
    private final String redirectUri;
    private final Integer tokenRefreshBufferMinutes;
    private final String basePath;
    private final boolean mockMode;
    private final List<String> scopes;
    private final String authorizeUrl;
    private final String tokenUrl;
    private final String apiBaseUrl;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final Integer maxRequestsPerSecond;
    private final Duration retryDelay;
    private final Integer maxRetries;
    private final Boolean secureCookies;

    private Config(Builder builder) {
        this.clientId = builder.clientId;
        this.redirectUri = builder.redirectUri;
        this.tokenRefreshBufferMinutes = builder.tokenRefreshBufferMinutes;
        this.basePath = builder.basePath;
        this.mockMode = builder.mockMode;
        this.scopes = builder.scopes == null ? null : new ArrayList<>(builder.scopes);
        this.authorizeUrl = builder.authorizeUrl;
        this.tokenUrl = builder.tokenUrl;
        this.apiBaseUrl = builder.apiBaseUrl;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.maxRequestsPerSecond = builder.maxRequestsPerSecond;
        this.retryDelay = builder.retryDelay;
        this.maxRetries = builder.maxRetries;
        this.secureCookies = builder.secureCookies;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the externally supplied configuration surface. Keys that are absent fall back to the builder defaults.
     *
     * @throws IllegalArgumentException when a numeric key does not parse or a value fails validation.
     */
    public static Config fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder()
            .clientId(properties.getProperty(PROP_CLIENT_ID))
            .redirectUri(properties.getProperty(PROP_REDIRECT_URI))
            .basePath(properties.getProperty(PROP_BASE_PATH))
            .mockMode(Boolean.parseBoolean(properties.getProperty(PROP_MOCK_MODE, "false").trim()));

        Integer buffer = intProperty(properties, PROP_REFRESH_BUFFER);
        if (buffer != null) {
            builder.tokenRefreshBufferMinutes(buffer);
        }
        Integer rate = intProperty(properties, PROP_MAX_REQUESTS);
        if (rate != null) {
            builder.maxRequestsPerSecond(rate);
        }
        Integer delay = intProperty(properties, PROP_RETRY_DELAY);
        if (delay != null) {
            builder.retryDelay(Duration.ofMillis(delay));
        }
        Integer retries = intProperty(properties, PROP_MAX_RETRIES);
        if (retries != null) {
            builder.maxRetries(retries);
        }
        return builder.build();
    }

    public Config withDefaults() {
        String resolvedClientId = Optional.ofNullable(clientId).map(String::trim).orElse("");
        if (resolvedClientId.isEmpty() && !mockMode) {
            throw new IllegalArgumentException("ClientID is required");
        }

        String resolvedRedirect = sanitizeUrl(Optional.ofNullable(redirectUri).orElse(DEFAULT_REDIRECT_URI), false);
        String resolvedAuthorizeUrl = sanitizeUrl(Optional.ofNullable(authorizeUrl).orElse(DEFAULT_AUTHORIZE_URL), true);
        String resolvedTokenUrl = sanitizeUrl(Optional.ofNullable(tokenUrl).orElse(DEFAULT_TOKEN_URL), true);
        String resolvedApiBaseUrl = sanitizeUrl(Optional.ofNullable(apiBaseUrl).orElse(DEFAULT_API_BASE_URL), true);

        int resolvedBuffer = Optional.ofNullable(tokenRefreshBufferMinutes).orElse(DEFAULT_TOKEN_REFRESH_BUFFER_MINUTES);
        if (resolvedBuffer < 1 || resolvedBuffer > 60) {
            throw new IllegalArgumentException("TokenRefreshBufferMinutes must be between 1 and 60");
        }

        String resolvedBasePath = Optional.ofNullable(basePath).map(String::trim).filter(s -> !s.isEmpty())
            .orElse(DEFAULT_BASE_PATH);
        if (!resolvedBasePath.startsWith("/")) {
            resolvedBasePath = "/" + resolvedBasePath;
        }

        List<String> resolvedScopes;
        if (scopes == null) {
            resolvedScopes = DEFAULT_SCOPES;
        } else {
            resolvedScopes = scopes.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
        }

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        int resolvedRate = Optional.ofNullable(maxRequestsPerSecond).orElse(DEFAULT_MAX_REQUESTS_PER_SECOND);
        if (resolvedRate <= 0) {
            throw new IllegalArgumentException("MaxRequestsPerSecond must be positive");
        }

        Duration resolvedRetryDelay = Optional.ofNullable(retryDelay).orElse(DEFAULT_RETRY_DELAY);
        if (resolvedRetryDelay.isNegative()) {
            throw new IllegalArgumentException("RetryDelay cannot be negative");
        }

        int resolvedRetries = Optional.ofNullable(maxRetries).orElse(DEFAULT_MAX_RETRIES);
        if (resolvedRetries < 0) {
            throw new IllegalArgumentException("MaxRetries cannot be negative");
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .clientId(resolvedClientId)
            .redirectUri(resolvedRedirect)
            .tokenRefreshBufferMinutes(resolvedBuffer)
            .basePath(resolvedBasePath)
            .mockMode(mockMode)
            .scopes(resolvedScopes)
            .authorizeUrl(resolvedAuthorizeUrl)
            .tokenUrl(resolvedTokenUrl)
            .apiBaseUrl(resolvedApiBaseUrl)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .maxRequestsPerSecond(resolvedRate)
            .retryDelay(resolvedRetryDelay)
            .maxRetries(resolvedRetries)
            .secureCookies(Optional.ofNullable(secureCookies).orElse(Boolean.TRUE))
            .buildInternal();
    }

    private static Integer intProperty(Properties properties, String key) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, ex);
        }
    }

    private static String sanitizeUrl(String url, boolean stripTrailingSlash) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (stripTrailingSlash && trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getClientId() {
        return clientId;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public int getTokenRefreshBufferMinutes() {
        return tokenRefreshBufferMinutes;
    }

    public Duration getTokenRefreshBuffer() {
        return Duration.ofMinutes(tokenRefreshBufferMinutes);
    }

    public String getBasePath() {
        return basePath;
    }

    public boolean isMockMode() {
        return mockMode;
    }

    public List<String> getScopes() {
        return Collections.unmodifiableList(scopes);
    }

    public String getAuthorizeUrl() {
        return authorizeUrl;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public int getMaxRequestsPerSecond() {
        return maxRequestsPerSecond;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public boolean isSecureCookies() {
        return secureCookies;
    }

    public static final class Builder {
        private String clientId;
        private String redirectUri;
        private Integer tokenRefreshBufferMinutes;
        private String basePath;
        private boolean mockMode;
        private List<String> scopes;
        private String authorizeUrl;
        private String tokenUrl;
        private String apiBaseUrl;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private Integer maxRequestsPerSecond;
        private Duration retryDelay;
        private Integer maxRetries;
        private Boolean secureCookies;

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder redirectUri(String redirectUri) {
            this.redirectUri = redirectUri;
            return this;
        }

        public Builder tokenRefreshBufferMinutes(int tokenRefreshBufferMinutes) {
            this.tokenRefreshBufferMinutes = tokenRefreshBufferMinutes;
            return this;
        }

        /**
         * Path scope applied to every persisted credential, e.g. {@code /walkup_music} when served below a sub-path.
         */
        public Builder basePath(String basePath) {
            this.basePath = basePath;
            return this;
        }

        /**
         * Selects the offline auth manager and catalog. Useful for local development without Spotify credentials.
         */
        public Builder mockMode(boolean mockMode) {
            this.mockMode = mockMode;
            return this;
        }

        public Builder scopes(List<String> scopes) {
            this.scopes = scopes == null ? null : new ArrayList<>(scopes);
            return this;
        }

        public Builder authorizeUrl(String authorizeUrl) {
            this.authorizeUrl = authorizeUrl;
            return this;
        }

        public Builder tokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
            return this;
        }

        public Builder apiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder maxRequestsPerSecond(int maxRequestsPerSecond) {
            this.maxRequestsPerSecond = maxRequestsPerSecond;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Controls the {@code secure} attribute on persisted credentials. Disable only for plain-http development.
         */
        public Builder secureCookies(boolean secureCookies) {
            this.secureCookies = secureCookies;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
