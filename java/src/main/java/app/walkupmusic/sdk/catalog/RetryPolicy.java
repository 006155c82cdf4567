package app.walkupmusic.sdk.catalog;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Decides whether a failed attempt is retried and how long to wait first.
 *
 * <p>Only {@link ResponseClass#isRetryable() retryable} classes are retried, at most {@code maxRetries} times.
 * The wait is the server's {@code Retry-After} when given, otherwise {@code baseDelay} doubled per retry
 * already made.</p>
 */
public final class RetryPolicy {

    private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private final int maxRetries;
    private final Duration baseDelay;

    public RetryPolicy(int maxRetries, Duration baseDelay) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be zero or positive");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
    }

    /**
     * @param responseClass  outcome of the attempt
     * @param retriesSoFar   retries already made for this request (0 after the first attempt)
     * @param retryAfter     server-requested delay, or {@code null}
     * @return the delay before the next attempt, or empty when the failure is final
     */
    public Optional<Duration> nextDelay(ResponseClass responseClass, int retriesSoFar, Duration retryAfter) {
        if (!responseClass.isRetryable() || retriesSoFar >= maxRetries) {
            return Optional.empty();
        }
        if (retryAfter != null && !retryAfter.isNegative()) {
            return Optional.of(retryAfter);
        }
        Duration backoff = baseDelay.multipliedBy(1L << Math.min(retriesSoFar, 16));
        return Optional.of(backoff.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : backoff);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    /**
     * Parses a {@code Retry-After} header given either as delta-seconds or as an HTTP date.
     *
     * @return the delay, or {@code null} when the header is absent or unreadable.
     */
    public static Duration parseRetryAfter(String header, Instant now) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String trimmed = header.trim();
        if (trimmed.length() <= 9 && trimmed.chars().allMatch(Character::isDigit)) {
            return Duration.ofSeconds(Long.parseLong(trimmed));
        }
        try {
            Instant at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration delta = Duration.between(now, at);
            return delta.isNegative() ? Duration.ZERO : delta;
        } catch (DateTimeParseException ex) {
            return null;
        }
    }
}
