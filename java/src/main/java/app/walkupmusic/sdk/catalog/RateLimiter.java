package app.walkupmusic.sdk.catalog;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Spaces outbound requests at least {@code 1s / maxRequestsPerSecond} apart, which caps any rolling one-second
 * window at {@code maxRequestsPerSecond} dispatches.
 *
 * <p>Callers reserve dispatch slots under a fair lock, so slots are handed out in arrival order and waiting
 * happens outside the lock. A caller interrupted while waiting forfeits its slot; the rate is never exceeded.</p>
 */
public final class RateLimiter {

    private static final Logger LOGGER = Logger.getLogger(RateLimiter.class.getName());

    private final int maxRequestsPerSecond;
    private final long minIntervalNanos;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final AtomicInteger waiting = new AtomicInteger();

    private boolean dispatched;
    private long lastDispatchNanos;

    public RateLimiter(int maxRequestsPerSecond) {
        if (maxRequestsPerSecond <= 0) {
            throw new IllegalArgumentException("maxRequestsPerSecond must be positive");
        }
        this.maxRequestsPerSecond = maxRequestsPerSecond;
        this.minIntervalNanos = TimeUnit.SECONDS.toNanos(1) / maxRequestsPerSecond;
    }

    /**
     * Blocks until the caller may dispatch one request.
     */
    public void acquire() throws InterruptedException {
        long waitNanos;
        lock.lock();
        try {
            long now = System.nanoTime();
            long slot = dispatched ? Math.max(now, lastDispatchNanos + minIntervalNanos) : now;
            lastDispatchNanos = slot;
            dispatched = true;
            waitNanos = slot - now;
        } finally {
            lock.unlock();
        }

        if (waitNanos <= 0) {
            return;
        }
        long delayMillis = Duration.ofNanos(waitNanos).toMillis();
        LOGGER.fine(() -> "[walkup-sdk] rate limiter delaying request by " + delayMillis + "ms");
        waiting.incrementAndGet();
        try {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        } finally {
            waiting.decrementAndGet();
        }
    }

    public int getMaxRequestsPerSecond() {
        return maxRequestsPerSecond;
    }

    /**
     * @return callers currently waiting for their slot.
     */
    public int queuedRequests() {
        return waiting.get();
    }
}
