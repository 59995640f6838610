package ai.photodesk.batch.throttle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Admits at most {@code maxRequests} attempts within any trailing window.
 */
public class SlidingWindowRateLimiter implements RateLimiter {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Deque<Instant> admissions = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxRequests) {
        this(maxRequests, DEFAULT_WINDOW, Clock.systemUTC());
    }

    public SlidingWindowRateLimiter(int maxRequests, Duration window, Clock clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1");
        }
        Objects.requireNonNull(window, "window");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized boolean tryAcquire() {
        Instant now = clock.instant();
        evictExpired(now);
        if (admissions.size() >= maxRequests) {
            return false;
        }
        admissions.addLast(now);
        return true;
    }

    /**
     * Number of admissions still counted against the current window.
     */
    public synchronized int recentRequests() {
        evictExpired(clock.instant());
        return admissions.size();
    }

    public int maxRequests() {
        return maxRequests;
    }

    public Duration window() {
        return window;
    }

    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(window);
        while (!admissions.isEmpty() && !admissions.peekFirst().isAfter(cutoff)) {
            admissions.removeFirst();
        }
    }
}
