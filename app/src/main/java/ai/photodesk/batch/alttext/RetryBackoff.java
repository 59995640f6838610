package ai.photodesk.batch.alttext;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with symmetric jitter: {@code min(initial * 2^attempt, max) * (1 +/- jitter)}.
 */
public class RetryBackoff {

    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double jitterFactor;
    private final DoubleSupplier random;

    public RetryBackoff(Duration initialBackoff, Duration maxBackoff, double jitterFactor) {
        this(initialBackoff, maxBackoff, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryBackoff(Duration initialBackoff, Duration maxBackoff, double jitterFactor, DoubleSupplier random) {
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
        this.jitterFactor = jitterFactor;
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * @param attempt zero-based index of the attempt that just failed
     */
    public Duration delayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative");
        }
        long initialMillis = initialBackoff.toMillis();
        long maxMillis = maxBackoff.toMillis();
        int shift = Math.min(attempt, 30);
        long baseMillis = initialMillis > (maxMillis >> shift) ? maxMillis : initialMillis << shift;
        long cappedMillis = Math.min(baseMillis, maxMillis);

        double jitterMultiplier = 1.0 + (random.getAsDouble() * 2.0 - 1.0) * jitterFactor;
        long finalMillis = Math.max(0L, Math.round(cappedMillis * jitterMultiplier));
        return Duration.ofMillis(finalMillis);
    }
}
