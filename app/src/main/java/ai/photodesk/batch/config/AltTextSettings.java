package ai.photodesk.batch.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings of the alt-text engine: credentials, prompt context, throttling, retry and pricing.
 */
public record AltTextSettings(
        Optional<String> apiKey,
        Optional<String> defaultContext,
        int maxConcurrentRequests,
        int maxRequestsPerMinute,
        int maxRetryAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        double jitterFactor,
        Duration requestTimeout,
        BigDecimal costPerImage
) {

    public static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 5;
    public static final int DEFAULT_MAX_REQUESTS_PER_MINUTE = 50;
    public static final int DEFAULT_MAX_RETRY_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(60);
    public static final double DEFAULT_JITTER_FACTOR = 0.3;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final BigDecimal DEFAULT_COST_PER_IMAGE = new BigDecimal("0.006");

    public AltTextSettings {
        apiKey = apiKey == null ? Optional.empty() : apiKey.filter(value -> !value.isBlank());
        defaultContext = defaultContext == null ? Optional.empty() : defaultContext.filter(value -> !value.isBlank());
        if (maxConcurrentRequests < 1) {
            throw new IllegalArgumentException("maxConcurrentRequests must be at least 1");
        }
        if (maxRequestsPerMinute < 1) {
            throw new IllegalArgumentException("maxRequestsPerMinute must be at least 1");
        }
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be at least initialBackoff");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        Objects.requireNonNull(costPerImage, "costPerImage");
        if (costPerImage.signum() < 0) {
            throw new IllegalArgumentException("costPerImage must not be negative");
        }
    }

    public static AltTextSettings defaults(Optional<String> apiKey) {
        return new AltTextSettings(apiKey, Optional.empty(),
                DEFAULT_MAX_CONCURRENT_REQUESTS,
                DEFAULT_MAX_REQUESTS_PER_MINUTE,
                DEFAULT_MAX_RETRY_ATTEMPTS,
                DEFAULT_INITIAL_BACKOFF,
                DEFAULT_MAX_BACKOFF,
                DEFAULT_JITTER_FACTOR,
                DEFAULT_REQUEST_TIMEOUT,
                DEFAULT_COST_PER_IMAGE);
    }

    public boolean hasApiKey() {
        return apiKey.isPresent();
    }

    public AltTextSettings withApiKey(Optional<String> key) {
        return new AltTextSettings(key, defaultContext, maxConcurrentRequests, maxRequestsPerMinute,
                maxRetryAttempts, initialBackoff, maxBackoff, jitterFactor, requestTimeout, costPerImage);
    }

    public AltTextSettings withDefaultContext(Optional<String> context) {
        return new AltTextSettings(apiKey, context, maxConcurrentRequests, maxRequestsPerMinute,
                maxRetryAttempts, initialBackoff, maxBackoff, jitterFactor, requestTimeout, costPerImage);
    }

    public AltTextSettings withRetry(int attempts, Duration initial, Duration max, double jitter) {
        return new AltTextSettings(apiKey, defaultContext, maxConcurrentRequests, maxRequestsPerMinute,
                attempts, initial, max, jitter, requestTimeout, costPerImage);
    }

    public AltTextSettings withLimits(int concurrentRequests, int requestsPerMinute) {
        return new AltTextSettings(apiKey, defaultContext, concurrentRequests, requestsPerMinute,
                maxRetryAttempts, initialBackoff, maxBackoff, jitterFactor, requestTimeout, costPerImage);
    }

    @Override
    public String toString() {
        return "AltTextSettings[apiKey=" + (apiKey.isPresent() ? "****" : "<none>")
                + ", defaultContext=" + defaultContext
                + ", maxConcurrentRequests=" + maxConcurrentRequests
                + ", maxRequestsPerMinute=" + maxRequestsPerMinute
                + ", maxRetryAttempts=" + maxRetryAttempts
                + ", initialBackoff=" + initialBackoff
                + ", maxBackoff=" + maxBackoff
                + ", jitterFactor=" + jitterFactor
                + ", requestTimeout=" + requestTimeout
                + ", costPerImage=" + costPerImage + "]";
    }
}
