package ai.photodesk.batch.alttext;

import ai.photodesk.batch.alttext.client.VisionApiException;
import ai.photodesk.batch.alttext.client.VisionClient;
import ai.photodesk.batch.alttext.client.VisionFailure;
import ai.photodesk.batch.alttext.client.VisionRequest;
import ai.photodesk.batch.config.AltTextSettings;
import ai.photodesk.batch.throttle.ConcurrencyGate;
import ai.photodesk.batch.throttle.RateLimiter;
import ai.photodesk.batch.throttle.SemaphoreConcurrencyGate;
import ai.photodesk.batch.throttle.SlidingWindowRateLimiter;
import ai.photodesk.batch.usage.UsageTracker;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates alt text for images through a {@link VisionClient}, sharing one rate limiter and one concurrency
 * gate across every request.
 *
 * <p>Per request the checks run in a fixed order: API key, image encoding, local rate limit, concurrency slot,
 * remote call. Only transient failures are retried; a 429 from the service is reported immediately.
 * No method of this class throws for a failed generation; failures become {@link AltTextStatus#ERROR} results.
 */
public class AltTextGenerationEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(AltTextGenerationEngine.class);

    static final int MAX_TOKENS = 300;
    static final int VALIDATION_MAX_TOKENS = 10;
    static final String USER_PROMPT = "Please write an alt text description for this image.";

    static final String SYSTEM_PROMPT = """
            You are an expert at writing alt text descriptions for editorial images.
            Your descriptions should be:
            - Concise yet informative (50-150 words)
            - Focused on the main subject and context
            - Descriptive of visual elements important for understanding
            - Professional and appropriate for publication
            - Avoiding redundant phrases like "image of" or "picture showing"

            For editorial content, emphasize:
            - People: their appearance, expressions, clothing, and actions
            - Settings: location, atmosphere, and relevant background elements
            - Products: key features, styling, and presentation
            - Composition: how elements are arranged and what draws attention""";

    private final AltTextSettings settings;
    private final VisionClient client;
    private final RateLimiter rateLimiter;
    private final ConcurrencyGate gate;
    private final UsageTracker usageTracker;
    private final ImageEncoder encoder;
    private final RetryBackoff backoff;

    public AltTextGenerationEngine(AltTextSettings settings, VisionClient client) {
        this(settings, client, new SlidingWindowRateLimiter(settings.maxRequestsPerMinute()),
                new SemaphoreConcurrencyGate(settings.maxConcurrentRequests()), UsageTracker.NOOP, new ImageEncoder());
    }

    public AltTextGenerationEngine(AltTextSettings settings, VisionClient client, RateLimiter rateLimiter,
                                   ConcurrencyGate gate, UsageTracker usageTracker, ImageEncoder encoder) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.client = Objects.requireNonNull(client, "client");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.usageTracker = Objects.requireNonNull(usageTracker, "usageTracker");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.backoff = new RetryBackoff(settings.initialBackoff(), settings.maxBackoff(), settings.jitterFactor());
    }

    public AltTextSettings settings() {
        return settings;
    }

    public boolean isEnabled() {
        return settings.hasApiKey();
    }

    public AltTextResult generateAltText(Path imagePath) {
        return generateAltText(imagePath, null);
    }

    /**
     * Generates alt text for one image.
     *
     * @param context optional editorial context appended to the prompt; the configured default is used when blank
     */
    public AltTextResult generateAltText(Path imagePath, String context) {
        long started = System.nanoTime();
        if (!settings.hasApiKey()) {
            return AltTextResult.error("API key not configured", elapsedSince(started));
        }
        try {
            return generate(imagePath, context, started);
        } catch (RuntimeException ex) {
            LOGGER.error("Unexpected error generating alt text for {}", imagePath, ex);
            return AltTextResult.error("Unexpected error: " + ex.getMessage(), elapsedSince(started));
        }
    }

    private AltTextResult generate(Path imagePath, String context, long started) {
        EncodedImage encoded;
        try {
            encoded = encoder.encode(imagePath);
        } catch (ImageEncodingException ex) {
            LOGGER.error("Failed to encode image {}: {}", imagePath, ex.getMessage());
            return AltTextResult.error(ex.getMessage(), elapsedSince(started));
        }

        if (!rateLimiter.tryAcquire()) {
            LOGGER.warn("Local rate limit reached; rejecting alt text request for {}", imagePath.getFileName());
            return AltTextResult.error("Rate limited locally - more than " + settings.maxRequestsPerMinute()
                    + " requests in the last minute", elapsedSince(started));
        }

        VisionRequest request = new VisionRequest(encoded.base64Data(), encoded.mediaType(), SYSTEM_PROMPT,
                buildUserPrompt(context), MAX_TOKENS);
        try (ConcurrencyGate.Permit permit = gate.acquire()) {
            String altText = describeWithRetry(request, imagePath);
            AltTextResult result = AltTextResult.completed(altText, settings.costPerImage(), elapsedSince(started));
            LOGGER.info("Generated alt text for {}", imagePath.getFileName());
            trackUsage(result);
            return result;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for a request slot for {}", imagePath.getFileName());
            return AltTextResult.error("Interrupted while waiting for a request slot", elapsedSince(started));
        } catch (VisionApiException ex) {
            LOGGER.error("Alt text generation failed for {}: {}", imagePath.getFileName(), ex.getMessage());
            return AltTextResult.error(describeFailure(ex), elapsedSince(started));
        }
    }

    public Map<Path, AltTextResult> generateBatch(Collection<Path> imagePaths) {
        return generateBatch(imagePaths, null, () -> false, AltTextBatchListener.NONE);
    }

    public Map<Path, AltTextResult> generateBatch(Collection<Path> imagePaths, String context) {
        return generateBatch(imagePaths, context, () -> false, AltTextBatchListener.NONE);
    }

    /**
     * Generates alt text for many images on a worker pool no larger than the concurrency limit.
     *
     * <p>Each request checks {@code cancellation} before it starts and is left out of the result when it is set.
     * Requests already dispatched always run to completion and are awaited before this method returns.
     *
     * @return results keyed by path, in input order
     */
    public Map<Path, AltTextResult> generateBatch(Collection<Path> imagePaths, String context,
                                                  BooleanSupplier cancellation, AltTextBatchListener listener) {
        Objects.requireNonNull(cancellation, "cancellation");
        Objects.requireNonNull(listener, "listener");
        if (imagePaths == null || imagePaths.isEmpty()) {
            return Map.of();
        }
        List<Path> paths = new ArrayList<>(new LinkedHashSet<>(imagePaths));
        int total = paths.size();
        Map<Path, AltTextResult> results = new ConcurrentHashMap<>();
        AtomicInteger resolved = new AtomicInteger();
        int workers = Math.min(settings.maxConcurrentRequests(), total);
        ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        LOGGER.info("Generating alt text for {} images with {} workers", total, workers);
        try {
            Map<Path, Future<?>> futures = new LinkedHashMap<>();
            for (Path path : paths) {
                futures.put(path, executor.submit(() -> {
                    if (cancellation.getAsBoolean()) {
                        LOGGER.debug("Skipping alt text for {}; batch cancelled", path.getFileName());
                        return;
                    }
                    notifyStarted(listener, path);
                    AltTextResult result = generateAltText(path, context);
                    results.put(path, result);
                    notifyCompleted(listener, path, result, resolved.incrementAndGet(), total);
                }));
            }
            awaitAll(futures, (path, failure) -> {
                AltTextResult result = AltTextResult.error("Unexpected error: " + failure.getMessage(), Duration.ZERO);
                if (results.putIfAbsent(path, result) == null) {
                    notifyCompleted(listener, path, result, resolved.incrementAndGet(), total);
                }
            });
        } finally {
            executor.shutdown();
        }

        Map<Path, AltTextResult> ordered = new LinkedHashMap<>();
        for (Path path : paths) {
            AltTextResult result = results.get(path);
            if (result != null) {
                ordered.put(path, result);
            }
        }
        long succeeded = ordered.values().stream().filter(AltTextResult::isSuccess).count();
        LOGGER.info("Alt text batch finished: {} succeeded, {} failed, {} skipped", succeeded,
                ordered.size() - succeeded, total - ordered.size());
        return Collections.unmodifiableMap(ordered);
    }

    public CostEstimate estimateBatchCost(int imageCount) {
        return CostEstimate.of(imageCount, settings.costPerImage());
    }

    /**
     * Probes the configured key with a minimal request.
     */
    public ApiKeyValidation validateApiKey() {
        if (!settings.hasApiKey()) {
            return ApiKeyValidation.invalid("No API key configured");
        }
        EncodedImage probe = encoder.blankProbe();
        VisionRequest request = new VisionRequest(probe.base64Data(), probe.mediaType(), "", "test",
                VALIDATION_MAX_TOKENS);
        try {
            client.describe(request);
            return ApiKeyValidation.valid("API key is valid and supports vision");
        } catch (VisionApiException ex) {
            return switch (ex.failure()) {
                case RATE_LIMITED -> ApiKeyValidation.valid("API key is valid (currently rate limited)");
                case AUTHENTICATION -> ApiKeyValidation.invalid("Invalid API key");
                case MODEL_NOT_FOUND -> ApiKeyValidation.invalid("Model not found - API may need updating");
                // an answer without text still proves the key was accepted
                case INVALID_RESPONSE -> ApiKeyValidation.valid("API key is valid and supports vision");
                case TRANSIENT, CLIENT_ERROR, INTERRUPTED -> ex.statusCode().isPresent()
                        ? ApiKeyValidation.invalid("API error " + ex.statusCode().getAsInt() + ": " + ex.getMessage())
                        : ApiKeyValidation.invalid("Connection error: " + ex.getMessage());
            };
        } catch (RuntimeException ex) {
            return ApiKeyValidation.invalid("Connection error: " + ex.getMessage());
        }
    }

    private String describeWithRetry(VisionRequest request, Path imagePath) {
        int maxAttempts = settings.maxRetryAttempts();
        VisionApiException lastFailure = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return client.describe(request);
            } catch (VisionApiException ex) {
                lastFailure = ex;
                if (!ex.failure().isRetryable() || attempt == maxAttempts - 1) {
                    if (ex.failure().isRetryable()) {
                        LOGGER.error("Alt text request for {} failed; max attempts ({}) exhausted",
                                imagePath.getFileName(), maxAttempts);
                    }
                    throw ex;
                }
                Duration delay = backoff.delayFor(attempt);
                LOGGER.warn("Alt text request for {} failed ({}); retrying in {} ms (attempt {}/{})",
                        imagePath.getFileName(), ex.getMessage(), delay.toMillis(), attempt + 2, maxAttempts);
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException interruptedException) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("Alt text retry interrupted for {}", imagePath.getFileName());
                    throw ex;
                }
            }
        }
        throw lastFailure == null
                ? new VisionApiException(VisionFailure.CLIENT_ERROR, "Unknown vision API failure")
                : lastFailure;
    }

    private String buildUserPrompt(String context) {
        String effective = context != null && !context.isBlank()
                ? context.strip()
                : settings.defaultContext().map(String::strip).orElse(null);
        return effective == null ? USER_PROMPT : USER_PROMPT + " Context: " + effective;
    }

    private static String describeFailure(VisionApiException ex) {
        if (ex.failure() == VisionFailure.RATE_LIMITED) {
            return ex.retryAfter()
                    .map(delay -> "Rate limited by API (retry after " + delay.toSeconds() + "s)")
                    .orElse("Rate limited by API");
        }
        return ex.getMessage() == null ? ex.failure().name() : ex.getMessage();
    }

    private void trackUsage(AltTextResult result) {
        try {
            usageTracker.recordUsage(result.apiCost());
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to track usage: {}", ex.getMessage());
        }
    }

    private static void notifyStarted(AltTextBatchListener listener, Path path) {
        try {
            listener.onRequestStarted(path);
        } catch (RuntimeException ex) {
            LOGGER.warn("Alt text listener failed on start of {}: {}", path.getFileName(), ex.getMessage());
        }
    }

    private static void notifyCompleted(AltTextBatchListener listener, Path path, AltTextResult result,
                                        int resolved, int total) {
        try {
            listener.onRequestCompleted(path, result, resolved, total);
        } catch (RuntimeException ex) {
            LOGGER.warn("Alt text listener failed on completion of {}: {}", path.getFileName(), ex.getMessage());
        }
    }

    private static void awaitAll(Map<Path, Future<?>> futures, BiConsumer<Path, Throwable> onFailure) {
        boolean interrupted = false;
        for (Map.Entry<Path, Future<?>> entry : futures.entrySet()) {
            while (true) {
                try {
                    entry.getValue().get();
                    break;
                } catch (InterruptedException ex) {
                    interrupted = true;
                } catch (ExecutionException ex) {
                    LOGGER.error("Alt text worker failed for {}", entry.getKey().getFileName(), ex.getCause());
                    onFailure.accept(entry.getKey(), ex.getCause());
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

        private final int pool = POOL_SEQUENCE.incrementAndGet();
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("alt-text-" + pool + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
