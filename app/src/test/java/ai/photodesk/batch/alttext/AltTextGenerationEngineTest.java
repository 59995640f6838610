package ai.photodesk.batch.alttext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.photodesk.batch.alttext.client.VisionApiException;
import ai.photodesk.batch.alttext.client.VisionClient;
import ai.photodesk.batch.alttext.client.VisionFailure;
import ai.photodesk.batch.alttext.client.VisionRequest;
import ai.photodesk.batch.config.AltTextSettings;
import ai.photodesk.batch.testing.TestImages;
import ai.photodesk.batch.throttle.SemaphoreConcurrencyGate;
import ai.photodesk.batch.throttle.SlidingWindowRateLimiter;
import ai.photodesk.batch.usage.UsageTracker;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AltTextGenerationEngineTest {

    @TempDir
    Path tempDir;

    private final AltTextSettings settings = AltTextSettings.defaults(Optional.of("sk-test"))
            .withRetry(3, Duration.ZERO, Duration.ZERO, 0.0);

    @Test
    void returnsErrorWithoutCallingTheServiceWhenNoKeyIsConfigured() {
        AtomicInteger calls = new AtomicInteger();
        AltTextGenerationEngine engine = new AltTextGenerationEngine(AltTextSettings.defaults(Optional.empty()),
                request -> {
                    calls.incrementAndGet();
                    return "unused";
                });

        AltTextResult result = engine.generateAltText(image("a.jpg"));

        assertThat(result.status()).isEqualTo(AltTextStatus.ERROR);
        assertThat(result.errorMessage()).contains("API key not configured");
        assertThat(engine.isEnabled()).isFalse();
        assertThat(calls).hasValue(0);
    }

    @Test
    void generatesAltTextAndRecordsCost() {
        List<BigDecimal> recorded = new CopyOnWriteArrayList<>();
        AltTextGenerationEngine engine = engine(request -> "A reporter holds a microphone.", recorded::add);

        AltTextResult result = engine.generateAltText(image("a.jpg"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.altText()).contains("A reporter holds a microphone.");
        assertThat(result.apiCost()).isEqualByComparingTo("0.006");
        assertThat(result.errorMessage()).isEmpty();
        assertThat(recorded).hasSize(1);
    }

    @Test
    void sendsEditorialPromptsAndContext() {
        List<VisionRequest> requests = new CopyOnWriteArrayList<>();
        AltTextGenerationEngine engine = engine(request -> {
            requests.add(request);
            return "text";
        }, UsageTracker.NOOP);

        engine.generateAltText(image("a.jpg"), "  Election night coverage ");

        VisionRequest request = requests.get(0);
        assertThat(request.systemPrompt()).contains("editorial images");
        assertThat(request.userPrompt()).isEqualTo(AltTextGenerationEngine.USER_PROMPT
                + " Context: Election night coverage");
        assertThat(request.maxTokens()).isEqualTo(AltTextGenerationEngine.MAX_TOKENS);
        assertThat(request.mediaType()).isEqualTo("image/jpeg");
        assertThat(request.base64Image()).isNotBlank();
    }

    @Test
    void fallsBackToConfiguredDefaultContext() {
        List<VisionRequest> requests = new CopyOnWriteArrayList<>();
        AltTextGenerationEngine engine = new AltTextGenerationEngine(
                settings.withDefaultContext(Optional.of("Fashion week")), request -> {
                    requests.add(request);
                    return "text";
                });

        engine.generateAltText(image("a.jpg"), " ");

        assertThat(requests.get(0).userPrompt()).endsWith(" Context: Fashion week");
    }

    @Test
    void reportsEncodingFailureWithoutCallingTheService() {
        AtomicInteger calls = new AtomicInteger();
        AltTextGenerationEngine engine = engine(request -> {
            calls.incrementAndGet();
            return "text";
        }, UsageTracker.NOOP);

        AltTextResult result = engine.generateAltText(TestImages.corrupt(tempDir, "corrupt.jpg"));

        assertThat(result.status()).isEqualTo(AltTextStatus.ERROR);
        assertThat(result.errorMessage()).hasValueSatisfying(message -> assertThat(message).contains("corrupt.jpg"));
        assertThat(calls).hasValue(0);
    }

    @Test
    void rejectsRequestsBeyondTheLocalRateLimit() {
        AtomicInteger calls = new AtomicInteger();
        AltTextGenerationEngine engine = new AltTextGenerationEngine(settings, request -> {
            calls.incrementAndGet();
            return "text";
        }, new SlidingWindowRateLimiter(2), new SemaphoreConcurrencyGate(5), UsageTracker.NOOP, new ImageEncoder());
        Path path = image("a.jpg");

        List<AltTextResult> results = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            results.add(engine.generateAltText(path));
        }

        assertThat(results).filteredOn(AltTextResult::isSuccess).hasSize(2);
        assertThat(results.get(2).errorMessage())
                .hasValueSatisfying(message -> assertThat(message).startsWith("Rate limited locally"));
        assertThat(calls).hasValue(2);
    }

    @Test
    void doesNotRetryWhenTheServiceRateLimits() {
        AtomicInteger calls = new AtomicInteger();
        AltTextGenerationEngine engine = engine(request -> {
            calls.incrementAndGet();
            throw VisionApiException.rateLimited(Optional.of(Duration.ofSeconds(30)));
        }, UsageTracker.NOOP);

        AltTextResult result = engine.generateAltText(image("a.jpg"));

        assertThat(result.errorMessage()).contains("Rate limited by API (retry after 30s)");
        assertThat(calls).hasValue(1);
    }

    @Test
    void retriesTransientFailuresUpToTheAttemptLimit() {
        AtomicInteger calls = new AtomicInteger();
        AltTextGenerationEngine engine = engine(request -> {
            calls.incrementAndGet();
            throw VisionApiException.httpStatus(VisionFailure.TRANSIENT, 503, "Anthropic server error: 503");
        }, UsageTracker.NOOP);

        AltTextResult result = engine.generateAltText(image("a.jpg"));

        assertThat(result.errorMessage()).contains("Anthropic server error: 503");
        assertThat(calls).hasValue(settings.maxRetryAttempts());
    }

    @Test
    void succeedsAfterATransientFailure() {
        AtomicInteger calls = new AtomicInteger();
        AltTextGenerationEngine engine = engine(request -> {
            if (calls.incrementAndGet() == 1) {
                throw new VisionApiException(VisionFailure.TRANSIENT, "Request timeout - network may be slow");
            }
            return "Recovered";
        }, UsageTracker.NOOP);

        AltTextResult result = engine.generateAltText(image("a.jpg"));

        assertThat(result.altText()).contains("Recovered");
        assertThat(calls).hasValue(2);
    }

    @Test
    void doesNotRetryAuthenticationFailures() {
        AtomicInteger calls = new AtomicInteger();
        AltTextGenerationEngine engine = engine(request -> {
            calls.incrementAndGet();
            throw VisionApiException.httpStatus(VisionFailure.AUTHENTICATION, 401,
                    "Invalid API key - please check your API key");
        }, UsageTracker.NOOP);

        AltTextResult result = engine.generateAltText(image("a.jpg"));

        assertThat(result.errorMessage()).contains("Invalid API key - please check your API key");
        assertThat(calls).hasValue(1);
    }

    @Test
    void convertsUnexpectedExceptionsIntoErrorResults() {
        AltTextGenerationEngine engine = engine(request -> {
            throw new IllegalStateException("boom");
        }, UsageTracker.NOOP);

        AltTextResult result = engine.generateAltText(image("a.jpg"));

        assertThat(result.errorMessage()).contains("Unexpected error: boom");
    }

    @Test
    void decoderCrashBecomesAnErrorResult() {
        AtomicInteger calls = new AtomicInteger();
        AltTextGenerationEngine engine = new AltTextGenerationEngine(settings, request -> {
            calls.incrementAndGet();
            return "text";
        }, new SlidingWindowRateLimiter(50), new SemaphoreConcurrencyGate(5), UsageTracker.NOOP,
                new CrashingEncoder());

        AltTextResult single = engine.generateAltText(image("a.jpg"));
        Map<Path, AltTextResult> batch = engine.generateBatch(images(3));

        assertThat(single.status()).isEqualTo(AltTextStatus.ERROR);
        assertThat(single.errorMessage()).contains("Unexpected error: bad huffman table");
        assertThat(batch).hasSize(3);
        assertThat(batch.values()).allSatisfy(result ->
                assertThat(result.errorMessage()).contains("Unexpected error: bad huffman table"));
        assertThat(calls).hasValue(0);
    }

    @Test
    void rateLimiterFailureBecomesAnErrorResult() {
        AltTextGenerationEngine engine = new AltTextGenerationEngine(settings, request -> "text", () -> {
            throw new IllegalStateException("clock went backwards");
        }, new SemaphoreConcurrencyGate(5), UsageTracker.NOOP, new ImageEncoder());

        AltTextResult result = engine.generateAltText(image("a.jpg"));

        assertThat(result.errorMessage()).contains("Unexpected error: clock went backwards");
    }

    @Test
    void ignoresUsageTrackerFailures() {
        AltTextGenerationEngine engine = engine(request -> "text", cost -> {
            throw new IllegalStateException("disk full");
        });

        AltTextResult result = engine.generateAltText(image("a.jpg"));

        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void batchCostIsExactlyTheSumOfSuccessfulCalls() {
        AltTextGenerationEngine engine = engine(request -> "text", UsageTracker.NOOP);
        List<Path> paths = images(7);

        Map<Path, AltTextResult> results = engine.generateBatch(paths);

        BigDecimal total = results.values().stream()
                .map(AltTextResult::apiCost)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(results).hasSize(7);
        assertThat(results.keySet()).containsExactlyElementsOf(paths);
        assertThat(total).isEqualByComparingTo(settings.costPerImage().multiply(BigDecimal.valueOf(7)));
    }

    @Test
    void batchNeverExceedsTheConcurrencyLimit() {
        AtomicInteger current = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        AltTextGenerationEngine engine = engine(request -> {
            int now = current.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(100);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } finally {
                current.decrementAndGet();
            }
            return "text";
        }, UsageTracker.NOOP);
        List<Path> paths = images(10);

        long started = System.nanoTime();
        Map<Path, AltTextResult> results = engine.generateBatch(paths);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(results.values()).allMatch(AltTextResult::isSuccess);
        assertThat(peak.get()).isLessThanOrEqualTo(settings.maxConcurrentRequests());
        assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(200));
    }

    @Test
    void cancelledBatchSkipsRequestsThatHaveNotStarted() {
        AtomicBoolean cancelled = new AtomicBoolean();
        AltTextGenerationEngine engine = new AltTextGenerationEngine(settings.withLimits(1, 50), request -> {
            cancelled.set(true);
            return "text";
        });
        List<Path> paths = images(4);
        List<Path> started = new CopyOnWriteArrayList<>();
        List<String> completions = new CopyOnWriteArrayList<>();

        Map<Path, AltTextResult> results = engine.generateBatch(paths, null, cancelled::get,
                new AltTextBatchListener() {
                    @Override
                    public void onRequestStarted(Path path) {
                        started.add(path);
                    }

                    @Override
                    public void onRequestCompleted(Path path, AltTextResult result, int resolved, int total) {
                        completions.add(resolved + "/" + total);
                    }
                });

        assertThat(results).containsOnlyKeys(paths.get(0));
        assertThat(started).containsExactly(paths.get(0));
        assertThat(completions).containsExactly("1/4");
    }

    @Test
    void listenerFailuresDoNotAbortTheBatch() {
        AltTextGenerationEngine engine = engine(request -> "text", UsageTracker.NOOP);
        List<Path> paths = images(3);

        Map<Path, AltTextResult> results = engine.generateBatch(paths, null, () -> false, new AltTextBatchListener() {
            @Override
            public void onRequestStarted(Path path) {
                throw new IllegalStateException("listener broke");
            }
        });

        assertThat(results).hasSize(3);
        assertThat(results.values()).allMatch(AltTextResult::isSuccess);
    }

    @Test
    void emptyBatchReturnsEmptyMap() {
        AltTextGenerationEngine engine = engine(request -> "text", UsageTracker.NOOP);

        assertThat(engine.generateBatch(List.of())).isEmpty();
    }

    @Test
    void estimatesBatchCost() {
        AltTextGenerationEngine engine = engine(request -> "text", UsageTracker.NOOP);

        CostEstimate estimate = engine.estimateBatchCost(100);

        assertThat(estimate.imageCount()).isEqualTo(100);
        assertThat(estimate.total()).isEqualByComparingTo("0.600");
        assertThat(estimate.monthlyEstimate()).isEqualByComparingTo("12.000");
        assertThat(engine.estimateBatchCost(0).total()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThatThrownBy(() -> engine.estimateBatchCost(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void validatesApiKeyAgainstTheService() {
        assertThat(validate(request -> "ok")).isEqualTo(new ApiKeyValidation(true, "API key is valid and supports vision"));
        assertThat(validate(request -> {
            throw VisionApiException.rateLimited(Optional.empty());
        })).isEqualTo(new ApiKeyValidation(true, "API key is valid (currently rate limited)"));
        assertThat(validate(request -> {
            throw VisionApiException.httpStatus(VisionFailure.AUTHENTICATION, 401, "Invalid API key");
        })).isEqualTo(new ApiKeyValidation(false, "Invalid API key"));
        assertThat(validate(request -> {
            throw VisionApiException.httpStatus(VisionFailure.MODEL_NOT_FOUND, 404, "gone");
        })).isEqualTo(new ApiKeyValidation(false, "Model not found - API may need updating"));
        assertThat(validate(request -> {
            throw VisionApiException.httpStatus(VisionFailure.CLIENT_ERROR, 400, "bad request");
        })).isEqualTo(new ApiKeyValidation(false, "API error 400: bad request"));
        assertThat(validate(request -> {
            throw new VisionApiException(VisionFailure.TRANSIENT, "Network error: ConnectException",
                    OptionalInt.empty(), Optional.empty(), null);
        })).isEqualTo(new ApiKeyValidation(false, "Connection error: Network error: ConnectException"));
    }

    @Test
    void validationUsesAMinimalProbe() {
        List<VisionRequest> requests = new CopyOnWriteArrayList<>();
        validate(request -> {
            requests.add(request);
            return "ok";
        });

        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).userPrompt()).isEqualTo("test");
        assertThat(requests.get(0).maxTokens()).isEqualTo(AltTextGenerationEngine.VALIDATION_MAX_TOKENS);
    }

    @Test
    void validationWithoutKeyFailsImmediately() {
        AltTextGenerationEngine engine = new AltTextGenerationEngine(AltTextSettings.defaults(Optional.empty()),
                request -> "ok");

        assertThat(engine.validateApiKey()).isEqualTo(new ApiKeyValidation(false, "No API key configured"));
    }

    private ApiKeyValidation validate(VisionClient client) {
        return engine(client, UsageTracker.NOOP).validateApiKey();
    }

    private AltTextGenerationEngine engine(VisionClient client, UsageTracker tracker) {
        return new AltTextGenerationEngine(settings, client,
                new SlidingWindowRateLimiter(settings.maxRequestsPerMinute()),
                new SemaphoreConcurrencyGate(settings.maxConcurrentRequests()), tracker, new ImageEncoder());
    }

    private Path image(String name) {
        return TestImages.gradientJpeg(tempDir, name, 64, 48);
    }

    private List<Path> images(int count) {
        List<Path> paths = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            paths.add(image("image-" + i + ".jpg"));
        }
        return paths;
    }

    private static class CrashingEncoder extends ImageEncoder {

        @Override
        public EncodedImage encode(Path imagePath) {
            throw new IllegalArgumentException("bad huffman table");
        }
    }
}
