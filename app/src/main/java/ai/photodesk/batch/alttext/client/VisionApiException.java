package ai.photodesk.batch.alttext.client;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Runtime exception raised by {@link VisionClient} implementations.
 */
public class VisionApiException extends RuntimeException {

    private final VisionFailure failure;
    private final OptionalInt statusCode;
    private final Optional<Duration> retryAfter;

    public VisionApiException(VisionFailure failure, String message) {
        this(failure, message, OptionalInt.empty(), Optional.empty(), null);
    }

    public VisionApiException(VisionFailure failure, String message, Throwable cause) {
        this(failure, message, OptionalInt.empty(), Optional.empty(), cause);
    }

    public VisionApiException(VisionFailure failure, String message, OptionalInt statusCode,
                              Optional<Duration> retryAfter, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
        this.statusCode = statusCode == null ? OptionalInt.empty() : statusCode;
        this.retryAfter = retryAfter == null ? Optional.empty() : retryAfter;
    }

    public static VisionApiException httpStatus(VisionFailure failure, int status, String message) {
        return new VisionApiException(failure, message, OptionalInt.of(status), Optional.empty(), null);
    }

    public static VisionApiException rateLimited(Optional<Duration> retryAfter) {
        return new VisionApiException(VisionFailure.RATE_LIMITED, "Rate limited by API", OptionalInt.of(429), retryAfter, null);
    }

    public VisionFailure failure() {
        return failure;
    }

    public OptionalInt statusCode() {
        return statusCode;
    }

    public Optional<Duration> retryAfter() {
        return retryAfter;
    }
}
