package ai.photodesk.batch.alttext.client;

/**
 * Classification of a failed vision call, used to decide whether it is retried.
 */
public enum VisionFailure {
    /** The service answered 429. Never retried. */
    RATE_LIMITED,
    /** 5xx, timeouts and connection failures. Retried with backoff. */
    TRANSIENT,
    AUTHENTICATION,
    MODEL_NOT_FOUND,
    CLIENT_ERROR,
    INVALID_RESPONSE,
    INTERRUPTED;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
