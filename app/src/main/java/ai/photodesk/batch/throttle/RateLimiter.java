package ai.photodesk.batch.throttle;

/**
 * Client-side admission check for outbound API requests.
 */
@FunctionalInterface
public interface RateLimiter {

    /**
     * Atomically tests whether another request fits the current window and records it when it does.
     * Never blocks; a rejected attempt consumes no budget.
     *
     * @return {@code true} when the request is admitted
     */
    boolean tryAcquire();
}
