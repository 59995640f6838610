package ai.photodesk.batch.throttle;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ConcurrencyGate} backed by a fair counting semaphore.
 */
public class SemaphoreConcurrencyGate implements ConcurrencyGate {

    private final Semaphore semaphore;
    private final int permits;

    public SemaphoreConcurrencyGate(int permits) {
        if (permits < 1) {
            throw new IllegalArgumentException("permits must be at least 1");
        }
        this.permits = permits;
        this.semaphore = new Semaphore(permits, true);
    }

    @Override
    public Permit acquire() throws InterruptedException {
        semaphore.acquire();
        return new SemaphorePermit();
    }

    @Override
    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public int inFlight() {
        return permits - semaphore.availablePermits();
    }

    public int capacity() {
        return permits;
    }

    private final class SemaphorePermit implements Permit {

        private final AtomicBoolean released = new AtomicBoolean();

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                semaphore.release();
            }
        }
    }
}
