package ai.photodesk.batch.throttle;

/**
 * Bounds the number of simultaneous in-flight remote calls.
 */
public interface ConcurrencyGate {

    /**
     * Blocks until a slot is free.
     *
     * @return the held slot; closing it releases the slot exactly once
     * @throws InterruptedException when interrupted while waiting
     */
    Permit acquire() throws InterruptedException;

    int availablePermits();

    /**
     * A held slot, released on {@link #close()}. Closing twice is a no-op.
     */
    interface Permit extends AutoCloseable {

        @Override
        void close();
    }
}
