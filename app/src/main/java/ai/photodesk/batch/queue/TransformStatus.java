package ai.photodesk.batch.queue;

/**
 * Transform lifecycle of a queued image: {@code PENDING -> PROCESSING -> COMPLETED | FAILED}, or
 * {@code PENDING -> CANCELLED}.
 */
public enum TransformStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
