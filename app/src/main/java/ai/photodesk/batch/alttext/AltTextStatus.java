package ai.photodesk.batch.alttext;

/**
 * Lifecycle of one alt-text request: {@code PENDING -> GENERATING -> COMPLETED | ERROR}.
 */
public enum AltTextStatus {
    PENDING,
    GENERATING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}
