package ai.photodesk.batch.queue;

import ai.photodesk.batch.alttext.AltTextResult;
import ai.photodesk.batch.alttext.AltTextStatus;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * One image in the processing queue together with its transform and alt-text outcome.
 *
 * <p>State changes are only made by {@link BatchProcessor}; they are validated and throw
 * {@link IllegalStateException} on an illegal transition. Observers receive copies.
 */
public final class BatchItem {

    private final Path sourcePath;
    private final long fileSize;
    private Path outputPath;
    private TransformStatus transformStatus;
    private String transformError;
    private Duration processingTime;
    private String altText;
    private AltTextStatus altTextStatus;
    private String altTextError;
    private BigDecimal apiCost;
    private Duration generationTime;

    BatchItem(Path sourcePath, long fileSize) {
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath");
        this.fileSize = fileSize;
        this.transformStatus = TransformStatus.PENDING;
        this.processingTime = Duration.ZERO;
        this.altTextStatus = AltTextStatus.PENDING;
        this.apiCost = BigDecimal.ZERO;
        this.generationTime = Duration.ZERO;
    }

    private BatchItem(BatchItem other) {
        this.sourcePath = other.sourcePath;
        this.fileSize = other.fileSize;
        this.outputPath = other.outputPath;
        this.transformStatus = other.transformStatus;
        this.transformError = other.transformError;
        this.processingTime = other.processingTime;
        this.altText = other.altText;
        this.altTextStatus = other.altTextStatus;
        this.altTextError = other.altTextError;
        this.apiCost = other.apiCost;
        this.generationTime = other.generationTime;
    }

    public Path sourcePath() {
        return sourcePath;
    }

    public long fileSize() {
        return fileSize;
    }

    public synchronized Optional<Path> outputPath() {
        return Optional.ofNullable(outputPath);
    }

    public synchronized TransformStatus transformStatus() {
        return transformStatus;
    }

    public synchronized Optional<String> transformError() {
        return Optional.ofNullable(transformError);
    }

    public synchronized Duration processingTime() {
        return processingTime;
    }

    public synchronized Optional<String> altText() {
        return Optional.ofNullable(altText);
    }

    public synchronized AltTextStatus altTextStatus() {
        return altTextStatus;
    }

    public synchronized Optional<String> altTextError() {
        return Optional.ofNullable(altTextError);
    }

    public synchronized BigDecimal apiCost() {
        return apiCost;
    }

    public synchronized Duration generationTime() {
        return generationTime;
    }

    public String fileName() {
        Path name = sourcePath.getFileName();
        return name == null ? sourcePath.toString() : name.toString();
    }

    /**
     * @return an independent snapshot of this item
     */
    public synchronized BatchItem copy() {
        return new BatchItem(this);
    }

    synchronized void markProcessing() {
        requireTransform(TransformStatus.PENDING, TransformStatus.PROCESSING);
        transformStatus = TransformStatus.PROCESSING;
    }

    synchronized void markCompleted(Path output, Duration elapsed) {
        requireTransform(TransformStatus.PROCESSING, TransformStatus.COMPLETED);
        outputPath = Objects.requireNonNull(output, "output");
        processingTime = Objects.requireNonNull(elapsed, "elapsed");
        transformStatus = TransformStatus.COMPLETED;
    }

    synchronized void markFailed(String error, Duration elapsed) {
        requireTransform(TransformStatus.PROCESSING, TransformStatus.FAILED);
        transformError = error == null || error.isBlank() ? "Unknown error" : error;
        processingTime = Objects.requireNonNull(elapsed, "elapsed");
        transformStatus = TransformStatus.FAILED;
    }

    synchronized void markCancelled() {
        requireTransform(TransformStatus.PENDING, TransformStatus.CANCELLED);
        transformStatus = TransformStatus.CANCELLED;
    }

    synchronized void markAltTextGenerating() {
        requireTransformCompleted();
        if (altTextStatus != AltTextStatus.PENDING) {
            throw new IllegalStateException("Cannot start alt text generation from " + altTextStatus + " for " + fileName());
        }
        altTextStatus = AltTextStatus.GENERATING;
    }

    synchronized void applyAltText(AltTextResult result) {
        Objects.requireNonNull(result, "result");
        requireTransformCompleted();
        if (altTextStatus != AltTextStatus.PENDING && altTextStatus != AltTextStatus.GENERATING) {
            throw new IllegalStateException("Alt text already resolved as " + altTextStatus + " for " + fileName());
        }
        altTextStatus = result.status();
        altText = result.altText().orElse(null);
        altTextError = result.errorMessage().orElse(null);
        apiCost = result.apiCost();
        generationTime = result.generationTime();
    }

    synchronized void resetAltText() {
        requireTransformCompleted();
        if (altTextStatus == AltTextStatus.GENERATING) {
            throw new IllegalStateException("Alt text generation in progress for " + fileName());
        }
        altTextStatus = AltTextStatus.PENDING;
        altText = null;
        altTextError = null;
        apiCost = BigDecimal.ZERO;
        generationTime = Duration.ZERO;
    }

    private void requireTransform(TransformStatus expected, TransformStatus target) {
        if (transformStatus != expected) {
            throw new IllegalStateException("Illegal transition " + transformStatus + " -> " + target + " for " + fileName());
        }
    }

    private void requireTransformCompleted() {
        if (transformStatus != TransformStatus.COMPLETED) {
            throw new IllegalStateException("Alt text requires a completed transform; " + fileName() + " is " + transformStatus);
        }
    }

    @Override
    public synchronized String toString() {
        return "BatchItem[" + sourcePath + ", transform=" + transformStatus + ", altText=" + altTextStatus + "]";
    }
}
