package ai.photodesk.batch.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * Summary of a batch run. A run that could not start carries {@code success=false} and a message.
 */
public record BatchResult(
        boolean success,
        int totalProcessed,
        int successful,
        int failed,
        int cancelledItems,
        boolean cancelled,
        Duration elapsedTime,
        Duration averageTimePerImage,
        int altTextGenerated,
        int altTextFailed,
        Optional<String> message
) {

    public BatchResult {
        elapsedTime = elapsedTime == null ? Duration.ZERO : elapsedTime;
        averageTimePerImage = averageTimePerImage == null ? Duration.ZERO : averageTimePerImage;
        message = message == null ? Optional.empty() : message;
    }

    public static BatchResult failure(String message) {
        return new BatchResult(false, 0, 0, 0, 0, false, Duration.ZERO, Duration.ZERO, 0, 0, Optional.of(message));
    }

    public BatchResult withAltText(int generated, int failedCount) {
        return new BatchResult(success, totalProcessed, successful, failed, cancelledItems, cancelled, elapsedTime,
                averageTimePerImage, generated, failedCount, message);
    }
}
