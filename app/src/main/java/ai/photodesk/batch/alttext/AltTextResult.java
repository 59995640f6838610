package ai.photodesk.batch.alttext;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single alt-text generation.
 */
public record AltTextResult(
        Optional<String> altText,
        AltTextStatus status,
        Optional<String> errorMessage,
        BigDecimal apiCost,
        Duration generationTime
) {

    public AltTextResult {
        altText = altText == null ? Optional.empty() : altText;
        status = Objects.requireNonNull(status, "status");
        errorMessage = errorMessage == null ? Optional.empty() : errorMessage;
        apiCost = apiCost == null ? BigDecimal.ZERO : apiCost;
        generationTime = generationTime == null ? Duration.ZERO : generationTime;
        if (status != AltTextStatus.COMPLETED && status != AltTextStatus.ERROR) {
            throw new IllegalArgumentException("status must be COMPLETED or ERROR");
        }
        if (status == AltTextStatus.COMPLETED && altText.isEmpty()) {
            throw new IllegalArgumentException("altText is required for a completed result");
        }
    }

    public static AltTextResult completed(String altText, BigDecimal apiCost, Duration generationTime) {
        return new AltTextResult(Optional.of(altText), AltTextStatus.COMPLETED, Optional.empty(), apiCost, generationTime);
    }

    public static AltTextResult error(String message, Duration generationTime) {
        return new AltTextResult(Optional.empty(), AltTextStatus.ERROR, Optional.of(message), BigDecimal.ZERO, generationTime);
    }

    public boolean isSuccess() {
        return status == AltTextStatus.COMPLETED;
    }
}
