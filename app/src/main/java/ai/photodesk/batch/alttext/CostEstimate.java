package ai.photodesk.batch.alttext;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Projected API spend in USD. The monthly figure assumes twenty batches of the same size.
 */
public record CostEstimate(int imageCount, BigDecimal perImage, BigDecimal total, BigDecimal monthlyEstimate) {

    public static final int BATCHES_PER_MONTH = 20;

    public CostEstimate {
        if (imageCount < 0) {
            throw new IllegalArgumentException("imageCount must not be negative");
        }
        Objects.requireNonNull(perImage, "perImage");
        Objects.requireNonNull(total, "total");
        Objects.requireNonNull(monthlyEstimate, "monthlyEstimate");
    }

    public static CostEstimate of(int imageCount, BigDecimal perImage) {
        if (imageCount < 0) {
            throw new IllegalArgumentException("imageCount must not be negative");
        }
        BigDecimal total = perImage.multiply(BigDecimal.valueOf(imageCount));
        return new CostEstimate(imageCount, perImage, total, total.multiply(BigDecimal.valueOf(BATCHES_PER_MONTH)));
    }
}
