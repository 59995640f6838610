package ai.photodesk.batch.usage;

import java.math.BigDecimal;

/**
 * Receives the cost of every successful vision call.
 */
@FunctionalInterface
public interface UsageTracker {

    UsageTracker NOOP = cost -> { };

    void recordUsage(BigDecimal cost);
}
