package ai.photodesk.batch.queue;

import java.time.Duration;

/**
 * Point-in-time view of a running transform phase. {@code currentItemIndex} is -1 before the first item.
 */
public record ProgressSnapshot(
        int totalItems,
        int completedItems,
        int failedItems,
        int cancelledItems,
        int currentItemIndex,
        String currentItemName,
        Duration elapsedTime,
        Duration estimatedTimeRemaining,
        Duration averageProcessingTime,
        boolean cancelled
) {

    public ProgressSnapshot {
        if (completedItems + failedItems + cancelledItems > totalItems) {
            throw new IllegalArgumentException("resolved items exceed total");
        }
        currentItemName = currentItemName == null ? "" : currentItemName;
    }

    public int resolvedItems() {
        return completedItems + failedItems + cancelledItems;
    }

    public double percentComplete() {
        return totalItems == 0 ? 100.0 : resolvedItems() * 100.0 / totalItems;
    }
}
