package io.clype.sqsbatcher.model;

import java.util.List;

/**
 * Partition of one send attempt into the items that went through and the ones to retry.
 *
 * @param succeededIds  ids delivered on this attempt, in batch order
 * @param failedItems   items rejected on this attempt, in batch order
 * @param failedEntries the service's error details for the rejected items
 */
public record FlushOutcome(
    List<String> succeededIds,
    List<BatchItem> failedItems,
    List<FailedEntry> failedEntries
) {
    public boolean isComplete() {
        return failedItems.isEmpty();
    }
}
