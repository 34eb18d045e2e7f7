package io.clype.sqsbatcher.model;

import java.util.List;

/**
 * Thrown when messages in a batch are still failing after the last retry and the
 * batcher is configured to fail on undelivered messages.
 *
 * <p>This exception provides structured access to failure details, allowing
 * consumers to programmatically handle partial failures.</p>
 */
public class PartialBatchFailureException extends RuntimeException {

    private final List<FailedEntry> failedEntries;
    private final List<String> deliveredIds;

    /**
     * Creates a new PartialBatchFailureException.
     *
     * @param failedEntries the entries that were never delivered
     * @param deliveredIds  the ids delivered by the same flush
     */
    public PartialBatchFailureException(List<FailedEntry> failedEntries, List<String> deliveredIds) {
        super("Partial batch failure: " + failedEntries.size() + " of " +
              (failedEntries.size() + deliveredIds.size()) + " messages undelivered after retries");
        this.failedEntries = List.copyOf(failedEntries);
        this.deliveredIds = List.copyOf(deliveredIds);
    }

    /**
     * Returns the list of failed entries with error details.
     *
     * @return immutable list of failed entries
     */
    public List<FailedEntry> getFailedEntries() {
        return failedEntries;
    }

    /**
     * Returns the ids that were delivered before the flush gave up.
     *
     * @return immutable list of delivered ids
     */
    public List<String> getDeliveredIds() {
        return deliveredIds;
    }

    public int getFailureCount() {
        return failedEntries.size();
    }
}
