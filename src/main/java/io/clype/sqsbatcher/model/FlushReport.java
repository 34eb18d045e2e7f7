package io.clype.sqsbatcher.model;

import java.util.List;

/**
 * Result of one logical flush across all of its attempts.
 *
 * @param deliveredIds ids delivered, accumulated across attempts
 * @param undelivered  entries still failing after the last permitted attempt
 * @param attempts     number of transport calls made
 */
public record FlushReport(
    List<String> deliveredIds,
    List<FailedEntry> undelivered,
    int attempts
) {
    private static final FlushReport EMPTY = new FlushReport(List.of(), List.of(), 0);

    public FlushReport {
        deliveredIds = List.copyOf(deliveredIds);
        undelivered = List.copyOf(undelivered);
    }

    public static FlushReport empty() {
        return EMPTY;
    }

    public boolean fullyDelivered() {
        return undelivered.isEmpty();
    }
}
