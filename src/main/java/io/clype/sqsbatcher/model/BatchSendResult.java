package io.clype.sqsbatcher.model;

import java.util.List;

/**
 * Structured response of one batched transport call.
 *
 * @param successfulIds ids the service accepted
 * @param failed        entries the service rejected
 */
public record BatchSendResult(
    List<String> successfulIds,
    List<FailedEntry> failed
) {
    public BatchSendResult {
        successfulIds = successfulIds != null ? List.copyOf(successfulIds) : List.of();
        failed = failed != null ? List.copyOf(failed) : List.of();
    }

    public static BatchSendResult allSucceeded(List<String> ids) {
        return new BatchSendResult(ids, List.of());
    }
}
