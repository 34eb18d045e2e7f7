package io.clype.sqsbatcher.service;

import java.util.List;

import org.mockito.stubbing.Answer;

import io.clype.sqsbatcher.model.BatchItem;
import io.clype.sqsbatcher.model.BatchSendResult;
import io.clype.sqsbatcher.model.FailedEntry;

final class TestTransports {

    static final String QUEUE_URL = "https://sqs.us-east-1.amazonaws.com/123456789012/orders";

    private TestTransports() {
    }

    /** Accepts every entry of the batch it is given. */
    static Answer<BatchSendResult> acceptAll() {
        return invocation -> {
            List<BatchItem> items = invocation.getArgument(1);
            return BatchSendResult.allSucceeded(items.stream().map(BatchItem::id).toList());
        };
    }

    /** Rejects the given ids with a retryable service-side error and accepts the rest. */
    static BatchSendResult rejecting(List<BatchItem> items, String... failedIds) {
        List<String> failed = List.of(failedIds);
        return new BatchSendResult(
                items.stream().map(BatchItem::id).filter(id -> !failed.contains(id)).toList(),
                failed.stream().map(TestTransports::internalError).toList());
    }

    static FailedEntry internalError(String id) {
        return new FailedEntry(id, "InternalError", "Internal failure", false);
    }
}
