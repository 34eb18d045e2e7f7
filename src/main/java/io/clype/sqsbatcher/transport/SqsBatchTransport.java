package io.clype.sqsbatcher.transport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;

import io.clype.sqsbatcher.model.BatchItem;
import io.clype.sqsbatcher.model.BatchSendResult;
import io.clype.sqsbatcher.model.BatchTransportException;
import io.clype.sqsbatcher.model.EntryOptions;
import io.clype.sqsbatcher.model.FailedEntry;
import io.clype.sqsbatcher.model.MessageAttribute;

import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchRequestEntry;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchResultEntry;

/**
 * {@link BatchTransport} backed by the AWS SDK's {@link SqsAsyncClient}.
 *
 * <p>Each call blocks until the {@code SendMessageBatch} response arrives. The client is
 * only read, so one instance can serve any number of buffers.</p>
 */
public class SqsBatchTransport implements BatchTransport {

    private final SqsAsyncClient sqsClient;

    public SqsBatchTransport(SqsAsyncClient sqsClient) {
        this.sqsClient = Objects.requireNonNull(sqsClient, "sqsClient cannot be null");
    }

    @Override
    public BatchSendResult sendBatch(String queueUrl, List<BatchItem> items) {
        SendMessageBatchRequest request = buildBatchRequest(queueUrl, items);
        SendMessageBatchResponse response;
        try {
            response = sqsClient.sendMessageBatch(request).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new BatchTransportException("SendMessageBatch failed: " + cause.getMessage(), cause);
        }
        return toResult(response);
    }

    /**
     * Builds the SQS SendMessageBatchRequest from a list of items.
     */
    SendMessageBatchRequest buildBatchRequest(String queueUrl, List<BatchItem> items) {
        List<SendMessageBatchRequestEntry> entries = new ArrayList<>(items.size());

        for (BatchItem item : items) {
            EntryOptions options = item.options();
            entries.add(SendMessageBatchRequestEntry.builder()
                    .id(item.id())
                    .messageBody(item.body())
                    .messageAttributes(toAttributeValues(item.attributes()))
                    .messageGroupId(options.messageGroupId())
                    .messageDeduplicationId(options.messageDeduplicationId())
                    .delaySeconds(options.delaySeconds())
                    .build());
        }

        return SendMessageBatchRequest.builder()
                .queueUrl(queueUrl)
                .entries(entries)
                .build();
    }

    private static Map<String, MessageAttributeValue> toAttributeValues(Map<String, MessageAttribute> attributes) {
        Map<String, MessageAttributeValue> values = new LinkedHashMap<>(attributes.size());
        attributes.forEach((name, attribute) -> values.put(name, MessageAttributeValue.builder()
                .dataType(attribute.dataType())
                .stringValue(attribute.stringValue())
                .binaryValue(attribute.binaryValue())
                .stringListValues(attribute.stringListValues())
                .binaryListValues(attribute.binaryListValues())
                .build()));
        return values;
    }

    private static BatchSendResult toResult(SendMessageBatchResponse response) {
        List<String> successful = response.hasSuccessful()
                ? response.successful().stream().map(SendMessageBatchResultEntry::id).toList()
                : List.of();
        List<FailedEntry> failed = response.hasFailed()
                ? response.failed().stream()
                        .map(e -> new FailedEntry(e.id(), e.code(), e.message(),
                                Boolean.TRUE.equals(e.senderFault())))
                        .toList()
                : List.of();
        return new BatchSendResult(successful, failed);
    }
}
