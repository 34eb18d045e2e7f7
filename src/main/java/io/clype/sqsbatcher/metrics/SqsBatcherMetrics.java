package io.clype.sqsbatcher.metrics;

import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Collects and exposes metrics for SQS batch sends.
 *
 * <p><b>Available Metrics:</b></p>
 * <ul>
 *   <li>{@code sqs.batcher.flushes} - Counter of logical flushes (one per non-empty buffer flush)</li>
 *   <li>{@code sqs.batcher.attempts} - Counter of SendMessageBatch calls, retries included</li>
 *   <li>{@code sqs.batcher.retries} - Counter of attempts beyond the first</li>
 *   <li>{@code sqs.batcher.transport.errors} - Counter of calls that failed outright</li>
 *   <li>{@code sqs.batcher.messages.sent} - Counter of messages accepted by SQS</li>
 *   <li>{@code sqs.batcher.messages.failed} - Counter of per-entry rejections, per attempt</li>
 *   <li>{@code sqs.batcher.messages.undelivered} - Counter of messages given up on after the last attempt</li>
 *   <li>{@code sqs.batcher.send.latency} - Timer measuring SendMessageBatch latency (p50, p95, p99)</li>
 *   <li>{@code sqs.batcher.batch.size} - Summary of messages per flushed batch</li>
 * </ul>
 *
 * <p>All metrics are tagged with the queue name.</p>
 */
public class SqsBatcherMetrics {

    private static final String METRIC_PREFIX = "sqs.batcher";
    private static final double[] SEND_LATENCY_PERCENTILES = {0.5, 0.95, 0.99};

    private final Counter flushes;
    private final Counter attempts;
    private final Counter retries;
    private final Counter transportErrors;
    private final Counter messagesSent;
    private final Counter messagesFailed;
    private final Counter messagesUndelivered;
    private final Timer sendLatency;
    private final DistributionSummary batchSize;

    /**
     * Creates a new SqsBatcherMetrics instance.
     *
     * @param registry the Micrometer registry to register metrics with
     * @param queueUrl the SQS queue URL (used for tagging metrics)
     */
    public SqsBatcherMetrics(MeterRegistry registry, String queueUrl) {
        Tags tags = Tags.of("queue", extractQueueName(queueUrl));

        this.flushes = counter(registry, "flushes", "Number of non-empty buffer flushes", tags);
        this.attempts = counter(registry, "attempts", "Number of SendMessageBatch calls", tags);
        this.retries = counter(registry, "retries", "Number of SendMessageBatch calls beyond the first per flush", tags);
        this.transportErrors = counter(registry, "transport.errors",
                "Number of SendMessageBatch calls that failed without a response", tags);
        this.messagesSent = counter(registry, "messages.sent", "Messages accepted by SQS", tags);
        this.messagesFailed = counter(registry, "messages.failed", "Per-entry rejections reported by SQS", tags);
        this.messagesUndelivered = counter(registry, "messages.undelivered",
                "Messages still rejected after the last retry", tags);

        this.sendLatency = Timer.builder(METRIC_PREFIX + ".send.latency")
                .description("Time taken by one SendMessageBatch call")
                .tags(tags)
                .publishPercentiles(SEND_LATENCY_PERCENTILES)
                .register(registry);

        this.batchSize = DistributionSummary.builder(METRIC_PREFIX + ".batch.size")
                .description("Number of messages per flushed batch")
                .tags(tags)
                .register(registry);
    }

    private static Counter counter(MeterRegistry registry, String name, String description, Tags tags) {
        return Counter.builder(METRIC_PREFIX + "." + name)
                .description(description)
                .tags(tags)
                .register(registry);
    }

    /**
     * Records the start of a flush of a non-empty batch.
     *
     * @param messageCount number of messages in the snapshot
     */
    public void recordFlush(int messageCount) {
        flushes.increment();
        batchSize.record(messageCount);
    }

    /**
     * Records a SendMessageBatch call that returned a response.
     *
     * @param attempt      1-based attempt index within the flush
     * @param sentCount    number of messages accepted on this attempt
     * @param failedCount  number of messages rejected on this attempt
     * @param latencyNanos call duration in nanoseconds
     */
    public void recordAttempt(int attempt, int sentCount, int failedCount, long latencyNanos) {
        countAttempt(attempt);
        messagesSent.increment(sentCount);
        messagesFailed.increment(failedCount);
        sendLatency.record(latencyNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Records a SendMessageBatch call that threw.
     *
     * @param attempt 1-based attempt index within the flush
     */
    public void recordTransportError(int attempt) {
        countAttempt(attempt);
        transportErrors.increment();
    }

    /**
     * Records messages abandoned after the last attempt.
     *
     * @param count number of undelivered messages
     */
    public void recordUndelivered(int count) {
        messagesUndelivered.increment(count);
    }

    private void countAttempt(int attempt) {
        attempts.increment();
        if (attempt > 1) {
            retries.increment();
        }
    }

    /**
     * Extracts the queue name from a queue URL or ARN.
     *
     * @param queueUrl e.g. https://sqs.us-east-1.amazonaws.com/123456789012/orders.fifo
     * @return the queue name (e.g., orders.fifo)
     */
    static String extractQueueName(String queueUrl) {
        if (queueUrl == null || queueUrl.isEmpty()) {
            return "unknown";
        }
        String trimmed = queueUrl.endsWith("/") ? queueUrl.substring(0, queueUrl.length() - 1) : queueUrl;
        int lastSeparator = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf(':'));
        if (lastSeparator >= 0 && lastSeparator < trimmed.length() - 1) {
            return trimmed.substring(lastSeparator + 1);
        }
        return trimmed.isEmpty() ? "unknown" : trimmed;
    }
}
