package io.clype.sqsbatcher.service;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings for one batcher.
 *
 * @param queueUrl          the destination queue URL (required)
 * @param maxBatchCount     flush once this many messages are pending (1-10)
 * @param maxBatchSizeBytes flush before the estimated batch size would exceed this (1 B - 1 MiB)
 * @param maxRetries        additional attempts after the first (0 or more)
 * @param backoffFactor     base of the exponential pause between partial-failure retries
 * @param failOnUndelivered throw {@link io.clype.sqsbatcher.model.PartialBatchFailureException}
 *                          instead of dropping messages still failing after the last attempt
 */
public record BatcherSettings(
    String queueUrl,
    int maxBatchCount,
    int maxBatchSizeBytes,
    int maxRetries,
    Duration backoffFactor,
    boolean failOnUndelivered
) {

    /** SQS maximum entries per SendMessageBatch call. */
    public static final int MAX_BATCH_COUNT = 10;

    /** SQS maximum payload per SendMessageBatch call: 1 MiB. */
    public static final int MAX_BATCH_SIZE_BYTES = 1_048_576;

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BACKOFF_FACTOR = Duration.ofMillis(500);

    public BatcherSettings {
        Objects.requireNonNull(queueUrl, "queueUrl cannot be null");
        Objects.requireNonNull(backoffFactor, "backoffFactor cannot be null");
        if (queueUrl.isBlank()) {
            throw new IllegalArgumentException("queueUrl cannot be blank");
        }
        if (maxBatchCount < 1 || maxBatchCount > MAX_BATCH_COUNT) {
            throw new IllegalArgumentException("maxBatchCount must be between 1 and " + MAX_BATCH_COUNT);
        }
        if (maxBatchSizeBytes < 1 || maxBatchSizeBytes > MAX_BATCH_SIZE_BYTES) {
            throw new IllegalArgumentException("maxBatchSizeBytes must be between 1 and " + MAX_BATCH_SIZE_BYTES);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (backoffFactor.isNegative()) {
            throw new IllegalArgumentException("backoffFactor must not be negative");
        }
    }

    public static Builder builder(String queueUrl) {
        return new Builder(queueUrl);
    }

    public long maxAttempts() {
        return (long) maxRetries + 1;
    }

    /** Builder starting from the SQS limits and the default retry policy. */
    public static final class Builder {
        private final String queueUrl;
        private int maxBatchCount = MAX_BATCH_COUNT;
        private int maxBatchSizeBytes = MAX_BATCH_SIZE_BYTES;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration backoffFactor = DEFAULT_BACKOFF_FACTOR;
        private boolean failOnUndelivered;

        private Builder(String queueUrl) {
            this.queueUrl = queueUrl;
        }

        public Builder maxBatchCount(int maxBatchCount) {
            this.maxBatchCount = maxBatchCount;
            return this;
        }

        public Builder maxBatchSizeBytes(int maxBatchSizeBytes) {
            this.maxBatchSizeBytes = maxBatchSizeBytes;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder backoffFactor(Duration backoffFactor) {
            this.backoffFactor = backoffFactor;
            return this;
        }

        public Builder failOnUndelivered(boolean failOnUndelivered) {
            this.failOnUndelivered = failOnUndelivered;
            return this;
        }

        public BatcherSettings build() {
            return new BatcherSettings(queueUrl, maxBatchCount, maxBatchSizeBytes, maxRetries,
                    backoffFactor, failOnUndelivered);
        }
    }
}
