package io.clype.sqsbatcher.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.clype.sqsbatcher.service.BatcherSettings;

/**
 * Configuration properties for the SQS batcher.
 *
 * <p>These properties are bound to the {@code sqs.batcher} prefix in your
 * application configuration.</p>
 *
 * <p><b>Example Configuration (application.yml):</b></p>
 * <pre>{@code
 * sqs:
 *   batcher:
 *     queue-url: https://sqs.us-east-1.amazonaws.com/123456789012/orders
 *     region: us-east-1
 *     max-batch-count: 10
 *     max-batch-size-bytes: 1048576
 *     max-retries: 3
 *     backoff-factor: 500ms
 *     fail-on-undelivered: false
 *     max-connections: 50
 *     publish-threads: 16
 *     metrics:
 *       enabled: true
 * }</pre>
 *
 * @see SqsBatcherAutoConfiguration
 */
@ConfigurationProperties(prefix = "sqs.batcher")
public class SqsBatcherProperties {

    public static final int DEFAULT_MAX_CONNECTIONS = 50;
    public static final int DEFAULT_PUBLISH_THREADS = 16;

    private String queueUrl;
    private String region;
    private int maxBatchCount = BatcherSettings.MAX_BATCH_COUNT;
    private int maxBatchSizeBytes = BatcherSettings.MAX_BATCH_SIZE_BYTES;
    private int maxRetries = BatcherSettings.DEFAULT_MAX_RETRIES;
    private Duration backoffFactor = BatcherSettings.DEFAULT_BACKOFF_FACTOR;
    private boolean failOnUndelivered = false;
    private int maxConnections = DEFAULT_MAX_CONNECTIONS;
    private int publishThreads = DEFAULT_PUBLISH_THREADS;
    private MetricsConfig metrics = new MetricsConfig();

    public String getQueueUrl() { return queueUrl; }
    public void setQueueUrl(String queueUrl) { this.queueUrl = queueUrl; }

    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }

    public int getMaxBatchCount() { return maxBatchCount; }
    public void setMaxBatchCount(int maxBatchCount) { this.maxBatchCount = maxBatchCount; }

    public int getMaxBatchSizeBytes() { return maxBatchSizeBytes; }
    public void setMaxBatchSizeBytes(int maxBatchSizeBytes) { this.maxBatchSizeBytes = maxBatchSizeBytes; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public Duration getBackoffFactor() { return backoffFactor; }
    public void setBackoffFactor(Duration backoffFactor) { this.backoffFactor = backoffFactor; }

    public boolean isFailOnUndelivered() { return failOnUndelivered; }
    public void setFailOnUndelivered(boolean failOnUndelivered) { this.failOnUndelivered = failOnUndelivered; }

    public int getMaxConnections() { return maxConnections; }
    public void setMaxConnections(int maxConnections) { this.maxConnections = maxConnections; }

    public int getPublishThreads() { return publishThreads; }
    public void setPublishThreads(int publishThreads) { this.publishThreads = publishThreads; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Converts the bound properties into validated batcher settings.
     *
     * @throws IllegalArgumentException if any value is out of range
     */
    public BatcherSettings toSettings() {
        return BatcherSettings.builder(queueUrl)
                .maxBatchCount(maxBatchCount)
                .maxBatchSizeBytes(maxBatchSizeBytes)
                .maxRetries(maxRetries)
                .backoffFactor(backoffFactor)
                .failOnUndelivered(failOnUndelivered)
                .build();
    }

    /** Metrics configuration. */
    public static class MetricsConfig {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
