package io.clype.sqsbatcher.config;

import java.time.Duration;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import io.clype.sqsbatcher.metrics.SqsBatcherMetrics;
import io.clype.sqsbatcher.service.BatchSendListener;
import io.clype.sqsbatcher.service.Sleeper;
import io.clype.sqsbatcher.service.SqsBatcher;
import io.clype.sqsbatcher.transport.BatchTransport;
import io.clype.sqsbatcher.transport.SqsBatchTransport;

import software.amazon.awssdk.http.async.SdkAsyncHttpClient;
import software.amazon.awssdk.http.crt.AwsCrtAsyncHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

/**
 * Spring Boot auto-configuration for the SQS batcher.
 *
 * <p>This configuration is automatically enabled when the {@code sqs.batcher.queue-url}
 * property is set in your application configuration.</p>
 *
 * <p><b>Configuration Example (application.yml):</b></p>
 * <pre>{@code
 * sqs:
 *   batcher:
 *     queue-url: https://sqs.us-east-1.amazonaws.com/123456789012/orders
 *     region: us-east-1        # Optional, uses default provider chain if not set
 *     max-retries: 3           # Optional, default: 3
 *     backoff-factor: 500ms    # Optional, default: 500ms
 * }</pre>
 *
 * <p><b>Bean Customization:</b> All beans created by this configuration use
 * {@code @ConditionalOnMissingBean}. Define your own {@link BatchTransport} to send somewhere
 * other than SQS, or a {@link BatchSendListener} bean to observe every flush.</p>
 *
 * <p><b>AWS Credentials:</b> The SQS client uses the default AWS credential provider chain.</p>
 *
 * @see SqsBatcherProperties
 * @see SqsBatcher
 */
@AutoConfiguration
@EnableConfigurationProperties(SqsBatcherProperties.class)
@ConditionalOnProperty(prefix = "sqs.batcher", name = "queue-url")
public class SqsBatcherAutoConfiguration {

    private final SqsBatcherProperties properties;

    public SqsBatcherAutoConfiguration(SqsBatcherProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates an AWS CRT-based async HTTP client for SendMessageBatch calls.
     *
     * @return the configured async HTTP client
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SdkAsyncHttpClient awsCrtHttpClient() {
        return AwsCrtAsyncHttpClient.builder()
                .maxConcurrency(properties.getMaxConnections())
                .connectionTimeout(Duration.ofSeconds(10))
                .connectionMaxIdleTime(Duration.ofSeconds(60))
                .build();
    }

    /**
     * Creates the AWS SQS async client.
     *
     * <p>If a region is specified in properties, it will be used. Otherwise, the client
     * uses the default AWS region provider chain (environment, system properties, profile).</p>
     *
     * @param httpClient the async HTTP client to use for API calls
     * @return the configured SQS async client
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SqsAsyncClient sqsAsyncClient(SdkAsyncHttpClient httpClient) {
        var builder = SqsAsyncClient.builder()
                .httpClient(httpClient);

        if (properties.getRegion() != null && !properties.getRegion().isEmpty()) {
            builder.region(Region.of(properties.getRegion()));
        }

        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(SqsAsyncClient.class)
    public BatchTransport sqsBatchTransport(SqsAsyncClient sqsClient) {
        return new SqsBatchTransport(sqsClient);
    }

    /**
     * Creates the batcher bean from the bound properties.
     *
     * @param transport the transport shared by every buffer the batcher creates
     * @param listener  optional listener used by sessions opened without one
     * @param metrics   optional metrics collector
     * @return the configured batcher
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(BatchTransport.class)
    public SqsBatcher sqsBatcher(
            BatchTransport transport,
            ObjectProvider<BatchSendListener> listener,
            ObjectProvider<SqsBatcherMetrics> metrics) {
        return new SqsBatcher(
                transport,
                properties.toSettings(),
                listener.getIfAvailable(BatchSendListener::noop),
                metrics.getIfAvailable(),
                Sleeper.THREAD,
                properties.getPublishThreads());
    }
}
