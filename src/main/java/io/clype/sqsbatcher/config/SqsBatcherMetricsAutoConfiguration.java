package io.clype.sqsbatcher.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import io.clype.sqsbatcher.metrics.SqsBatcherMetrics;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Auto-configuration for SQS batcher metrics.
 *
 * <p>This configuration is automatically enabled when:</p>
 * <ul>
 *   <li>Micrometer is on the classpath</li>
 *   <li>A {@link MeterRegistry} bean exists</li>
 *   <li>{@code sqs.batcher.queue-url} is set</li>
 *   <li>The {@code sqs.batcher.metrics.enabled} property is true (default)</li>
 * </ul>
 *
 * <p>Runs after Spring Boot Actuator's meter registry auto-configuration, so an actuator-provided
 * registry is visible to {@code @ConditionalOnBean}, and before {@link SqsBatcherAutoConfiguration}
 * so the batcher picks up the metrics bean. The actuator class is referenced by name; actuator is
 * not a dependency of this library.</p>
 *
 * @see SqsBatcherMetrics
 */
@AutoConfiguration(
        before = SqsBatcherAutoConfiguration.class,
        afterName = SqsBatcherMetricsAutoConfiguration.COMPOSITE_METER_REGISTRY_AUTO_CONFIGURATION)
@EnableConfigurationProperties(SqsBatcherProperties.class)
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "sqs.batcher", name = "queue-url")
public class SqsBatcherMetricsAutoConfiguration {

    static final String COMPOSITE_METER_REGISTRY_AUTO_CONFIGURATION =
            "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration";

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "sqs.batcher.metrics", name = "enabled",
            havingValue = "true", matchIfMissing = true)
    public SqsBatcherMetrics sqsBatcherMetrics(
            MeterRegistry registry,
            SqsBatcherProperties properties) {
        return new SqsBatcherMetrics(registry, properties.getQueueUrl());
    }
}
