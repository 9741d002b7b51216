package com.cred.freestyle.eventbooking.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.time.Duration;
import java.util.Map;

/**
 * Ships booking metrics to AWS CloudWatch.
 * Only active when cloud.aws.cloudwatch.enabled=true; otherwise Actuator's default
 * in-memory registry backs {@link com.cred.freestyle.eventbooking.infrastructure.metrics.CloudWatchMetricsService}.
 *
 * @author Event Booking Team
 */
@Configuration
@ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true")
public class CloudWatchConfig {

    @Value("${cloud.aws.region:us-east-1}")
    private String awsRegion;

    @Value("${cloud.aws.cloudwatch.namespace:EventBooking}")
    private String namespace;

    @Value("${cloud.aws.cloudwatch.batch-size:20}")
    private int batchSize;

    @Value("${cloud.aws.cloudwatch.step:PT1M}")
    private Duration step;

    @Value("${spring.application.name:event-booking-service}")
    private String applicationName;

    @Bean(destroyMethod = "close")
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    /**
     * CloudWatch-backed registry. Keys not listed fall back to Micrometer's defaults.
     */
    @Bean
    public MeterRegistry cloudWatchMeterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        Map<String, String> values = Map.of(
                "cloudwatch.namespace", namespace,
                "cloudwatch.batchSize", String.valueOf(batchSize),
                "cloudwatch.step", step.toString()
        );
        io.micrometer.cloudwatch2.CloudWatchConfig config = values::get;
        return new CloudWatchMeterRegistry(config, Clock.SYSTEM, cloudWatchAsyncClient);
    }

    /**
     * Tags every booking metric with the emitting application so dashboards can
     * split staging and production namespaces sharing one account.
     */
    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTags() {
        return registry -> registry.config().commonTags("application", applicationName);
    }
}
