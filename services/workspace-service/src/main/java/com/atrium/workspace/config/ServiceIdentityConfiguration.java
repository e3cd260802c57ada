package com.atrium.workspace.config;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.actuate.info.InfoContributor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Publishes {@link WorkspaceServiceProperties} to operations: the {@code service} section of
 * {@code /actuator/info}, and {@code service}/{@code environment} tags on every meter.
 */
@Configuration
public class ServiceIdentityConfiguration {

    @Bean
    public InfoContributor serviceInfoContributor(WorkspaceServiceProperties properties) {
        return builder -> builder.withDetail("service", Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description()));
    }

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> serviceMeterTags(WorkspaceServiceProperties properties) {
        return registry -> registry.config().commonTags(
                "service", properties.name(),
                "environment", properties.environment());
    }
}
