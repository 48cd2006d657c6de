package com.example.stlabels.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация метрик Micrometer.
 */
@Configuration
public class MetricsConfig {

    /**
     * Общий тег application для всех метрик.
     */
    @Bean
    public MeterRegistryCustomizer<MeterRegistry> applicationTagCustomizer(
            @Value("${spring.application.name:st-labels}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }
}
