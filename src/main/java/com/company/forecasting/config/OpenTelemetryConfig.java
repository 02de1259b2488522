package com.company.forecasting.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Tracing for training runs. Metrics go through Micrometer, so only the trace exporter is enabled.
 */
@Configuration
public class OpenTelemetryConfig {

    static final String INSTRUMENTATION_NAME = "com.company.forecasting";

    @Bean
    public OpenTelemetry openTelemetry(@Value("${spring.application.name:load-forecasting-service}") String serviceName) {
        // OTEL_* environment variables and system properties take precedence over these defaults
        return AutoConfiguredOpenTelemetrySdk.builder()
                .addPropertiesSupplier(() -> Map.of(
                        "otel.service.name", serviceName,
                        "otel.metrics.exporter", "none",
                        "otel.logs.exporter", "none"))
                .build()
                .getOpenTelemetrySdk();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME);
    }
}
