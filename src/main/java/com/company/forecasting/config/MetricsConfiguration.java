package com.company.forecasting.config;

import com.company.forecasting.service.AnomalyDetectionService;
import com.company.forecasting.service.TrainingRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final TrainingRegistry trainingRegistry;
    private final AnomalyDetectionService anomalyDetectionService;

    @Bean
    public MeterBinder forecastingMetrics() {
        return (registry) -> {
            Gauge.builder("forecast.training.in_flight", trainingRegistry, TrainingRegistry::size)
                    .description("Training runs currently in flight")
                    .register(registry);

            Gauge.builder("anomaly.streams.tracked", anomalyDetectionService,
                            AnomalyDetectionService::trackedStreams)
                    .description("Series with a live anomaly window")
                    .register(registry);

            log.info("Forecasting metrics registered");
        };
    }
}
