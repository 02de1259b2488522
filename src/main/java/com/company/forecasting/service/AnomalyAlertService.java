package com.company.forecasting.service;

import com.company.forecasting.domain.AnomalyScore;
import com.company.forecasting.domain.enums.AnomalySeverity;
import com.company.forecasting.event.AnomalyDetectedEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class AnomalyAlertService {

    private final MeterRegistry meterRegistry;

    @EventListener
    @Async
    public void handleAnomalyDetected(AnomalyDetectedEvent event) {
        AnomalyScore score = event.getScore();
        AnomalySeverity severity = score.getSeverity();

        String message = String.format("%s %s anomaly for %s at %s: value=%.2f baseline=%.2f deviation=%.2f%s",
                severity, score.getType(), event.getKey(), score.getTimestamp(), score.getValue(), score.getBaseline(),
                score.getDeviation(), Boolean.TRUE.equals(score.getOutsideForecastBounds())
                        ? " (outside forecast interval)" : "");

        if (severity == AnomalySeverity.CRITICAL || severity == AnomalySeverity.HIGH) {
            log.warn(message);
        } else {
            log.info(message);
        }

        meterRegistry.counter("anomaly.alerts",
                "entity", event.getKey().getEntity(),
                "severity", severity.name()
        ).increment();
    }
}
