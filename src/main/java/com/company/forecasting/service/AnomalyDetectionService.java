package com.company.forecasting.service;

import com.company.forecasting.config.ForecastingProperties;
import com.company.forecasting.domain.AnomalyScore;
import com.company.forecasting.domain.ForecastResult;
import com.company.forecasting.domain.SeriesKey;
import com.company.forecasting.event.AnomalyDetectedEvent;
import com.company.forecasting.event.ForecastGeneratedEvent;
import com.company.forecasting.exception.ValidationException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps one {@link RollingAnomalyDetector} per live series.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnomalyDetectionService {

    private final ForecastingProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    private final ConcurrentMap<SeriesKey, RollingAnomalyDetector> detectors = new ConcurrentHashMap<>();

    public AnomalyScore observe(SeriesKey key, Instant timestamp, double value) {
        AnomalyScore score = detectorFor(key).observe(timestamp, value);

        if (score.isAnomaly()) {
            meterRegistry.counter("anomaly.detected",
                    "metric", key.getMetric(),
                    "severity", score.getSeverity().name(),
                    "type", score.getType().name()
            ).increment();
            log.debug("{} anomaly for {} at {}: value={} baseline={} deviation={} rules={}",
                    score.getType(), key, timestamp, value, score.getBaseline(), score.getDeviation(),
                    score.getTriggeredRules());
            eventPublisher.publishEvent(new AnomalyDetectedEvent(key, score));
        }
        return score;
    }

    /**
     * Score a finished stretch of observations against the values predicted for them. Runs on a
     * fresh window, so the live detector for the series is left alone and no events are published.
     *
     * @return the anomalous observations, in input order
     */
    public List<AnomalyScore> detectAnomalies(SeriesKey key, List<Instant> timestamps,
                                              double[] actual, double[] predicted) {
        if (timestamps.size() != actual.length || actual.length != predicted.length) {
            throw new ValidationException(key, "detectAnomalies", String.format(
                    "Length mismatch: %d timestamps, %d actual, %d predicted",
                    timestamps.size(), actual.length, predicted.length));
        }

        RollingAnomalyDetector detector = newDetector(key);
        List<AnomalyScore> anomalies = new ArrayList<>();
        for (int i = 0; i < actual.length; i++) {
            AnomalyScore score = detector.observe(timestamps.get(i), actual[i], predicted[i]);
            if (score.isAnomaly()) {
                anomalies.add(score);
            }
        }
        log.debug("Batch check for {} flagged {} of {} points", key, anomalies.size(), actual.length);
        return anomalies;
    }

    /**
     * Stop tracking a series and drop its window.
     *
     * @return true when the series was tracked
     */
    public boolean release(SeriesKey key) {
        boolean removed = detectors.remove(key) != null;
        if (removed) {
            log.info("Released anomaly detector for {}", key);
        }
        return removed;
    }

    public int trackedStreams() {
        return detectors.size();
    }

    @EventListener
    public void onForecastGenerated(ForecastGeneratedEvent event) {
        ForecastResult forecast = event.getForecast();
        detectorFor(forecast.getKey()).attachForecast(forecast);
        log.debug("Attached {} forecast points to anomaly detector for {}", forecast.size(), forecast.getKey());
    }

    private RollingAnomalyDetector detectorFor(SeriesKey key) {
        return detectors.computeIfAbsent(key, this::newDetector);
    }

    private RollingAnomalyDetector newDetector(SeriesKey key) {
        ForecastingProperties.Anomaly anomaly = properties.getAnomaly();
        return new RollingAnomalyDetector(key, anomaly.getWindowSize(), anomaly.rulesFor(key.getMetric()));
    }
}
