package com.company.forecasting.service;

import com.company.forecasting.domain.AnomalyRules;
import com.company.forecasting.domain.AnomalyScore;
import com.company.forecasting.domain.ForecastPoint;
import com.company.forecasting.domain.ForecastResult;
import com.company.forecasting.domain.SeriesKey;
import com.company.forecasting.domain.enums.AnomalySeverity;
import com.company.forecasting.domain.enums.AnomalyType;
import com.company.forecasting.exception.ValidationException;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Anomaly detector over the last {@code windowSize} observations of one series.
 *
 * <p>Each value is scored against the window as it was before the value arrived, then added.
 * Mean and variance come from running sums, so an observation costs O(1). The sums are
 * rebuilt from the buffer once per full rotation to keep rounding error bounded.
 *
 * <p>Besides the z-score, an observation is checked against the metric's critical level, its
 * change from the previous value, and the attached forecast's value and interval. The most
 * severe of the rules that fire sets the score's severity and type.
 */
public class RollingAnomalyDetector {

    private static final double ZERO_VARIANCE_EPSILON = 1e-12;

    @Getter
    private final SeriesKey key;
    @Getter
    private final int windowSize;
    @Getter
    private final AnomalyRules rules;

    private final double[] buffer;
    private int next;
    private int count;
    private double sum;
    private double sumSquares;
    private Instant lastTimestamp;

    private NavigableMap<Instant, ForecastPoint> forecast = new TreeMap<>();
    private Duration forecastFrequency;

    public RollingAnomalyDetector(SeriesKey key, int windowSize, double threshold) {
        this(key, windowSize, AnomalyRules.zScoreOnly(threshold));
    }

    public RollingAnomalyDetector(SeriesKey key, int windowSize, AnomalyRules rules) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Window size must be positive: " + windowSize);
        }
        if (!(rules.getThreshold() > 0.0)) {
            throw new IllegalArgumentException("Threshold must be positive: " + rules.getThreshold());
        }
        this.key = key;
        this.windowSize = windowSize;
        this.rules = rules;
        this.buffer = new double[windowSize];
    }

    public synchronized AnomalyScore observe(Instant timestamp, double value) {
        ForecastPoint covering = forecastPointAt(timestamp);
        if (covering == null) {
            return score(timestamp, value, null, null);
        }
        return score(timestamp, value, covering.getPredicted(), !covering.contains(value));
    }

    /**
     * Score against an explicit prediction instead of the attached forecast.
     */
    synchronized AnomalyScore observe(Instant timestamp, double value, double predicted) {
        return score(timestamp, value, predicted, null);
    }

    private AnomalyScore score(Instant timestamp, double value, Double predicted, Boolean outsideBounds) {
        if (timestamp == null) {
            throw new ValidationException(key, "observe", "Timestamp is required");
        }
        if (!Double.isFinite(value)) {
            throw new ValidationException(key, "observe", "Non-finite value " + value + " at " + timestamp);
        }
        if (lastTimestamp != null && !timestamp.isAfter(lastTimestamp)) {
            throw new ValidationException(key, "observe",
                    "Timestamp " + timestamp + " is not after previous observation " + lastTimestamp);
        }

        double baseline;
        double deviation;
        if (count == 0) {
            baseline = value;
            deviation = 0.0;
        } else {
            baseline = sum / count;
            double stdDev = Math.sqrt(variance());
            double difference = value - baseline;
            if (stdDev <= ZERO_VARIANCE_EPSILON * Math.max(1.0, Math.abs(baseline))) {
                if (Math.abs(difference) <= ZERO_VARIANCE_EPSILON * Math.max(1.0, Math.abs(baseline))) {
                    deviation = 0.0;
                } else {
                    deviation = difference > 0 ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
                }
            } else {
                deviation = difference / stdDev;
            }
        }

        Map<AnomalyType, AnomalySeverity> triggered = new EnumMap<>(AnomalyType.class);
        checkCriticalLevel(value, triggered);
        if (count >= rules.getMinPoints() && Math.abs(deviation) > rules.getThreshold()) {
            triggered.put(AnomalyType.Z_SCORE, atLeastMedium(AnomalySeverity.fromDeviation(deviation)));
        }
        checkPredictionError(value, predicted, triggered);
        checkRateOfChange(value, triggered);
        if (Boolean.TRUE.equals(outsideBounds)) {
            triggered.put(AnomalyType.FORECAST_BOUNDS, AnomalySeverity.MEDIUM);
        }

        AnomalySeverity severity = AnomalySeverity.fromDeviation(deviation);
        AnomalyType type = null;
        if (!triggered.isEmpty()) {
            severity = AnomalySeverity.LOW;
            for (Map.Entry<AnomalyType, AnomalySeverity> rule : triggered.entrySet()) {
                if (type == null || rule.getValue().compareTo(severity) > 0) {
                    type = rule.getKey();
                    severity = rule.getValue();
                }
            }
        }

        AnomalyScore score = AnomalyScore.builder()
                .timestamp(timestamp)
                .value(value)
                .baseline(baseline)
                .deviation(deviation)
                .anomaly(!triggered.isEmpty())
                .lowConfidence(count < windowSize)
                .outsideForecastBounds(outsideBounds)
                .predicted(predicted)
                .severity(severity)
                .type(type)
                .triggeredRules(triggered.isEmpty()
                        ? Collections.emptySet()
                        : Collections.unmodifiableSet(EnumSet.copyOf(triggered.keySet())))
                .build();

        add(value);
        lastTimestamp = timestamp;
        return score;
    }

    /**
     * Replace the forecast used for interval checks.
     */
    public synchronized void attachForecast(ForecastResult result) {
        NavigableMap<Instant, ForecastPoint> points = new TreeMap<>();
        for (ForecastPoint point : result.getPoints()) {
            points.put(point.getTimestamp(), point);
        }
        this.forecast = points;
        this.forecastFrequency = result.getFrequency();
    }

    public synchronized int size() {
        return count;
    }

    public synchronized double mean() {
        return count == 0 ? 0.0 : sum / count;
    }

    public synchronized double stdDev() {
        return count == 0 ? 0.0 : Math.sqrt(variance());
    }

    /**
     * Window contents, oldest first.
     */
    public synchronized double[] windowValues() {
        double[] values = new double[count];
        int oldest = (next - count + windowSize) % windowSize;
        for (int i = 0; i < count; i++) {
            values[i] = buffer[(oldest + i) % windowSize];
        }
        return values;
    }

    private double variance() {
        double mean = sum / count;
        return Math.max(0.0, sumSquares / count - mean * mean);
    }

    private void add(double value) {
        if (count == windowSize) {
            double evicted = buffer[next];
            sum -= evicted;
            sumSquares -= evicted * evicted;
        } else {
            count++;
        }
        buffer[next] = value;
        sum += value;
        sumSquares += value * value;
        next = (next + 1) % windowSize;

        if (next == 0 && count == windowSize) {
            recomputeSums();
        }
    }

    private void recomputeSums() {
        double freshSum = 0.0;
        double freshSquares = 0.0;
        for (double value : buffer) {
            freshSum += value;
            freshSquares += value * value;
        }
        sum = freshSum;
        sumSquares = freshSquares;
    }

    private void checkCriticalLevel(double value, Map<AnomalyType, AnomalySeverity> triggered) {
        Double criticalLevel = rules.getCriticalLevel();
        if (criticalLevel != null && value >= criticalLevel) {
            triggered.put(AnomalyType.CRITICAL_LEVEL, AnomalySeverity.CRITICAL);
        }
    }

    private void checkPredictionError(double value, Double predicted, Map<AnomalyType, AnomalySeverity> triggered) {
        Double limit = rules.getPredictionErrorPercent();
        // Relative error is undefined for a zero prediction
        if (limit == null || predicted == null || predicted <= 0.0) {
            return;
        }
        double errorPercent = Math.abs(value - predicted) * 100.0 / predicted;
        if (errorPercent > limit) {
            triggered.put(AnomalyType.PREDICTION_ERROR, errorPercent > rules.getPredictionErrorHighPercent()
                    ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM);
        }
    }

    private void checkRateOfChange(double value, Map<AnomalyType, AnomalySeverity> triggered) {
        Double limit = rules.getRateOfChange();
        if (limit == null || count == 0) {
            return;
        }
        double change = Math.abs(value - buffer[(next - 1 + windowSize) % windowSize]);
        if (change > limit) {
            triggered.put(AnomalyType.RATE_OF_CHANGE, change > rules.getRateOfChangeHigh()
                    ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM);
        }
    }

    private static AnomalySeverity atLeastMedium(AnomalySeverity severity) {
        return severity == AnomalySeverity.LOW ? AnomalySeverity.MEDIUM : severity;
    }

    private ForecastPoint forecastPointAt(Instant timestamp) {
        if (timestamp == null || forecast.isEmpty() || forecastFrequency == null) {
            return null;
        }
        Map.Entry<Instant, ForecastPoint> entry = forecast.floorEntry(timestamp);
        if (entry == null || Duration.between(entry.getKey(), timestamp).compareTo(forecastFrequency) >= 0) {
            return null;
        }
        return entry.getValue();
    }
}
