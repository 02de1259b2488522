package com.company.forecasting.support;

import com.company.forecasting.domain.DataPoint;
import com.company.forecasting.domain.MetricSeries;
import com.company.forecasting.domain.SeriesKey;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

/**
 * Builders for synthetic metric series used across tests.
 */
public final class TestSeries {

    public static final SeriesKey KEY = SeriesKey.of("vm-01", "cpu.usage.average");
    public static final Instant START = Instant.parse("2024-03-04T00:00:00Z");
    public static final Duration HALF_HOUR = Duration.ofMinutes(30);

    private TestSeries() {
    }

    public static MetricSeries generate(SeriesKey key, Instant start, Duration step, int count,
                                        IntToDoubleFunction value) {
        List<DataPoint> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            points.add(DataPoint.of(start.plus(step.multipliedBy(i)), value.applyAsDouble(i)));
        }
        return MetricSeries.of(key, points);
    }

    /**
     * {@code 50 + 20 sin(2 pi h / 24)} sampled every 30 minutes, h in hours.
     */
    public static MetricSeries dailySine(int count) {
        return generate(KEY, START, HALF_HOUR, count,
                i -> 50.0 + 20.0 * Math.sin(2.0 * Math.PI * (i * 0.5) / 24.0));
    }

    public static MetricSeries linear(int count, double intercept, double slope) {
        return generate(KEY, START, HALF_HOUR, count, i -> intercept + slope * i);
    }

    public static List<Instant> timestamps(Instant start, Duration step, int count) {
        List<Instant> timestamps = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            timestamps.add(start.plus(step.multipliedBy(i)));
        }
        return timestamps;
    }
}
