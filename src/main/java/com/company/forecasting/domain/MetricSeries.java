package com.company.forecasting.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.*;

/**
 * Ordered samples of one (entity, metric) key.
 * Construction normalizes the input: points are sorted by timestamp and duplicate
 * timestamps collapse to the last one supplied. Instances are immutable.
 */
@Getter
@EqualsAndHashCode
@ToString(of = {"key", "points"})
public final class MetricSeries {

    private final SeriesKey key;
    private final List<DataPoint> points;

    private MetricSeries(SeriesKey key, List<DataPoint> points) {
        this.key = key;
        this.points = points;
    }

    public static MetricSeries of(SeriesKey key, Collection<DataPoint> rawPoints) {
        Objects.requireNonNull(key, "key");
        if (rawPoints == null || rawPoints.isEmpty()) {
            return empty(key);
        }

        // Last write wins for duplicate timestamps
        Map<Instant, DataPoint> byTimestamp = new TreeMap<>();
        for (DataPoint point : rawPoints) {
            byTimestamp.put(point.getTimestamp(), point);
        }

        return new MetricSeries(key, List.copyOf(byTimestamp.values()));
    }

    public static MetricSeries empty(SeriesKey key) {
        return new MetricSeries(Objects.requireNonNull(key, "key"), List.of());
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public DataPoint get(int index) {
        return points.get(index);
    }

    public Optional<Instant> firstTimestamp() {
        return isEmpty() ? Optional.empty() : Optional.of(points.get(0).getTimestamp());
    }

    public Optional<Instant> lastTimestamp() {
        return isEmpty() ? Optional.empty() : Optional.of(points.get(points.size() - 1).getTimestamp());
    }

    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    public List<Instant> timestamps() {
        List<Instant> timestamps = new ArrayList<>(points.size());
        for (DataPoint point : points) {
            timestamps.add(point.getTimestamp());
        }
        return timestamps;
    }

    /**
     * Points in {@code [fromIndex, toIndex)} as a new series.
     */
    public MetricSeries slice(int fromIndex, int toIndex) {
        return new MetricSeries(key, List.copyOf(points.subList(fromIndex, toIndex)));
    }
}
