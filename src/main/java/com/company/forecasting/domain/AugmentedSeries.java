package com.company.forecasting.domain;

import lombok.Getter;

import java.util.List;

/**
 * A metric series with one row of calendar regressors per point.
 * Recomputable from the series alone, so it is never persisted.
 */
@Getter
public final class AugmentedSeries {

    private final MetricSeries series;
    private final List<CalendarFeatures> features;

    public AugmentedSeries(MetricSeries series, List<CalendarFeatures> features) {
        if (series.size() != features.size()) {
            throw new IllegalArgumentException(String.format(
                    "Feature rows (%d) do not match series points (%d)", features.size(), series.size()));
        }
        this.series = series;
        this.features = List.copyOf(features);
    }

    public SeriesKey getKey() {
        return series.getKey();
    }

    public int size() {
        return series.size();
    }

    public AugmentedSeries slice(int fromIndex, int toIndex) {
        return new AugmentedSeries(series.slice(fromIndex, toIndex), features.subList(fromIndex, toIndex));
    }
}
