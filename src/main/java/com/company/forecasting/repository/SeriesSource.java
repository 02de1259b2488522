package com.company.forecasting.repository;

import com.company.forecasting.domain.MetricSeries;
import com.company.forecasting.domain.SeriesKey;

import java.time.Instant;
import java.util.List;

/**
 * Read-only access to the raw metric samples.
 */
public interface SeriesSource {

    /**
     * Samples with {@code start <= timestamp <= end}, normalized. Empty series when there are none.
     */
    MetricSeries getHistoricalSeries(SeriesKey key, Instant start, Instant end);

    List<Instant> findTimestamps(SeriesKey key, Instant start, Instant end);

    /**
     * Every (entity, metric) pair that has samples.
     */
    List<SeriesKey> findTrackedKeys();
}
