package com.company.forecasting.repository;

import com.company.forecasting.domain.ForecastResult;
import com.company.forecasting.domain.SeriesKey;

public interface PredictionsSink {

    /**
     * Insert or replace one row per forecast point, keyed by (entity, metric, timestamp).
     *
     * @return number of rows written
     */
    int upsertPredictions(SeriesKey key, ForecastResult result);
}
