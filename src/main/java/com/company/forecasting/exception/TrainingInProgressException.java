package com.company.forecasting.exception;

import com.company.forecasting.domain.SeriesKey;

public class TrainingInProgressException extends ForecastingException {
    public TrainingInProgressException(SeriesKey key) {
        super(key, "train", "A training run is already in progress");
    }
}
