package com.company.forecasting.exception;

import com.company.forecasting.domain.SeriesKey;

public class TrainingFailedException extends ForecastingException {
    public TrainingFailedException(SeriesKey key, String message) {
        super(key, "train", message);
    }

    public TrainingFailedException(SeriesKey key, String message, Throwable cause) {
        super(key, "train", message, cause);
    }
}
