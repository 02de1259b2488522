package com.company.forecasting.exception;

import com.company.forecasting.domain.SeriesKey;

import java.time.Duration;

/**
 * The caller stopped waiting. The training run itself keeps going in the background.
 */
public class TrainingTimeoutException extends TrainingFailedException {
    public TrainingTimeoutException(SeriesKey key, Duration budget) {
        super(key, "Training did not complete within " + budget);
    }
}
