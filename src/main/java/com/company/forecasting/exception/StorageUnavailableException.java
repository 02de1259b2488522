package com.company.forecasting.exception;

import com.company.forecasting.domain.SeriesKey;

public class StorageUnavailableException extends ForecastingException {
    public StorageUnavailableException(SeriesKey key, String operation, Throwable cause) {
        super(key, operation, "Model storage unavailable: " + (cause == null ? "unknown" : cause.getMessage()), cause);
    }

    public StorageUnavailableException(SeriesKey key, String operation, String message) {
        super(key, operation, message);
    }
}
