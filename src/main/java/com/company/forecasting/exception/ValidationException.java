package com.company.forecasting.exception;

import com.company.forecasting.domain.SeriesKey;

public class ValidationException extends ForecastingException {
    public ValidationException(String operation, String message) {
        super(null, operation, message);
    }

    public ValidationException(SeriesKey key, String operation, String message) {
        super(key, operation, message);
    }
}
