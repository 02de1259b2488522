package com.company.forecasting.exception;

import com.company.forecasting.domain.SeriesKey;
import lombok.Getter;

/**
 * Base type for every failure raised by the forecasting core.
 * Carries the series key (when one applies) and the operation that failed.
 */
@Getter
public class ForecastingException extends RuntimeException {

    private final SeriesKey key;
    private final String operation;

    public ForecastingException(SeriesKey key, String operation, String message) {
        super(format(key, operation, message));
        this.key = key;
        this.operation = operation;
    }

    public ForecastingException(SeriesKey key, String operation, String message, Throwable cause) {
        super(format(key, operation, message), cause);
        this.key = key;
        this.operation = operation;
    }

    private static String format(SeriesKey key, String operation, String message) {
        return key == null
                ? operation + ": " + message
                : operation + " [" + key + "]: " + message;
    }
}
