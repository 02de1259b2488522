package com.company.forecasting.domain.enums;

/**
 * Rule that flagged an observation. Declaration order breaks ties between rules of equal severity.
 */
public enum AnomalyType {
    /** Value at or above the metric's critical level. */
    CRITICAL_LEVEL,
    /** Too many standard deviations from the rolling mean. */
    Z_SCORE,
    /** Too far, relative to the prediction, from the forecast value. */
    PREDICTION_ERROR,
    /** Jump from the previous observation beyond the metric's limit. */
    RATE_OF_CHANGE,
    /** Outside the forecast's confidence interval. */
    FORECAST_BOUNDS
}
