package com.company.forecasting.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Thresholds one series is checked against. A null critical level, rate-of-change limit or
 * prediction-error limit disables that rule.
 */
@Value
@Builder(toBuilder = true)
public class AnomalyRules {

    /** Z-score above which a value is anomalous. */
    double threshold;

    /** Window points required before the z-score rule may flag. */
    @Builder.Default
    int minPoints = 1;

    Double criticalLevel;

    /** Largest absolute change from the previous value that is still normal. */
    Double rateOfChange;

    /** Changes above this are HIGH rather than MEDIUM. */
    @Builder.Default
    double rateOfChangeHigh = 30.0;

    /** Relative error against the forecast value, in percent, that flags an observation. */
    @Builder.Default
    Double predictionErrorPercent = 30.0;

    @Builder.Default
    double predictionErrorHighPercent = 50.0;

    public static AnomalyRules zScoreOnly(double threshold) {
        return AnomalyRules.builder()
                .threshold(threshold)
                .predictionErrorPercent(null)
                .build();
    }
}
