package com.company.forecasting.domain;

import com.company.forecasting.domain.enums.AnomalySeverity;
import com.company.forecasting.domain.enums.AnomalyType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

@Value
@Builder
public class AnomalyScore {
    Instant timestamp;
    double value;
    double baseline;
    double deviation;
    boolean anomaly;
    boolean lowConfidence;

    /** Null when no attached forecast covers the timestamp. */
    Boolean outsideForecastBounds;

    /** Forecast value for the timestamp, null when there is none. */
    Double predicted;

    AnomalySeverity severity;

    /** Rule behind the severity; null for normal observations. */
    AnomalyType type;

    /** Every rule that flagged the observation. */
    @Builder.Default
    Set<AnomalyType> triggeredRules = Set.of();
}
