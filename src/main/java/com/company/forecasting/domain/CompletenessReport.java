package com.company.forecasting.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class CompletenessReport {
    Instant rangeStart;
    Instant rangeEnd;
    Duration expectedInterval;
    long expectedPoints;
    long actualPoints;
    long missingPoints;
    double completenessPercentage;
    List<MissingInterval> missingIntervals;

    public boolean isComplete() {
        return missingIntervals.isEmpty() && missingPoints == 0;
    }
}
