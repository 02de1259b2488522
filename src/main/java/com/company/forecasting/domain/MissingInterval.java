package com.company.forecasting.domain;

import lombok.Value;

import java.time.Instant;

/**
 * Inclusive span of expected sample slots with no data.
 */
@Value
public class MissingInterval {
    Instant start;
    Instant end;
    long missingPoints;
}
