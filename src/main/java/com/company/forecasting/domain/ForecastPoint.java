package com.company.forecasting.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

@Value
public class ForecastPoint {
    Instant timestamp;
    double predicted;
    double lower;
    double upper;

    @JsonCreator
    public ForecastPoint(@JsonProperty("timestamp") Instant timestamp,
                         @JsonProperty("predicted") double predicted,
                         @JsonProperty("lower") double lower,
                         @JsonProperty("upper") double upper) {
        this.timestamp = timestamp;
        this.predicted = predicted;
        this.lower = lower;
        this.upper = upper;
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }
}
