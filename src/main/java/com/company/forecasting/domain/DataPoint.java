package com.company.forecasting.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;
import java.util.Objects;

@Value
public class DataPoint {
    Instant timestamp;
    double value;

    @JsonCreator
    public DataPoint(@JsonProperty("timestamp") Instant timestamp,
                     @JsonProperty("value") double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.value = value;
    }

    public static DataPoint of(Instant timestamp, double value) {
        return new DataPoint(timestamp, value);
    }
}
