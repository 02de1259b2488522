package com.company.forecasting.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

@Value
public class TrainingWindow {
    Instant start;
    Instant end;

    @JsonCreator
    public TrainingWindow(@JsonProperty("start") Instant start,
                          @JsonProperty("end") Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Training window bounds are required");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Training window end " + end + " is before start " + start);
        }
        this.start = start;
        this.end = end;
    }

    public static TrainingWindow of(MetricSeries series) {
        return new TrainingWindow(
                series.firstTimestamp().orElseThrow(() -> new IllegalArgumentException("Series is empty")),
                series.lastTimestamp().orElseThrow());
    }
}
