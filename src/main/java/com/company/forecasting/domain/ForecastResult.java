package com.company.forecasting.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Value
@Builder
public class ForecastResult {
    SeriesKey key;
    Duration frequency;
    double confidenceLevel;
    @Singular
    List<ForecastPoint> points;

    public int size() {
        return points.size();
    }

    public Optional<Instant> lastTimestamp() {
        return points.isEmpty() ? Optional.empty() : Optional.of(points.get(points.size() - 1).getTimestamp());
    }
}
