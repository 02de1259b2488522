package com.company.forecasting.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.company.forecasting.support.TestSeries.KEY;
import static com.company.forecasting.support.TestSeries.START;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MetricSeries")
class MetricSeriesTest {

    @Test
    @DisplayName("Sorts points and keeps the last value for duplicate timestamps")
    void normalizes() {
        // Given
        Instant t1 = START.plusSeconds(60);
        Instant t2 = START.plusSeconds(120);

        // When
        MetricSeries series = MetricSeries.of(KEY, List.of(
                DataPoint.of(t2, 3.0),
                DataPoint.of(START, 1.0),
                DataPoint.of(t1, 2.0),
                DataPoint.of(t2, 4.0)));

        // Then
        assertThat(series.timestamps()).containsExactly(START, t1, t2);
        assertThat(series.values()).containsExactly(1.0, 2.0, 4.0);
        assertThat(series.firstTimestamp()).contains(START);
        assertThat(series.lastTimestamp()).contains(t2);
    }

    @Test
    @DisplayName("Empty input gives an empty series")
    void empty() {
        MetricSeries series = MetricSeries.of(KEY, List.of());

        assertThat(series.isEmpty()).isTrue();
        assertThat(series.lastTimestamp()).isEmpty();
        assertThat(series).isEqualTo(MetricSeries.empty(KEY));
    }

    @Test
    @DisplayName("Slices keep the key")
    void slice() {
        MetricSeries series = MetricSeries.of(KEY, List.of(
                DataPoint.of(START, 1.0),
                DataPoint.of(START.plusSeconds(60), 2.0),
                DataPoint.of(START.plusSeconds(120), 3.0)));

        MetricSeries tail = series.slice(1, 3);

        assertThat(tail.getKey()).isEqualTo(KEY);
        assertThat(tail.values()).containsExactly(2.0, 3.0);
    }
}
