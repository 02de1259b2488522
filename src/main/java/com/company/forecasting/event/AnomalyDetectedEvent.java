package com.company.forecasting.event;

import com.company.forecasting.domain.AnomalyScore;
import com.company.forecasting.domain.SeriesKey;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AnomalyDetectedEvent {
    private final SeriesKey key;
    private final AnomalyScore score;
}
