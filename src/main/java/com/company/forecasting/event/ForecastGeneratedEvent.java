package com.company.forecasting.event;

import com.company.forecasting.domain.ForecastResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ForecastGeneratedEvent {
    private final ForecastResult forecast;
}
