package com.company.forecasting.event;

import com.company.forecasting.domain.TrainedModel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ModelTrainedEvent {
    private final TrainedModel model;
    private final boolean persisted;
}
