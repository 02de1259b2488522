package com.company.forecasting.domain;

import com.company.forecasting.domain.enums.EvaluationType;
import com.company.forecasting.engine.FittedModel;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A fitted engine model together with the metadata needed to decide whether it is still current.
 */
@Value
@Builder(toBuilder = true)
public class TrainedModel {
    SeriesKey key;
    FittedModel fittedModel;
    String engineName;
    HyperparameterSet hyperparameters;
    Instant trainedAt;
    TrainingWindow trainingWindow;
    int pointCount;
    QualityMetrics qualityMetrics;
    boolean tuned;
    EvaluationType tuningEvaluation;

    public Instant getWindowEnd() {
        return trainingWindow.getEnd();
    }
}
