package com.company.forecasting.engine;

import com.company.forecasting.domain.AugmentedSeries;
import com.company.forecasting.domain.ForecastPoint;
import com.company.forecasting.domain.HyperparameterSet;
import com.company.forecasting.exception.TrainingFailedException;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Fits and evaluates a forecasting model. Implementations must be thread-safe:
 * the tuner calls {@link #fit} concurrently for different candidates.
 */
public interface ForecastingEngine {

    String name();

    /**
     * Smallest series the engine will fit.
     */
    int minimumTrainingPoints();

    /**
     * @throws TrainingFailedException when the series cannot be fitted with these parameters
     */
    FittedModel fit(AugmentedSeries series, HyperparameterSet params);

    /**
     * Point predictions with a symmetric interval at {@code confidenceLevel}, one per timestamp,
     * in the order given.
     */
    List<ForecastPoint> predict(FittedModel model, List<Instant> timestamps, double confidenceLevel);

    byte[] serialize(FittedModel model) throws IOException;

    FittedModel deserialize(byte[] bytes) throws IOException;
}
