package com.company.forecasting.service;

import com.company.forecasting.config.ForecastingProperties;
import com.company.forecasting.domain.AugmentedSeries;
import com.company.forecasting.domain.ForecastPoint;
import com.company.forecasting.domain.HyperparameterSet;
import com.company.forecasting.domain.QualityMetrics;
import com.company.forecasting.domain.TrainedModel;
import com.company.forecasting.domain.TrainingWindow;
import com.company.forecasting.domain.enums.EvaluationType;
import com.company.forecasting.engine.FittedModel;
import com.company.forecasting.engine.ForecastingEngine;
import com.company.forecasting.exception.TrainingFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Fits one model for one hyperparameter set. Blocking; callers decide which thread it runs on.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ModelTrainer {

    private final ForecastingEngine engine;
    private final QualityEvaluator qualityEvaluator;
    private final ForecastingProperties properties;

    public int minimumPoints() {
        return Math.max(properties.getTraining().getMinPoints(), engine.minimumTrainingPoints());
    }

    public String engineName() {
        return engine.name();
    }

    public TrainedModel train(AugmentedSeries series, HyperparameterSet params) {
        int n = series.size();
        if (n < minimumPoints()) {
            throw new TrainingFailedException(series.getKey(),
                    String.format("Need at least %d points to train, got %d", minimumPoints(), n));
        }

        double[] values = series.getSeries().values();
        if (isConstant(values)) {
            throw new TrainingFailedException(series.getKey(), "Series is constant (value " + values[0] + ")");
        }

        FittedModel fitted = engine.fit(series, params);

        List<ForecastPoint> inSample = engine.predict(fitted, series.getSeries().timestamps(),
                properties.getConfidenceLevel());
        QualityMetrics metrics = qualityEvaluator.evaluate(values, inSample, EvaluationType.IN_SAMPLE);

        log.debug("Trained {} on {} points for {}: mape={} rmse={}",
                engine.name(), n, series.getKey(), metrics.getMape(), metrics.getRmse());

        return TrainedModel.builder()
                .key(series.getKey())
                .fittedModel(fitted)
                .engineName(engine.name())
                .hyperparameters(params)
                .trainedAt(Instant.now())
                .trainingWindow(TrainingWindow.of(series.getSeries()))
                .pointCount(n)
                .qualityMetrics(metrics)
                .tuned(false)
                .tuningEvaluation(EvaluationType.SKIPPED)
                .build();
    }

    public List<ForecastPoint> predict(TrainedModel model, List<Instant> timestamps, double confidenceLevel) {
        return engine.predict(model.getFittedModel(), timestamps, confidenceLevel);
    }

    private static boolean isConstant(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (values[i] != values[0]) {
                return false;
            }
        }
        return true;
    }
}
