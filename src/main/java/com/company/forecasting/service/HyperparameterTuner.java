package com.company.forecasting.service;

import com.company.forecasting.config.ForecastingProperties;
import com.company.forecasting.domain.AugmentedSeries;
import com.company.forecasting.domain.ForecastPoint;
import com.company.forecasting.domain.HyperparameterGrid;
import com.company.forecasting.domain.HyperparameterSet;
import com.company.forecasting.domain.TrainedModel;
import com.company.forecasting.domain.TuningResult;
import com.company.forecasting.domain.enums.EvaluationType;
import com.company.forecasting.exception.ForecastingException;
import com.company.forecasting.exception.TrainingFailedException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Grid search over hyperparameter sets scored by out-of-sample MAPE.
 *
 * <p>Large series use expanding-window cross-validation, small ones a single chronological
 * holdout. Candidates are evaluated in parallel but selected in grid order, so the outcome
 * does not depend on completion order.
 */
@Service
@Slf4j
public class HyperparameterTuner {

    private final ModelTrainer trainer;
    private final QualityEvaluator qualityEvaluator;
    private final Executor tuningExecutor;
    private final MeterRegistry meterRegistry;
    private final int cvFolds;
    private final double holdoutFraction;
    private final double confidenceLevel;

    public HyperparameterTuner(ModelTrainer trainer,
                               QualityEvaluator qualityEvaluator,
                               @Qualifier("tuningExecutor") Executor tuningExecutor,
                               MeterRegistry meterRegistry,
                               ForecastingProperties properties) {
        this.trainer = trainer;
        this.qualityEvaluator = qualityEvaluator;
        this.tuningExecutor = tuningExecutor;
        this.meterRegistry = meterRegistry;
        this.cvFolds = properties.getTuning().getCvFolds();
        this.holdoutFraction = properties.getTuning().getHoldoutFraction();
        this.confidenceLevel = properties.getConfidenceLevel();

        if (cvFolds < 1) {
            throw new IllegalArgumentException("cv-folds must be at least 1: " + cvFolds);
        }
        if (!(holdoutFraction > 0.0 && holdoutFraction < 1.0)) {
            throw new IllegalArgumentException("holdout-fraction must be in (0, 1): " + holdoutFraction);
        }
    }

    public TuningResult tune(AugmentedSeries series, HyperparameterGrid grid, int minPointsForCv) {
        int n = series.size();
        EvaluationType evaluationType;
        List<Fold> folds;

        if (n >= minPointsForCv) {
            evaluationType = EvaluationType.CROSS_VALIDATION;
            folds = crossValidationFolds(n);
        } else {
            evaluationType = EvaluationType.HOLDOUT;
            int holdout = (int) Math.floor(n * holdoutFraction);
            if (holdout < 2) {
                log.info("Skipping tuning for {}: holdout of {} points is too small", series.getKey(), holdout);
                return TuningResult.skipped(grid.getDefaultSet());
            }
            folds = List.of(new Fold(n - holdout, n));
        }

        if (folds.get(0).getTrainEnd() < trainer.minimumPoints()) {
            log.info("Skipping tuning for {}: training part of {} points is below the minimum of {}",
                    series.getKey(), folds.get(0).getTrainEnd(), trainer.minimumPoints());
            return TuningResult.skipped(grid.getDefaultSet());
        }

        log.info("Tuning {} over {} candidates using {} ({} folds, {} points)",
                series.getKey(), grid.size(), evaluationType, folds.size(), n);

        Timer.Sample sample = Timer.start(meterRegistry);

        List<CompletableFuture<CandidateScore>> futures = new ArrayList<>(grid.size());
        for (int i = 0; i < grid.size(); i++) {
            HyperparameterSet candidate = grid.get(i);
            futures.add(CompletableFuture.supplyAsync(
                    () -> scoreCandidate(series, candidate, folds), tuningExecutor));
        }

        CandidateScore best = null;
        int bestIndex = -1;
        int failed = 0;
        for (int i = 0; i < futures.size(); i++) {
            CandidateScore score = futures.get(i).join();
            if (score.isFailed()) {
                failed++;
                continue;
            }
            if (best == null || isBetter(score.getScore(), best.getScore())) {
                best = score;
                bestIndex = i;
            }
        }

        sample.stop(meterRegistry.timer("forecast.tuning.duration", "evaluation", evaluationType.name()));
        meterRegistry.counter("forecast.tuning.candidates.failed").increment(failed);

        if (best == null) {
            throw new TrainingFailedException(series.getKey(),
                    "All " + grid.size() + " hyperparameter candidates failed");
        }

        log.info("Selected candidate {} of {} for {} (score={}, failed={}): {}",
                bestIndex, grid.size(), series.getKey(),
                best.getScore().isPresent() ? best.getScore().getAsDouble() : "n/a",
                failed, grid.get(bestIndex).describe());

        return TuningResult.builder()
                .bestParams(grid.get(bestIndex))
                .bestScore(best.getScore())
                .evaluationType(evaluationType)
                .skipped(false)
                .candidatesEvaluated(grid.size())
                .candidatesFailed(failed)
                .build();
    }

    /**
     * Expanding window: fold {@code i} trains on {@code [0, n - (k - i) * h)} and validates on
     * the following {@code h} points.
     */
    List<Fold> crossValidationFolds(int n) {
        int horizon = Math.max(2, (int) Math.floor(n * holdoutFraction / cvFolds));
        List<Fold> folds = new ArrayList<>(cvFolds);
        for (int i = 0; i < cvFolds; i++) {
            int trainEnd = n - (cvFolds - i) * horizon;
            folds.add(new Fold(trainEnd, trainEnd + horizon));
        }
        return folds;
    }

    private CandidateScore scoreCandidate(AugmentedSeries series, HyperparameterSet candidate, List<Fold> folds) {
        double sum = 0.0;
        int computable = 0;

        try {
            for (Fold fold : folds) {
                if (fold.getTrainEnd() <= 0) {
                    return CandidateScore.failed();
                }
                TrainedModel model = trainer.train(series.slice(0, fold.getTrainEnd()), candidate);

                AugmentedSeries validation = series.slice(fold.getTrainEnd(), fold.getValidationEnd());
                List<Instant> timestamps = validation.getSeries().timestamps();
                List<ForecastPoint> predictions = trainer.predict(model, timestamps, confidenceLevel);

                double[] predicted = new double[predictions.size()];
                for (int i = 0; i < predicted.length; i++) {
                    predicted[i] = predictions.get(i).getPredicted();
                }

                OptionalDouble mape = qualityEvaluator.mape(validation.getSeries().values(), predicted);
                if (mape.isPresent()) {
                    sum += mape.getAsDouble();
                    computable++;
                }
            }
        } catch (ForecastingException e) {
            log.debug("Candidate failed for {}: {} ({})", series.getKey(), candidate.describe(), e.getMessage());
            return CandidateScore.failed();
        } catch (RuntimeException e) {
            log.warn("Candidate raised an unexpected error for {}: {}", series.getKey(), candidate.describe(), e);
            return CandidateScore.failed();
        }

        return computable == 0
                ? CandidateScore.of(OptionalDouble.empty())
                : CandidateScore.of(OptionalDouble.of(sum / computable));
    }

    // Strictly lower wins; a computable score beats a missing one
    private static boolean isBetter(OptionalDouble candidate, OptionalDouble incumbent) {
        if (candidate.isEmpty()) {
            return false;
        }
        return incumbent.isEmpty() || candidate.getAsDouble() < incumbent.getAsDouble();
    }

    @Value
    static class Fold {
        int trainEnd;
        int validationEnd;
    }

    @Value
    private static class CandidateScore {
        OptionalDouble score;
        boolean failed;

        static CandidateScore of(OptionalDouble score) {
            return new CandidateScore(score, false);
        }

        static CandidateScore failed() {
            return new CandidateScore(OptionalDouble.empty(), true);
        }
    }
}
