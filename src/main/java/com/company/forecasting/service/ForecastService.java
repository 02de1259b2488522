package com.company.forecasting.service;

import com.company.forecasting.cache.ModelStore;
import com.company.forecasting.config.ForecastingProperties;
import com.company.forecasting.domain.AugmentedSeries;
import com.company.forecasting.domain.ForecastPoint;
import com.company.forecasting.domain.ForecastResult;
import com.company.forecasting.domain.HyperparameterGrid;
import com.company.forecasting.domain.MetricSeries;
import com.company.forecasting.domain.SeriesKey;
import com.company.forecasting.domain.TrainedModel;
import com.company.forecasting.domain.TuningResult;
import com.company.forecasting.domain.enums.ModelState;
import com.company.forecasting.event.ForecastGeneratedEvent;
import com.company.forecasting.event.ModelTrainedEvent;
import com.company.forecasting.exception.DataInsufficientException;
import com.company.forecasting.exception.ForecastingException;
import com.company.forecasting.exception.StorageUnavailableException;
import com.company.forecasting.exception.TrainingFailedException;
import com.company.forecasting.exception.TrainingInProgressException;
import com.company.forecasting.exception.TrainingTimeoutException;
import com.company.forecasting.exception.ValidationException;
import com.company.forecasting.repository.PredictionsSink;
import com.company.forecasting.repository.SeriesSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Entry point for model lifecycle and forecasting per series key.
 *
 * <p>A training run fetches the series, reuses the stored model when it already covers the
 * latest data, and otherwise tunes, trains and persists a new one. Runs execute on the training
 * pool with at most one in flight per key; concurrent callers for the same key share its result.
 */
@Service
@Slf4j
public class ForecastService {

    static final String MDC_SERIES_KEY = "seriesKey";

    private final SeriesSource seriesSource;
    private final FeatureAugmenter featureAugmenter;
    private final HyperparameterTuner tuner;
    private final ModelTrainer trainer;
    private final ModelStore modelStore;
    private final TrainingRegistry registry;
    private final PredictionsSink predictionsSink;
    private final HyperparameterGrid grid;
    private final Executor trainingExecutor;
    private final ApplicationEventPublisher eventPublisher;
    private final ForecastingProperties properties;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;

    public ForecastService(SeriesSource seriesSource,
                           FeatureAugmenter featureAugmenter,
                           HyperparameterTuner tuner,
                           ModelTrainer trainer,
                           ModelStore modelStore,
                           TrainingRegistry registry,
                           PredictionsSink predictionsSink,
                           HyperparameterGrid grid,
                           @Qualifier("trainingExecutor") Executor trainingExecutor,
                           ApplicationEventPublisher eventPublisher,
                           ForecastingProperties properties,
                           MeterRegistry meterRegistry,
                           Tracer tracer) {
        this.seriesSource = seriesSource;
        this.featureAugmenter = featureAugmenter;
        this.tuner = tuner;
        this.trainer = trainer;
        this.modelStore = modelStore;
        this.registry = registry;
        this.predictionsSink = predictionsSink;
        this.grid = grid;
        this.trainingExecutor = trainingExecutor;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.tracer = tracer;
    }

    /**
     * Train or reuse a model on the configured lookback window of the series source.
     */
    public TrainedModel trainOrLoad(SeriesKey key) {
        return trainOrLoad(key, () -> fetchSeries(key));
    }

    /**
     * Train or reuse a model on the series supplied by {@code seriesProvider}. The provider runs
     * on the training pool, once per run; callers that join an in-flight run do not invoke theirs.
     *
     * @throws DataInsufficientException when the series is shorter than the trainer minimum
     * @throws TrainingTimeoutException when the run does not finish within the training timeout
     */
    public TrainedModel trainOrLoad(SeriesKey key, Supplier<MetricSeries> seriesProvider) {
        return await(key, registry.joinOrStart(key, k -> startRun(k, seriesProvider)));
    }

    /**
     * Like {@link #trainOrLoad(SeriesKey)} but refuses to wait on a run that is already in flight.
     *
     * @throws TrainingInProgressException when another caller's run holds the key
     */
    public TrainedModel trainOrLoadNonBlocking(SeriesKey key) {
        CompletableFuture<TrainedModel> run = registry.startIfIdle(key, k -> startRun(k, () -> fetchSeries(k)))
                .orElseThrow(() -> new TrainingInProgressException(key));
        return await(key, run);
    }

    private CompletableFuture<TrainedModel> startRun(SeriesKey key, Supplier<MetricSeries> seriesProvider) {
        return CompletableFuture.supplyAsync(() -> runTraining(key, seriesProvider), trainingExecutor);
    }

    public ForecastResult predict(TrainedModel model, int horizon, Duration frequency) {
        if (horizon < 1) {
            throw new ValidationException(model.getKey(), "predict", "Horizon must be at least 1, got " + horizon);
        }
        if (frequency == null || frequency.isZero() || frequency.isNegative()) {
            throw new ValidationException(model.getKey(), "predict", "Frequency must be positive: " + frequency);
        }

        List<Instant> timestamps = new ArrayList<>(horizon);
        Instant cursor = model.getWindowEnd();
        for (int i = 1; i <= horizon; i++) {
            cursor = cursor.plus(frequency);
            timestamps.add(cursor);
        }

        List<ForecastPoint> points = trainer.predict(model, timestamps, properties.getConfidenceLevel());
        return ForecastResult.builder()
                .key(model.getKey())
                .frequency(frequency)
                .confidenceLevel(properties.getConfidenceLevel())
                .points(points)
                .build();
    }

    /**
     * Train or reuse, predict {@code horizon} steps, upsert the predictions and announce them.
     */
    public ForecastResult generateForecast(SeriesKey key, int horizon, Duration frequency) {
        TrainedModel model = trainOrLoad(key);
        ForecastResult result = predict(model, horizon, frequency);

        int written = predictionsSink.upsertPredictions(key, result);
        meterRegistry.counter("forecast.predictions.written").increment(written);
        log.info("Generated {} forecast points for {} ({} rows written)", result.size(), key, written);

        eventPublisher.publishEvent(new ForecastGeneratedEvent(result));
        return result;
    }

    /**
     * Drop the stored model so the next request retrains.
     */
    public void invalidate(SeriesKey key) {
        modelStore.delete(key);
        log.info("Invalidated stored model for {}", key);
    }

    public ModelState state(SeriesKey key) {
        if (registry.isTraining(key)) {
            return ModelState.TRAINING;
        }

        Optional<TrainedModel> stored = loadStored(key);
        if (stored.isEmpty()) {
            return ModelState.NO_MODEL;
        }

        Instant now = Instant.now();
        List<Instant> timestamps = seriesSource.findTimestamps(key, now.minus(properties.getLookback()), now);
        Instant latest = timestamps.isEmpty()
                ? stored.get().getWindowEnd()
                : timestamps.get(timestamps.size() - 1);
        return isCurrent(stored.get(), latest) ? ModelState.READY : ModelState.STALE;
    }

    private TrainedModel runTraining(SeriesKey key, Supplier<MetricSeries> seriesProvider) {
        MDC.put(MDC_SERIES_KEY, key.toString());
        Span span = tracer.spanBuilder("forecast.train")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "trained";

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("series.entity", key.getEntity());
            span.setAttribute("series.metric", key.getMetric());

            MetricSeries series = seriesProvider.get();
            if (series == null) {
                series = MetricSeries.empty(key);
            }

            int minimum = trainer.minimumPoints();
            if (series.size() < minimum) {
                throw new DataInsufficientException(key, minimum, series.size());
            }
            Instant latest = series.lastTimestamp().orElseThrow();

            Optional<TrainedModel> stored = loadStored(key);
            if (stored.isPresent() && isCurrent(stored.get(), latest)) {
                outcome = "reused";
                span.setAttribute("forecast.reused", true);
                log.info("Reusing stored model for {} trained at {}", key, stored.get().getTrainedAt());
                return stored.get();
            }

            AugmentedSeries augmented = featureAugmenter.augment(series);
            TuningResult tuning = tune(augmented);

            TrainedModel model = trainer.train(augmented, tuning.getBestParams()).toBuilder()
                    .tuned(!tuning.isSkipped())
                    .tuningEvaluation(tuning.getEvaluationType())
                    .build();

            boolean persisted = persist(key, model);
            span.setAttribute("forecast.points", model.getPointCount());
            span.setAttribute("forecast.persisted", persisted);

            log.info("Trained model for {} on {} points (tuned={}, in-sample mape={})",
                    key, model.getPointCount(), model.isTuned(), model.getQualityMetrics().getMape());

            eventPublisher.publishEvent(new ModelTrainedEvent(model, persisted));
            return model;

        } catch (RuntimeException e) {
            outcome = "failed";
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Training failed");
            meterRegistry.counter("forecast.training.failures",
                    "reason", e.getClass().getSimpleName()).increment();
            log.warn("Training failed for {}: {}", key, e.getMessage());
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("forecast.training.duration", "outcome", outcome));
            span.end();
            MDC.remove(MDC_SERIES_KEY);
        }
    }

    private TuningResult tune(AugmentedSeries augmented) {
        if (!properties.getTuning().isEnabled()) {
            return TuningResult.skipped(grid.getDefaultSet());
        }
        return tuner.tune(augmented, grid, properties.getTuning().getMinPointsForCv());
    }

    private boolean persist(SeriesKey key, TrainedModel model) {
        try {
            return modelStore.save(key, model);
        } catch (StorageUnavailableException e) {
            meterRegistry.counter("forecast.model_store.failures", "operation", "save").increment();
            log.warn("Could not persist model for {}, returning it unsaved: {}", key, e.getMessage());
            return false;
        }
    }

    private Optional<TrainedModel> loadStored(SeriesKey key) {
        try {
            return modelStore.load(key);
        } catch (StorageUnavailableException e) {
            meterRegistry.counter("forecast.model_store.failures", "operation", "load").increment();
            log.warn("Model store unavailable for {}, treating as cache miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isCurrent(TrainedModel model, Instant latestData) {
        if (model.getWindowEnd().isBefore(latestData) || model.getTrainedAt().isBefore(latestData)) {
            return false;
        }
        Duration maxAge = properties.getModelMaxAge();
        return maxAge == null || maxAge.isZero()
                || model.getTrainedAt().plus(maxAge).isAfter(Instant.now());
    }

    private MetricSeries fetchSeries(SeriesKey key) {
        Instant end = Instant.now();
        return seriesSource.getHistoricalSeries(key, end.minus(properties.getLookback()), end);
    }

    private TrainedModel await(SeriesKey key, CompletableFuture<TrainedModel> run) {
        Duration timeout = properties.getTrainingTimeout();
        try {
            return run.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            meterRegistry.counter("forecast.training.timeouts").increment();
            log.warn("Gave up waiting for training of {} after {}; the run continues in the background",
                    key, timeout);
            throw new TrainingTimeoutException(key, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrainingFailedException(key, "Interrupted while waiting for training", e);
        } catch (ExecutionException e) {
            throw unwrap(key, e.getCause());
        }
    }

    private static ForecastingException unwrap(SeriesKey key, Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ForecastingException forecastingException) {
            return forecastingException;
        }
        return new TrainingFailedException(key, "Unexpected training failure: " + cause, cause);
    }
}
