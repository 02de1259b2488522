package com.company.forecasting.service;

import com.company.forecasting.cache.ModelStore;
import com.company.forecasting.config.ForecastingProperties;
import com.company.forecasting.domain.ForecastPoint;
import com.company.forecasting.domain.ForecastResult;
import com.company.forecasting.domain.HyperparameterGrid;
import com.company.forecasting.domain.HyperparameterSet;
import com.company.forecasting.domain.MetricSeries;
import com.company.forecasting.domain.SeriesKey;
import com.company.forecasting.domain.TrainedModel;
import com.company.forecasting.domain.TuningResult;
import com.company.forecasting.domain.enums.EvaluationType;
import com.company.forecasting.domain.enums.ModelState;
import com.company.forecasting.event.ForecastGeneratedEvent;
import com.company.forecasting.event.ModelTrainedEvent;
import com.company.forecasting.exception.DataInsufficientException;
import com.company.forecasting.exception.TrainingInProgressException;
import com.company.forecasting.exception.TrainingTimeoutException;
import com.company.forecasting.exception.ValidationException;
import com.company.forecasting.repository.PredictionsSink;
import com.company.forecasting.repository.SeriesSource;
import com.company.forecasting.support.InMemoryModelBlobStorage;
import com.company.forecasting.support.StubForecastingEngine;
import com.company.forecasting.support.TestSeries;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static com.company.forecasting.support.TestSeries.HALF_HOUR;
import static com.company.forecasting.support.TestSeries.KEY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ForecastService")
class ForecastServiceTest {

    private static final SeriesKey OTHER_KEY = SeriesKey.of("vm-02", "memory.usage.average");

    @Mock
    private SeriesSource seriesSource;

    @Mock
    private HyperparameterTuner tuner;

    @Mock
    private PredictionsSink predictionsSink;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private StubForecastingEngine engine;
    private InMemoryModelBlobStorage blobStorage;
    private TrainingRegistry registry;
    private ForecastingProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private HyperparameterGrid grid;
    private ExecutorService trainingExecutor;
    private ExecutorService callers;
    private ForecastService service;

    @BeforeEach
    void setUp() {
        properties = new ForecastingProperties();
        properties.getTuning().setEnabled(false);
        properties.setTrainingTimeout(Duration.ofSeconds(10));

        engine = new StubForecastingEngine();
        blobStorage = new InMemoryModelBlobStorage();
        registry = new TrainingRegistry();
        meterRegistry = new SimpleMeterRegistry();
        grid = HyperparameterGrid.singleton(HyperparameterSet.defaults());
        trainingExecutor = Executors.newFixedThreadPool(4);
        callers = Executors.newFixedThreadPool(5);

        ModelTrainer trainer = new ModelTrainer(engine, new QualityEvaluator(), properties);
        service = new ForecastService(
                seriesSource,
                new FeatureAugmenter(ZoneOffset.UTC),
                tuner,
                trainer,
                new ModelStore(blobStorage, engine),
                registry,
                predictionsSink,
                grid,
                trainingExecutor,
                eventPublisher,
                properties,
                meterRegistry,
                OpenTelemetry.noop().getTracer("test"));
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        trainingExecutor.shutdownNow();
    }

    @Nested
    @DisplayName("trainOrLoad")
    class TrainOrLoad {

        @Test
        @DisplayName("Trains, persists and announces a new model")
        void trainsAndPersists() {
            // Given
            MetricSeries series = TestSeries.dailySine(96);

            // When
            TrainedModel model = service.trainOrLoad(KEY, () -> series);

            // Then
            assertThat(model.getKey()).isEqualTo(KEY);
            assertThat(model.getPointCount()).isEqualTo(96);
            assertThat(model.getWindowEnd()).isEqualTo(series.lastTimestamp().orElseThrow());
            assertThat(model.isTuned()).isFalse();
            assertThat(model.getHyperparameters()).isEqualTo(grid.getDefaultSet());
            assertThat(blobStorage.contains(KEY)).isTrue();
            assertThat(engine.getFitCount()).isEqualTo(1);

            ArgumentCaptor<ModelTrainedEvent> captor = ArgumentCaptor.forClass(ModelTrainedEvent.class);
            verify(eventPublisher).publishEvent(captor.capture());
            assertThat(captor.getValue().isPersisted()).isTrue();
            assertThat(captor.getValue().getModel()).isSameAs(model);
            verify(tuner, never()).tune(any(), any(), anyInt());
        }

        @Test
        @DisplayName("Reuses the stored model when no newer data arrived")
        void reusesCurrentModel() {
            // Given
            MetricSeries series = TestSeries.dailySine(96);
            TrainedModel first = service.trainOrLoad(KEY, () -> series);

            // When
            TrainedModel second = service.trainOrLoad(KEY, () -> series);

            // Then
            assertThat(engine.getFitCount()).isEqualTo(1);
            assertThat(second.getTrainedAt()).isEqualTo(first.getTrainedAt());
            assertThat(second.getWindowEnd()).isEqualTo(first.getWindowEnd());
            verify(eventPublisher, times(1)).publishEvent(any(ModelTrainedEvent.class));
        }

        @Test
        @DisplayName("Retrains when the series extends past the stored window")
        void retrainsOnNewData() {
            // Given
            service.trainOrLoad(KEY, () -> TestSeries.dailySine(96));

            // When
            MetricSeries extended = TestSeries.dailySine(100);
            TrainedModel model = service.trainOrLoad(KEY, () -> extended);

            // Then
            assertThat(engine.getFitCount()).isEqualTo(2);
            assertThat(model.getWindowEnd()).isEqualTo(extended.lastTimestamp().orElseThrow());
        }

        @Test
        @DisplayName("Retrains when the stored model is older than the maximum age")
        void retrainsExpiredModel() {
            // Given
            MetricSeries series = TestSeries.dailySine(96);
            service.trainOrLoad(KEY, () -> series);
            properties.setModelMaxAge(Duration.ofNanos(1));

            // When
            service.trainOrLoad(KEY, () -> series);

            // Then
            assertThat(engine.getFitCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Applies the tuned hyperparameters when tuning is enabled")
        void appliesTunedParameters() {
            // Given
            properties.getTuning().setEnabled(true);
            HyperparameterSet tuned = HyperparameterSet.defaults().toBuilder()
                    .changepointPriorScale(0.5)
                    .weeklySeasonality(false)
                    .build();
            when(tuner.tune(any(), eq(grid), eq(properties.getTuning().getMinPointsForCv())))
                    .thenReturn(TuningResult.builder()
                            .bestParams(tuned)
                            .bestScore(OptionalDouble.of(3.2))
                            .evaluationType(EvaluationType.CROSS_VALIDATION)
                            .skipped(false)
                            .candidatesEvaluated(1)
                            .build());

            // When
            TrainedModel model = service.trainOrLoad(KEY, () -> TestSeries.dailySine(96));

            // Then
            assertThat(model.getHyperparameters()).isEqualTo(tuned);
            assertThat(model.isTuned()).isTrue();
            assertThat(model.getTuningEvaluation()).isEqualTo(EvaluationType.CROSS_VALIDATION);
        }

        @Test
        @DisplayName("Refuses series shorter than the training minimum")
        void dataInsufficient() {
            MetricSeries shortSeries = TestSeries.dailySine(10);

            assertThatThrownBy(() -> service.trainOrLoad(KEY, () -> shortSeries))
                    .isInstanceOfSatisfying(DataInsufficientException.class, e -> {
                        assertThat(e.getRequiredPoints()).isEqualTo(48);
                        assertThat(e.getAvailablePoints()).isEqualTo(10);
                    });
            assertThat(engine.getFitCount()).isZero();
            assertThat(registry.isTraining(KEY)).isFalse();
            assertThat(meterRegistry.counter("forecast.training.failures",
                    "reason", "DataInsufficientException").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Treats an unavailable store as a miss and still returns the model")
        void storageUnavailable() {
            // Given
            blobStorage.failLoads(true);

            // When
            TrainedModel model = service.trainOrLoad(KEY, () -> TestSeries.dailySine(96));

            // Then
            assertThat(model.getKey()).isEqualTo(KEY);
            assertThat(engine.getFitCount()).isEqualTo(1);
            assertThat(meterRegistry.counter("forecast.model_store.failures", "operation", "load").count())
                    .isEqualTo(1.0);

            ArgumentCaptor<ModelTrainedEvent> captor = ArgumentCaptor.forClass(ModelTrainedEvent.class);
            verify(eventPublisher).publishEvent(captor.capture());
            assertThat(captor.getValue().isPersisted()).isFalse();
        }

        @Test
        @DisplayName("Returns the model unsaved when the store rejects writes")
        void saveFails() {
            blobStorage.failSaves(true);

            TrainedModel model = service.trainOrLoad(KEY, () -> TestSeries.dailySine(96));

            assertThat(model.getPointCount()).isEqualTo(96);
            assertThat(blobStorage.contains(KEY)).isFalse();
            assertThat(meterRegistry.counter("forecast.model_store.failures", "operation", "save").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Loads the series from the source over the lookback window")
        void fetchesFromSource() {
            when(seriesSource.getHistoricalSeries(eq(KEY), any(Instant.class), any(Instant.class)))
                    .thenReturn(TestSeries.dailySine(96));

            TrainedModel model = service.trainOrLoad(KEY);

            assertThat(model.getPointCount()).isEqualTo(96);
            ArgumentCaptor<Instant> start = ArgumentCaptor.forClass(Instant.class);
            ArgumentCaptor<Instant> end = ArgumentCaptor.forClass(Instant.class);
            verify(seriesSource).getHistoricalSeries(eq(KEY), start.capture(), end.capture());
            assertThat(Duration.between(start.getValue(), end.getValue())).isEqualTo(properties.getLookback());
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("Concurrent callers for one key share a single training run")
        void singleRunPerKey() throws Exception {
            // Given
            MetricSeries series = TestSeries.dailySine(96);
            AtomicInteger providerCalls = new AtomicInteger();
            Supplier<MetricSeries> provider = () -> {
                providerCalls.incrementAndGet();
                return series;
            };
            CountDownLatch gate = engine.holdFits(KEY);

            // When
            List<Future<TrainedModel>> results = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                results.add(callers.submit(() -> service.trainOrLoad(KEY, provider)));
            }
            await().atMost(5, TimeUnit.SECONDS).until(() -> engine.getGatedFits() == 1);
            assertThat(registry.isTraining(KEY)).isTrue();
            gate.countDown();

            // Then
            for (Future<TrainedModel> result : results) {
                TrainedModel model = result.get(10, TimeUnit.SECONDS);
                assertThat(model.getKey()).isEqualTo(KEY);
                assertThat(model.getWindowEnd()).isEqualTo(series.lastTimestamp().orElseThrow());
            }
            assertThat(engine.getFitCount()).isEqualTo(1);
            assertThat(providerCalls.get()).isBetween(1, 5);
            assertThat(registry.isTraining(KEY)).isFalse();
        }

        @Test
        @DisplayName("Training one key does not block another")
        void keysAreIndependent() throws Exception {
            // Given a run for KEY held inside the engine
            CountDownLatch gate = engine.holdFits(KEY);
            CompletableFuture<TrainedModel> blocked = CompletableFuture.supplyAsync(
                    () -> service.trainOrLoad(KEY, () -> TestSeries.dailySine(96)), callers);
            await().atMost(5, TimeUnit.SECONDS).until(() -> engine.getGatedFits() == 1);

            // When
            MetricSeries otherSeries = TestSeries.generate(OTHER_KEY, TestSeries.START, HALF_HOUR, 96,
                    i -> 30.0 + i % 7);
            TrainedModel other = service.trainOrLoad(OTHER_KEY, () -> otherSeries);

            // Then
            assertThat(other.getKey()).isEqualTo(OTHER_KEY);
            assertThat(blocked).isNotDone();

            gate.countDown();
            assertThat(blocked.get(10, TimeUnit.SECONDS).getKey()).isEqualTo(KEY);
        }

        @Test
        @DisplayName("Waiting callers time out while the run continues in the background")
        void timeout() {
            // Given
            properties.setTrainingTimeout(Duration.ofMillis(200));
            CountDownLatch gate = engine.holdFits(KEY);

            // When / Then
            assertThatThrownBy(() -> service.trainOrLoad(KEY, () -> TestSeries.dailySine(96)))
                    .isInstanceOf(TrainingTimeoutException.class);
            assertThat(meterRegistry.counter("forecast.training.timeouts").count()).isEqualTo(1.0);

            gate.countDown();
            await().atMost(5, TimeUnit.SECONDS).until(() -> blobStorage.contains(KEY));
            await().atMost(5, TimeUnit.SECONDS).until(() -> !registry.isTraining(KEY));
        }

        @Test
        @DisplayName("The non-blocking variant refuses to join an in-flight run")
        void nonBlockingRefusesInFlight() {
            // Given
            CountDownLatch gate = engine.holdFits(KEY);
            CompletableFuture<TrainedModel> running = CompletableFuture.supplyAsync(
                    () -> service.trainOrLoad(KEY, () -> TestSeries.dailySine(96)), callers);
            await().atMost(5, TimeUnit.SECONDS).until(() -> engine.getGatedFits() == 1);

            // When / Then
            assertThatThrownBy(() -> service.trainOrLoadNonBlocking(KEY))
                    .isInstanceOf(TrainingInProgressException.class);
            assertThat(service.state(KEY)).isEqualTo(ModelState.TRAINING);

            gate.countDown();
            assertThat(running.join().getKey()).isEqualTo(KEY);
        }

        @Test
        @DisplayName("The non-blocking variant trains on the source series when the key is idle")
        void nonBlockingTrainsWhenIdle() {
            // Given
            when(seriesSource.getHistoricalSeries(eq(KEY), any(Instant.class), any(Instant.class)))
                    .thenReturn(TestSeries.dailySine(96));

            // When
            TrainedModel model = service.trainOrLoadNonBlocking(KEY);

            // Then
            assertThat(model.getKey()).isEqualTo(KEY);
            assertThat(engine.getFitCount()).isEqualTo(1);
            assertThat(registry.isTraining(KEY)).isFalse();
        }
    }

    @Nested
    @DisplayName("forecasting")
    class Forecasting {

        @Test
        @DisplayName("Predicts at fixed steps after the training window")
        void predictTimestamps() {
            // Given
            TrainedModel model = service.trainOrLoad(KEY, () -> TestSeries.dailySine(96));

            // When
            ForecastResult result = service.predict(model, 3, HALF_HOUR);

            // Then
            Instant end = model.getWindowEnd();
            assertThat(result.getPoints()).extracting(ForecastPoint::getTimestamp).containsExactly(
                    end.plus(HALF_HOUR), end.plus(HALF_HOUR.multipliedBy(2)), end.plus(HALF_HOUR.multipliedBy(3)));
            assertThat(result.getKey()).isEqualTo(KEY);
            assertThat(result.getFrequency()).isEqualTo(HALF_HOUR);
            assertThat(result.getConfidenceLevel()).isEqualTo(0.8);
        }

        @Test
        @DisplayName("Rejects a non-positive horizon or frequency")
        void invalidPredictArguments() {
            TrainedModel model = service.trainOrLoad(KEY, () -> TestSeries.dailySine(96));

            assertThatThrownBy(() -> service.predict(model, 0, HALF_HOUR))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> service.predict(model, 5, Duration.ZERO))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Generated forecasts are written and announced")
        void generateForecast() {
            // Given
            when(seriesSource.getHistoricalSeries(eq(KEY), any(Instant.class), any(Instant.class)))
                    .thenReturn(TestSeries.dailySine(96));
            when(predictionsSink.upsertPredictions(eq(KEY), any(ForecastResult.class))).thenReturn(48);

            // When
            ForecastResult result = service.generateForecast(KEY, 48, HALF_HOUR);

            // Then
            assertThat(result.size()).isEqualTo(48);
            verify(predictionsSink).upsertPredictions(KEY, result);
            assertThat(meterRegistry.counter("forecast.predictions.written").count()).isEqualTo(48.0);

            ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
            verify(eventPublisher, atLeastOnce()).publishEvent(events.capture());
            assertThat(events.getAllValues())
                    .filteredOn(ForecastGeneratedEvent.class::isInstance)
                    .singleElement()
                    .satisfies(event -> assertThat(((ForecastGeneratedEvent) event).getForecast()).isSameAs(result));
        }
    }

    @Nested
    @DisplayName("state")
    class State {

        @Test
        @DisplayName("Moves from no model to ready to stale")
        void lifecycle() {
            // Given
            MetricSeries series = TestSeries.dailySine(96);
            assertThat(service.state(KEY)).isEqualTo(ModelState.NO_MODEL);

            // When
            service.trainOrLoad(KEY, () -> series);

            // Then
            when(seriesSource.findTimestamps(eq(KEY), any(Instant.class), any(Instant.class)))
                    .thenReturn(series.timestamps());
            assertThat(service.state(KEY)).isEqualTo(ModelState.READY);

            when(seriesSource.findTimestamps(eq(KEY), any(Instant.class), any(Instant.class)))
                    .thenReturn(TestSeries.dailySine(97).timestamps());
            assertThat(service.state(KEY)).isEqualTo(ModelState.STALE);
        }

        @Test
        @DisplayName("Invalidation drops the stored model")
        void invalidate() {
            service.trainOrLoad(KEY, () -> TestSeries.dailySine(96));

            service.invalidate(KEY);

            assertThat(blobStorage.contains(KEY)).isFalse();
            assertThat(service.state(KEY)).isEqualTo(ModelState.NO_MODEL);
        }
    }
}
