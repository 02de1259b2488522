package com.company.forecasting.cache;

import com.company.forecasting.domain.SeriesKey;
import com.company.forecasting.domain.TrainedModel;
import com.company.forecasting.engine.FittedModel;
import com.company.forecasting.engine.ForecastingEngine;
import com.company.forecasting.exception.StorageUnavailableException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable latest-wins storage of trained models.
 *
 * <p>Writes for one key are serialized and version-guarded: a model whose training window ends
 * before the stored model's is rejected, so a slow training run can never replace a newer model.
 * Unreadable or foreign-engine blobs are reported as absent and get overwritten by the next save.
 */
@Service
@Slf4j
public class ModelStore {

    static final int LOCK_STRIPES = 64;

    private final ModelBlobStorage storage;
    private final ForecastingEngine engine;
    private final ObjectMapper objectMapper;
    private final ReentrantLock[] writeLocks = new ReentrantLock[LOCK_STRIPES];

    public ModelStore(ModelBlobStorage storage, ForecastingEngine engine) {
        this.storage = storage;
        this.engine = engine;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        for (int i = 0; i < LOCK_STRIPES; i++) {
            writeLocks[i] = new ReentrantLock();
        }
    }

    /**
     * @return true when the model was written, false when a model with a later training window is stored
     * @throws StorageUnavailableException when the backing storage fails
     */
    public boolean save(SeriesKey key, TrainedModel model) {
        Objects.requireNonNull(model, "model");
        if (!key.equals(model.getKey())) {
            throw new IllegalArgumentException("Model for " + model.getKey() + " cannot be stored under " + key);
        }

        byte[] blob = encode(model);

        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            Optional<ModelEnvelope> stored = storage.load(key).flatMap(bytes -> decodeEnvelope(key, bytes));
            if (stored.isPresent()
                    && stored.get().getTrainingWindow().getEnd().isAfter(model.getWindowEnd())) {
                log.info("Rejected stale model for {}: window end {} is before stored {}",
                        key, model.getWindowEnd(), stored.get().getTrainingWindow().getEnd());
                return false;
            }

            storage.save(key, blob);
            log.debug("Saved model for {} (window end {})", key, model.getWindowEnd());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the stored model, or empty when there is none for the key
     * @throws StorageUnavailableException when the backing storage fails
     */
    public Optional<TrainedModel> load(SeriesKey key) {
        return storage.load(key)
                .flatMap(bytes -> decodeEnvelope(key, bytes))
                .flatMap(envelope -> toModel(key, envelope));
    }

    public void delete(SeriesKey key) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            storage.delete(key);
        } finally {
            lock.unlock();
        }
    }

    // Keys share a fixed set of stripes, so the lock table does not grow with the number of series.
    ReentrantLock lockFor(SeriesKey key) {
        return writeLocks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }

    private byte[] encode(TrainedModel model) {
        try {
            ModelEnvelope envelope = ModelEnvelope.builder()
                    .formatVersion(ModelEnvelope.CURRENT_FORMAT)
                    .key(model.getKey())
                    .engineName(model.getEngineName())
                    .hyperparameters(model.getHyperparameters())
                    .trainedAt(model.getTrainedAt())
                    .trainingWindow(model.getTrainingWindow())
                    .pointCount(model.getPointCount())
                    .qualityMetrics(model.getQualityMetrics())
                    .tuned(model.isTuned())
                    .tuningEvaluation(model.getTuningEvaluation())
                    .model(engine.serialize(model.getFittedModel()))
                    .build();
            return objectMapper.writeValueAsBytes(envelope);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize model for " + model.getKey(), e);
        }
    }

    private Optional<ModelEnvelope> decodeEnvelope(SeriesKey key, byte[] bytes) {
        try {
            ModelEnvelope envelope = objectMapper.readValue(bytes, ModelEnvelope.class);
            if (envelope.getFormatVersion() != ModelEnvelope.CURRENT_FORMAT
                    || envelope.getTrainingWindow() == null || envelope.getModel() == null) {
                log.warn("Ignoring stored model for {} with unsupported format {}", key, envelope.getFormatVersion());
                return Optional.empty();
            }
            return Optional.of(envelope);
        } catch (IOException e) {
            log.warn("Ignoring unreadable stored model for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<TrainedModel> toModel(SeriesKey key, ModelEnvelope envelope) {
        if (!engine.name().equals(envelope.getEngineName())) {
            log.warn("Ignoring stored model for {} produced by engine {}", key, envelope.getEngineName());
            return Optional.empty();
        }

        FittedModel fitted;
        try {
            fitted = engine.deserialize(envelope.getModel());
        } catch (IOException e) {
            log.warn("Ignoring stored model for {}: {}", key, e.getMessage());
            return Optional.empty();
        }

        return Optional.of(TrainedModel.builder()
                .key(envelope.getKey())
                .fittedModel(fitted)
                .engineName(envelope.getEngineName())
                .hyperparameters(envelope.getHyperparameters())
                .trainedAt(envelope.getTrainedAt())
                .trainingWindow(envelope.getTrainingWindow())
                .pointCount(envelope.getPointCount())
                .qualityMetrics(envelope.getQualityMetrics())
                .tuned(envelope.isTuned())
                .tuningEvaluation(envelope.getTuningEvaluation())
                .build());
    }
}
