package com.company.forecasting.service;

import com.company.forecasting.domain.SeriesKey;
import com.company.forecasting.domain.TrainedModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * In-flight training runs, at most one per key. A run is removed when it completes,
 * whether it succeeded or failed.
 */
@Component
@Slf4j
public class TrainingRegistry {

    private final ConcurrentMap<SeriesKey, CompletableFuture<TrainedModel>> inFlight = new ConcurrentHashMap<>();

    /**
     * Returns the in-flight run for the key, or starts one with {@code starter}.
     * {@code starter} is invoked at most once per run and must not block.
     */
    public CompletableFuture<TrainedModel> joinOrStart(SeriesKey key,
                                                       Function<SeriesKey, CompletableFuture<TrainedModel>> starter) {
        CompletableFuture<TrainedModel> created = new CompletableFuture<>();
        CompletableFuture<TrainedModel> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            log.debug("Joining in-flight training for {}", key);
            return existing;
        }
        return start(key, created, starter);
    }

    /**
     * Starts a run with {@code starter} only when none is in flight for the key.
     *
     * @return the new run, or empty when another run already holds the key
     */
    public Optional<CompletableFuture<TrainedModel>> startIfIdle(
            SeriesKey key, Function<SeriesKey, CompletableFuture<TrainedModel>> starter) {
        CompletableFuture<TrainedModel> created = new CompletableFuture<>();
        if (inFlight.putIfAbsent(key, created) != null) {
            return Optional.empty();
        }
        return Optional.of(start(key, created, starter));
    }

    private CompletableFuture<TrainedModel> start(SeriesKey key, CompletableFuture<TrainedModel> created,
                                                  Function<SeriesKey, CompletableFuture<TrainedModel>> starter) {
        CompletableFuture<TrainedModel> run;
        try {
            run = starter.apply(key);
        } catch (RuntimeException e) {
            inFlight.remove(key, created);
            created.completeExceptionally(e);
            return created;
        }

        run.whenComplete((model, error) -> {
            inFlight.remove(key, created);
            if (error != null) {
                created.completeExceptionally(error);
            } else {
                created.complete(model);
            }
        });
        return created;
    }

    public boolean isTraining(SeriesKey key) {
        return inFlight.containsKey(key);
    }

    public int size() {
        return inFlight.size();
    }
}
