package com.company.forecasting.scheduled;

import com.company.forecasting.cache.ModelStore;
import com.company.forecasting.config.ForecastingProperties;
import com.company.forecasting.domain.SeriesKey;
import com.company.forecasting.domain.TrainedModel;
import com.company.forecasting.repository.SeriesSource;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Deletes stored models that were trained before the retention cutoff.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "forecasting.cleanup.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ModelCleanupJob {

    private final SeriesSource seriesSource;
    private final ModelStore modelStore;
    private final ForecastingProperties properties;
    private final MeterRegistry meterRegistry;

    @Scheduled(cron = "${forecasting.cleanup.cron:0 0 3 * * *}")
    public void cleanupOldModels() {
        Instant cutoff = Instant.now().minus(properties.getCleanup().getRetention());
        log.info("Starting model cleanup, removing models trained before {}", cutoff);

        int deletedCount = 0;
        int failureCount = 0;

        for (SeriesKey key : seriesSource.findTrackedKeys()) {
            try {
                Optional<TrainedModel> model = modelStore.load(key);
                if (model.isPresent() && model.get().getTrainedAt().isBefore(cutoff)) {
                    modelStore.delete(key);
                    deletedCount++;
                    log.debug("Deleted model for {} trained at {}", key, model.get().getTrainedAt());
                }
            } catch (Exception e) {
                log.error("Failed to clean up model for {}", key, e);
                failureCount++;
            }
        }

        meterRegistry.counter("forecast.models.deleted").increment(deletedCount);
        log.info("Model cleanup completed: {} deleted, {} failed", deletedCount, failureCount);
    }
}
