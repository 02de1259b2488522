package com.company.forecasting.scheduled;

import com.company.forecasting.cache.ModelStore;
import com.company.forecasting.config.ForecastingProperties;
import com.company.forecasting.domain.SeriesKey;
import com.company.forecasting.domain.TrainedModel;
import com.company.forecasting.exception.StorageUnavailableException;
import com.company.forecasting.repository.SeriesSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ModelCleanupJob")
class ModelCleanupJobTest {

    private static final SeriesKey EXPIRED = SeriesKey.of("vm-01", "cpu.usage.average");
    private static final SeriesKey RECENT = SeriesKey.of("vm-01", "memory.usage.average");
    private static final SeriesKey UNTRAINED = SeriesKey.of("vm-02", "cpu.usage.average");
    private static final SeriesKey UNREACHABLE = SeriesKey.of("vm-03", "cpu.usage.average");

    @Mock
    private SeriesSource seriesSource;

    @Mock
    private ModelStore modelStore;

    private SimpleMeterRegistry meterRegistry;
    private ModelCleanupJob job;

    @BeforeEach
    void setUp() {
        ForecastingProperties properties = new ForecastingProperties();
        properties.getCleanup().setRetention(Duration.ofDays(30));
        meterRegistry = new SimpleMeterRegistry();
        job = new ModelCleanupJob(seriesSource, modelStore, properties, meterRegistry);
    }

    @Test
    @DisplayName("Deletes only models trained before the retention cutoff")
    void deletesExpiredModels() {
        // Given
        when(seriesSource.findTrackedKeys()).thenReturn(List.of(UNREACHABLE, EXPIRED, RECENT, UNTRAINED));
        when(modelStore.load(UNREACHABLE)).thenThrow(new StorageUnavailableException(UNREACHABLE, "load", "down"));
        when(modelStore.load(EXPIRED)).thenReturn(Optional.of(trainedDaysAgo(EXPIRED, 45)));
        when(modelStore.load(RECENT)).thenReturn(Optional.of(trainedDaysAgo(RECENT, 2)));
        when(modelStore.load(UNTRAINED)).thenReturn(Optional.empty());

        // When
        job.cleanupOldModels();

        // Then
        verify(modelStore).delete(EXPIRED);
        verify(modelStore, never()).delete(RECENT);
        verify(modelStore, never()).delete(UNTRAINED);
        assertThat(meterRegistry.counter("forecast.models.deleted").count()).isEqualTo(1.0);
    }

    private static TrainedModel trainedDaysAgo(SeriesKey key, int days) {
        return TrainedModel.builder()
                .key(key)
                .engineName("seasonal-regression")
                .trainedAt(Instant.now().minus(Duration.ofDays(days)))
                .build();
    }
}
