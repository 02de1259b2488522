package com.company.forecasting.scheduled;

import com.company.forecasting.config.ForecastingProperties;
import com.company.forecasting.domain.SeriesKey;
import com.company.forecasting.exception.DataInsufficientException;
import com.company.forecasting.repository.SeriesSource;
import com.company.forecasting.service.ForecastService;
import com.company.forecasting.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Retrains where needed and writes a fresh forecast for every tracked series.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "forecasting.refresh.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ForecastRefreshJob {

    private final SeriesSource seriesSource;
    private final ForecastService forecastService;
    private final ForecastingProperties properties;
    private final MeterRegistry meterRegistry;

    @Scheduled(cron = "${forecasting.refresh.cron:0 */30 * * * *}")
    public void refreshForecasts() {
        long startTime = System.currentTimeMillis();
        ForecastingProperties.Refresh refresh = properties.getRefresh();
        Duration frequency = TimeUtils.parseFrequency(refresh.getFrequency());

        List<SeriesKey> keys = seriesSource.findTrackedKeys();
        log.info("Starting forecast refresh for {} series (horizon {} x {})",
                keys.size(), refresh.getHorizon(), frequency);

        int successCount = 0;
        int skippedCount = 0;
        int failureCount = 0;

        for (SeriesKey key : keys) {
            try {
                forecastService.generateForecast(key, refresh.getHorizon(), frequency);
                successCount++;
            } catch (DataInsufficientException e) {
                log.debug("Skipping forecast for {}: {}", key, e.getMessage());
                skippedCount++;
            } catch (Exception e) {
                log.error("Failed to refresh forecast for {}", key, e);
                failureCount++;
            }
        }

        meterRegistry.counter("forecast.refresh.runs").increment();
        meterRegistry.counter("forecast.refresh.failures").increment(failureCount);
        meterRegistry.timer("forecast.refresh.duration")
                .record(Duration.ofMillis(System.currentTimeMillis() - startTime));

        log.info("Forecast refresh completed: {} succeeded, {} skipped, {} failed",
                successCount, skippedCount, failureCount);
    }
}
