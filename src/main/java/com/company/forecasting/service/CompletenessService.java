package com.company.forecasting.service;

import com.company.forecasting.config.ForecastingProperties;
import com.company.forecasting.domain.CompletenessReport;
import com.company.forecasting.domain.SeriesKey;
import com.company.forecasting.repository.SeriesSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class CompletenessService {

    private final SeriesSource seriesSource;
    private final CompletenessAnalyzer analyzer;
    private final ForecastingProperties properties;

    public CompletenessReport analyze(SeriesKey key, Instant start, Instant end, Duration expectedInterval) {
        List<Instant> timestamps = seriesSource.findTimestamps(key, start, end);
        CompletenessReport report = analyzer.analyze(timestamps, start, end, expectedInterval,
                properties.getCompleteness().getTolerance());

        if (!report.isComplete()) {
            log.info("Data for {} is {}% complete between {} and {}: {} missing points in {} gaps",
                    key, report.getCompletenessPercentage(), start, end,
                    report.getMissingPoints(), report.getMissingIntervals().size());
        }
        return report;
    }
}
