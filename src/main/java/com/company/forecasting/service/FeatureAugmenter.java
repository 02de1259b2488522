package com.company.forecasting.service;

import com.company.forecasting.config.ForecastingProperties;
import com.company.forecasting.domain.AugmentedSeries;
import com.company.forecasting.domain.CalendarFeatures;
import com.company.forecasting.domain.DataPoint;
import com.company.forecasting.domain.MetricSeries;
import com.company.forecasting.exception.ValidationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derives calendar regressors from timestamps, interpreted in a fixed zone (UTC by default).
 */
@Component
public class FeatureAugmenter {

    private final ZoneId zoneId;

    @Autowired
    public FeatureAugmenter(ForecastingProperties properties) {
        this(properties.getFeatures().getZoneId());
    }

    public FeatureAugmenter(ZoneId zoneId) {
        this.zoneId = Objects.requireNonNull(zoneId, "zoneId");
    }

    public ZoneId getZoneId() {
        return zoneId;
    }

    public AugmentedSeries augment(MetricSeries series) {
        List<CalendarFeatures> rows = new ArrayList<>(series.size());
        for (DataPoint point : series.getPoints()) {
            if (!Double.isFinite(point.getValue())) {
                throw new ValidationException(series.getKey(), "augment",
                        "Non-finite value " + point.getValue() + " at " + point.getTimestamp());
            }
            rows.add(features(point.getTimestamp()));
        }
        return new AugmentedSeries(series, rows);
    }

    public CalendarFeatures features(Instant timestamp) {
        ZonedDateTime local = timestamp.atZone(zoneId);
        LocalDate date = local.toLocalDate();

        int hour = local.getHour();
        int dayOfWeek = date.getDayOfWeek().getValue();
        int dayOfMonth = date.getDayOfMonth();
        int month = date.getMonthValue();

        boolean monthStart = dayOfMonth == 1;
        boolean monthEnd = dayOfMonth == date.lengthOfMonth();
        boolean quarterFirstMonth = (month - 1) % 3 == 0;
        boolean quarterLastMonth = month % 3 == 0;

        return CalendarFeatures.builder()
                .hourOfDay(hour)
                .dayOfWeek(dayOfWeek)
                .dayOfMonth(dayOfMonth)
                .weekOfYear(date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR))
                .month(month)
                .quarter((month - 1) / 3 + 1)
                .weekend(dayOfWeek >= 6)
                .monthStart(monthStart)
                .monthEnd(monthEnd)
                .quarterStart(monthStart && quarterFirstMonth)
                .quarterEnd(monthEnd && quarterLastMonth)
                .yearStart(monthStart && month == 1)
                .yearEnd(monthEnd && month == 12)
                .workHours(hour >= 9 && hour <= 18)
                .night(hour <= 6)
                .build();
    }
}
