package com.company.forecasting.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Calendar regressors derived from a single timestamp.
 * Day of week follows ISO-8601 (1 = Monday, 7 = Sunday); week of year is the ISO week.
 */
@Value
@Builder
public class CalendarFeatures {
    int hourOfDay;
    int dayOfWeek;
    int dayOfMonth;
    int weekOfYear;
    int month;
    int quarter;

    boolean weekend;
    boolean monthStart;
    boolean monthEnd;
    boolean quarterStart;
    boolean quarterEnd;
    boolean yearStart;
    boolean yearEnd;

    // Conditional seasonality flags
    boolean workHours;
    boolean night;

    /**
     * Indicator regressors in a fixed column order, as 0/1 values.
     * The order must never change: fitted models store coefficients by position.
     */
    public double[] indicators() {
        return new double[]{
                flag(weekend),
                flag(monthStart),
                flag(monthEnd),
                flag(quarterStart),
                flag(quarterEnd),
                flag(yearStart),
                flag(yearEnd),
                flag(workHours),
                flag(night)
        };
    }

    public static int indicatorCount() {
        return 9;
    }

    private static double flag(boolean value) {
        return value ? 1.0 : 0.0;
    }
}
