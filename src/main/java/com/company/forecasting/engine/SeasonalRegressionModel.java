package com.company.forecasting.engine;

import com.company.forecasting.domain.CalendarFeatures;
import com.company.forecasting.domain.enums.SeasonalityMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Coefficients and design layout of a {@link SeasonalRegressionEngine} fit.
 * Column order of the design row: intercept, trend, changepoint hinges,
 * daily Fourier pairs, weekly Fourier pairs, calendar indicators.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SeasonalRegressionModel implements FittedModel {

    static final double DAY_SECONDS = 86_400.0;
    static final double WEEK_SECONDS = 7 * DAY_SECONDS;

    private String engineName;
    private SeasonalityMode seasonalityMode;

    // Trend time axis: scaled = (epochSeconds - originEpochSeconds) / spanSeconds
    private long originEpochSeconds;
    private double spanSeconds;
    private long lastEpochSeconds;
    private long stepSeconds;

    /** Divisor applied to the target in additive mode; 1 in multiplicative mode. */
    private double targetScale;

    private double[] changepoints;
    private int dailyOrder;
    private int weeklyOrder;

    private double[] coefficients;
    private double residualSigma;
    private int trainingPoints;

    public int columnCount() {
        return 2 + changepoints.length + 2 * dailyOrder + 2 * weeklyOrder + CalendarFeatures.indicatorCount();
    }

    public double[] designRow(long epochSeconds, CalendarFeatures features) {
        double[] row = new double[columnCount()];
        double t = (epochSeconds - originEpochSeconds) / spanSeconds;

        int col = 0;
        row[col++] = 1.0;
        row[col++] = t;
        for (double changepoint : changepoints) {
            row[col++] = Math.max(0.0, t - changepoint);
        }
        col = fourier(row, col, epochSeconds, DAY_SECONDS, dailyOrder);
        col = fourier(row, col, epochSeconds, WEEK_SECONDS, weeklyOrder);
        for (double indicator : features.indicators()) {
            row[col++] = indicator;
        }
        return row;
    }

    /**
     * Fitted value in model space: scaled units in additive mode, log units in multiplicative mode.
     */
    public double evaluate(double[] row) {
        double sum = 0.0;
        for (int i = 0; i < row.length; i++) {
            sum += row[i] * coefficients[i];
        }
        return sum;
    }

    private static int fourier(double[] row, int col, long epochSeconds, double period, int order) {
        for (int k = 1; k <= order; k++) {
            double angle = 2.0 * Math.PI * k * (epochSeconds % (long) period) / period;
            row[col++] = Math.sin(angle);
            row[col++] = Math.cos(angle);
        }
        return col;
    }
}
