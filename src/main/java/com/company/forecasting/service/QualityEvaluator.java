package com.company.forecasting.service;

import com.company.forecasting.domain.ForecastPoint;
import com.company.forecasting.domain.QualityMetrics;
import com.company.forecasting.domain.enums.EvaluationType;
import com.company.forecasting.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Accuracy metrics for predictions against actual values. Percent metrics are in [0, 100+].
 */
@Component
public class QualityEvaluator {

    /**
     * Mean absolute percentage error over the points whose actual value is non-zero.
     * Empty when every actual value is zero.
     */
    public OptionalDouble mape(double[] actual, double[] predicted) {
        requireAligned(actual, predicted);

        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] != 0.0) {
                sum += Math.abs(actual[i] - predicted[i]) / Math.abs(actual[i]);
                count++;
            }
        }
        return count == 0 ? OptionalDouble.empty() : OptionalDouble.of(sum / count * 100.0);
    }

    public double mae(double[] actual, double[] predicted) {
        requireAligned(actual, predicted);

        double sum = 0.0;
        for (int i = 0; i < actual.length; i++) {
            sum += Math.abs(actual[i] - predicted[i]);
        }
        return sum / actual.length;
    }

    public double rmse(double[] actual, double[] predicted) {
        requireAligned(actual, predicted);

        double sum = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double error = actual[i] - predicted[i];
            sum += error * error;
        }
        return Math.sqrt(sum / actual.length);
    }

    /**
     * Symmetric MAPE. Points where both values are zero count as exact.
     */
    public double smape(double[] actual, double[] predicted) {
        requireAligned(actual, predicted);

        double sum = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double denominator = Math.abs(actual[i]) + Math.abs(predicted[i]);
            if (denominator > 0.0) {
                sum += 2.0 * Math.abs(actual[i] - predicted[i]) / denominator;
            }
        }
        return sum / actual.length * 100.0;
    }

    /**
     * Percentage of actual values inside their prediction interval.
     */
    public double coverage(double[] actual, double[] lower, double[] upper) {
        requireAligned(actual, lower);
        requireAligned(actual, upper);

        int inside = 0;
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] >= lower[i] && actual[i] <= upper[i]) {
                inside++;
            }
        }
        return (double) inside / actual.length * 100.0;
    }

    public QualityMetrics evaluate(double[] actual, List<ForecastPoint> predictions, EvaluationType type) {
        double[] predicted = new double[predictions.size()];
        double[] lower = new double[predictions.size()];
        double[] upper = new double[predictions.size()];
        for (int i = 0; i < predictions.size(); i++) {
            ForecastPoint point = predictions.get(i);
            predicted[i] = point.getPredicted();
            lower[i] = point.getLower();
            upper[i] = point.getUpper();
        }

        OptionalDouble mape = mape(actual, predicted);
        return QualityMetrics.builder()
                .mape(mape.isPresent() ? mape.getAsDouble() : null)
                .mae(mae(actual, predicted))
                .rmse(rmse(actual, predicted))
                .smape(smape(actual, predicted))
                .coverage(coverage(actual, lower, upper))
                .evaluationType(type)
                .build();
    }

    private static void requireAligned(double[] actual, double[] predicted) {
        if (actual == null || predicted == null || actual.length == 0) {
            throw new ValidationException("evaluate", "Actual and predicted values must be non-empty");
        }
        if (actual.length != predicted.length) {
            throw new ValidationException("evaluate", String.format(
                    "Length mismatch: %d actual vs %d predicted values", actual.length, predicted.length));
        }
    }
}
