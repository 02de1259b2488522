package com.company.forecasting.engine;

import com.company.forecasting.domain.AugmentedSeries;
import com.company.forecasting.domain.CalendarFeatures;
import com.company.forecasting.domain.ForecastPoint;
import com.company.forecasting.domain.HyperparameterSet;
import com.company.forecasting.domain.SeriesKey;
import com.company.forecasting.domain.enums.SeasonalityMode;
import com.company.forecasting.exception.TrainingFailedException;
import com.company.forecasting.exception.ValidationException;
import com.company.forecasting.service.FeatureAugmenter;
import com.company.forecasting.util.TimeUtils;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ridge-regularized regression on a piecewise-linear trend, daily and weekly Fourier terms
 * and calendar indicators.
 *
 * <p>Each coefficient group gets a ridge penalty equal to the inverse of its prior scale, so a
 * larger scale lets that component move more freely. Intervals are normal quantiles of the
 * in-sample residual spread, widened by {@code sqrt(1 + h / n)} for a point {@code h} steps
 * past the training window.
 */
@Slf4j
public class SeasonalRegressionEngine implements ForecastingEngine {

    public static final String NAME = "seasonal-regression";

    static final int DAILY_ORDER = 4;
    static final int WEEKLY_ORDER = 3;

    // Keeps intercept and slope identifiable without shrinking them noticeably
    private static final double TREND_PENALTY = 1e-8;

    private final FeatureAugmenter featureAugmenter;
    private final int minimumTrainingPoints;
    private final ObjectMapper objectMapper;

    public SeasonalRegressionEngine(FeatureAugmenter featureAugmenter, int minimumTrainingPoints) {
        if (minimumTrainingPoints < 2) {
            throw new IllegalArgumentException("minimumTrainingPoints must be at least 2");
        }
        this.featureAugmenter = featureAugmenter;
        this.minimumTrainingPoints = minimumTrainingPoints;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int minimumTrainingPoints() {
        return minimumTrainingPoints;
    }

    @Override
    public FittedModel fit(AugmentedSeries series, HyperparameterSet params) {
        SeriesKey key = series.getKey();
        int n = series.size();
        if (n < 2) {
            throw new TrainingFailedException(key, "At least 2 points are required, got " + n);
        }

        List<Instant> timestamps = series.getSeries().timestamps();
        double[] values = series.getSeries().values();
        long origin = timestamps.get(0).getEpochSecond();
        long last = timestamps.get(n - 1).getEpochSecond();
        double span = Math.max(1.0, last - origin);

        double targetScale = 1.0;
        double[] target = new double[n];
        if (params.getSeasonalityMode() == SeasonalityMode.MULTIPLICATIVE) {
            for (int i = 0; i < n; i++) {
                if (values[i] <= 0.0) {
                    throw new TrainingFailedException(key,
                            "Multiplicative seasonality requires strictly positive values, found " + values[i]);
                }
                target[i] = Math.log(values[i]);
            }
        } else {
            targetScale = maxAbs(values);
            if (targetScale == 0.0) {
                throw new TrainingFailedException(key, "Series contains only zeros");
            }
            for (int i = 0; i < n; i++) {
                target[i] = values[i] / targetScale;
            }
        }

        SeasonalRegressionModel model = SeasonalRegressionModel.builder()
                .engineName(NAME)
                .seasonalityMode(params.getSeasonalityMode())
                .originEpochSeconds(origin)
                .spanSeconds(span)
                .lastEpochSeconds(last)
                .stepSeconds(Math.max(1L, TimeUtils.medianStepSeconds(timestamps)))
                .targetScale(targetScale)
                .changepoints(changepoints(params))
                .dailyOrder(params.isDailySeasonality() && last - origin >= 2 * SeasonalRegressionModel.DAY_SECONDS
                        ? DAILY_ORDER : 0)
                .weeklyOrder(params.isWeeklySeasonality() && last - origin >= 2 * SeasonalRegressionModel.WEEK_SECONDS
                        ? WEEKLY_ORDER : 0)
                .trainingPoints(n)
                .build();

        int p = model.columnCount();
        double[][] design = new double[n][];
        for (int i = 0; i < n; i++) {
            design[i] = model.designRow(timestamps.get(i).getEpochSecond(), series.getFeatures().get(i));
        }

        double[][] normal = new double[p][p];
        double[] rhs = new double[p];
        for (int i = 0; i < n; i++) {
            double[] row = design[i];
            for (int a = 0; a < p; a++) {
                if (row[a] == 0.0) continue;
                rhs[a] += row[a] * target[i];
                for (int b = a; b < p; b++) {
                    normal[a][b] += row[a] * row[b];
                }
            }
        }
        double[] penalties = penalties(key, model, params);
        for (int a = 0; a < p; a++) {
            normal[a][a] += penalties[a];
            for (int b = 0; b < a; b++) {
                normal[a][b] = normal[b][a];
            }
        }

        DecompositionSolver solver = new LUDecomposition(new Array2DRowRealMatrix(normal, false)).getSolver();
        if (!solver.isNonSingular()) {
            throw new TrainingFailedException(key, "Regression system is singular for " + params.describe());
        }
        double[] coefficients = solver.solve(new ArrayRealVector(rhs, false)).toArray();
        for (double coefficient : coefficients) {
            if (!Double.isFinite(coefficient)) {
                throw new TrainingFailedException(key, "Regression produced non-finite coefficients for "
                        + params.describe());
            }
        }
        model.setCoefficients(coefficients);

        double sumSquares = 0.0;
        for (int i = 0; i < n; i++) {
            double residual = target[i] - model.evaluate(design[i]);
            sumSquares += residual * residual;
        }
        model.setResidualSigma(Math.sqrt(sumSquares / n));

        log.debug("Fitted {} for {}: {} points, {} columns, sigma={}",
                NAME, key, n, p, model.getResidualSigma());
        return model;
    }

    @Override
    public List<ForecastPoint> predict(FittedModel fitted, List<Instant> timestamps, double confidenceLevel) {
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new ValidationException("predict", "Confidence level must be in (0, 1): " + confidenceLevel);
        }
        SeasonalRegressionModel model = cast(fitted);
        double z = new NormalDistribution().inverseCumulativeProbability(0.5 + confidenceLevel / 2.0);
        boolean multiplicative = model.getSeasonalityMode() == SeasonalityMode.MULTIPLICATIVE;

        List<ForecastPoint> points = new ArrayList<>(timestamps.size());
        for (Instant timestamp : timestamps) {
            long epochSeconds = timestamp.getEpochSecond();
            CalendarFeatures features = featureAugmenter.features(timestamp);
            double modelValue = model.evaluate(model.designRow(epochSeconds, features));

            double stepsAhead = Math.max(0.0,
                    (double) (epochSeconds - model.getLastEpochSeconds()) / model.getStepSeconds());
            double halfWidth = z * model.getResidualSigma()
                    * Math.sqrt(1.0 + stepsAhead / model.getTrainingPoints());

            double predicted;
            double lower;
            double upper;
            if (multiplicative) {
                predicted = Math.exp(modelValue);
                lower = Math.exp(modelValue - halfWidth);
                upper = Math.exp(modelValue + halfWidth);
            } else {
                predicted = modelValue * model.getTargetScale();
                lower = (modelValue - halfWidth) * model.getTargetScale();
                upper = (modelValue + halfWidth) * model.getTargetScale();
            }

            // Load cannot be negative
            points.add(new ForecastPoint(timestamp,
                    clip(TimeUtils.round2(predicted)),
                    clip(TimeUtils.round2(lower)),
                    clip(TimeUtils.round2(upper))));
        }
        return points;
    }

    @Override
    public byte[] serialize(FittedModel model) throws IOException {
        return objectMapper.writeValueAsBytes(cast(model));
    }

    @Override
    public FittedModel deserialize(byte[] bytes) throws IOException {
        SeasonalRegressionModel model = objectMapper.readValue(bytes, SeasonalRegressionModel.class);
        if (!NAME.equals(model.getEngineName()) || model.getCoefficients() == null
                || model.getCoefficients().length != model.columnCount()) {
            throw new IOException("Serialized model is not a valid " + NAME + " model");
        }
        return model;
    }

    private static double[] changepoints(HyperparameterSet params) {
        int count = Math.max(0, params.getChangepointCount());
        double range = Math.min(1.0, Math.max(0.0, params.getChangepointRange()));
        double[] changepoints = new double[count];
        for (int j = 0; j < count; j++) {
            changepoints[j] = range * (j + 1) / (count + 1);
        }
        return changepoints;
    }

    private static double[] penalties(SeriesKey key, SeasonalRegressionModel model, HyperparameterSet params) {
        double[] penalties = new double[model.columnCount()];
        int col = 0;
        penalties[col++] = TREND_PENALTY;
        penalties[col++] = TREND_PENALTY;
        for (int j = 0; j < model.getChangepoints().length; j++) {
            penalties[col++] = inverse(key, params.getChangepointPriorScale());
        }
        int seasonalColumns = 2 * model.getDailyOrder() + 2 * model.getWeeklyOrder();
        for (int j = 0; j < seasonalColumns; j++) {
            penalties[col++] = inverse(key, params.getSeasonalityPriorScale());
        }
        for (int j = 0; j < CalendarFeatures.indicatorCount(); j++) {
            penalties[col++] = inverse(key, params.getHolidayPriorScale());
        }
        return penalties;
    }

    private static double inverse(SeriesKey key, double priorScale) {
        if (!(priorScale > 0.0)) {
            throw new TrainingFailedException(key, "Prior scale must be positive: " + priorScale);
        }
        return 1.0 / priorScale;
    }

    private static double maxAbs(double[] values) {
        double max = 0.0;
        for (double value : values) {
            max = Math.max(max, Math.abs(value));
        }
        return max;
    }

    private static double clip(double value) {
        return Math.max(0.0, value);
    }

    private static SeasonalRegressionModel cast(FittedModel model) {
        if (model instanceof SeasonalRegressionModel regressionModel) {
            return regressionModel;
        }
        throw new IllegalArgumentException("Model was not produced by " + NAME + ": "
                + (model == null ? "null" : model.getEngineName()));
    }
}
