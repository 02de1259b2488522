package com.company.forecasting.config;

import com.company.forecasting.domain.AnomalyRules;
import com.company.forecasting.domain.HyperparameterSet;
import com.company.forecasting.domain.enums.SeasonalityMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds {@code forecasting.*} from application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "forecasting")
public class ForecastingProperties {

    /** History fetched for training. */
    @NotNull
    private Duration lookback = Duration.ofDays(30);

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private double confidenceLevel = 0.8;

    /** How long callers wait for a training run before giving up. */
    @NotNull
    private Duration trainingTimeout = Duration.ofMinutes(10);

    /** Stored models older than this are retrained even when no new data arrived. */
    private Duration modelMaxAge = Duration.ofHours(24);

    @Valid
    private Features features = new Features();
    @Valid
    private Training training = new Training();
    @Valid
    private Tuning tuning = new Tuning();
    @Valid
    private Anomaly anomaly = new Anomaly();
    @Valid
    private Completeness completeness = new Completeness();
    @Valid
    private ModelStore modelStore = new ModelStore();
    @Valid
    private Refresh refresh = new Refresh();
    @Valid
    private Cleanup cleanup = new Cleanup();

    @Data
    public static class Features {
        private ZoneId zoneId = ZoneId.of("UTC");
    }

    @Data
    public static class Training {
        @Min(2)
        private int minPoints = 48;
        @Min(1)
        private int poolSize = 4;
    }

    @Data
    public static class Tuning {
        private boolean enabled = true;
        @Min(1)
        private int cvFolds = 3;
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double holdoutFraction = 0.2;
        private int minPointsForCv = 100;
        @Min(1)
        private int maxCombinations = 50;
        @Min(1)
        private int poolSize = 4;
        @Valid
        private Grid grid = new Grid();
        @Valid
        private Defaults defaults = new Defaults();
    }

    @Data
    public static class Grid {
        @NotEmpty
        private List<SeasonalityMode> seasonalityModes =
                new ArrayList<>(List.of(SeasonalityMode.ADDITIVE, SeasonalityMode.MULTIPLICATIVE));
        @NotEmpty
        private List<Double> changepointPriorScales = new ArrayList<>(List.of(0.001, 0.01, 0.05, 0.1, 0.5));
        @NotEmpty
        private List<Double> seasonalityPriorScales = new ArrayList<>(List.of(2.0, 12.0, 24.0, 48.0));
        @NotEmpty
        private List<Double> holidayPriorScales = new ArrayList<>(List.of(10.0));
        @NotEmpty
        private List<Double> changepointRanges = new ArrayList<>(List.of(0.8, 0.9, 0.95));
        @NotEmpty
        private List<Integer> changepointCounts = new ArrayList<>(List.of(25));
        @NotEmpty
        private List<Boolean> dailySeasonality = new ArrayList<>(List.of(true, false));
        @NotEmpty
        private List<Boolean> weeklySeasonality = new ArrayList<>(List.of(true, false));
    }

    @Data
    public static class Defaults {
        private SeasonalityMode seasonalityMode = SeasonalityMode.ADDITIVE;
        private double changepointPriorScale = 0.05;
        private double seasonalityPriorScale = 10.0;
        private double holidayPriorScale = 10.0;
        private double changepointRange = 0.8;
        private int changepointCount = 25;
        private boolean dailySeasonality = true;
        private boolean weeklySeasonality = true;

        public HyperparameterSet toHyperparameterSet() {
            return HyperparameterSet.builder()
                    .seasonalityMode(seasonalityMode)
                    .changepointPriorScale(changepointPriorScale)
                    .seasonalityPriorScale(seasonalityPriorScale)
                    .holidayPriorScale(holidayPriorScale)
                    .changepointRange(changepointRange)
                    .changepointCount(changepointCount)
                    .dailySeasonality(dailySeasonality)
                    .weeklySeasonality(weeklySeasonality)
                    .build();
        }
    }

    @Data
    public static class Anomaly {
        @Min(1)
        private int windowSize = 24;
        @DecimalMin(value = "0.0", inclusive = false)
        private double threshold = 3.0;
        /** Window points required before the z-score rule may flag. */
        @Min(1)
        private int minPoints = 3;
        @DecimalMin(value = "0.0", inclusive = false)
        private double predictionErrorPercent = 30.0;
        @DecimalMin(value = "0.0", inclusive = false)
        private double predictionErrorHighPercent = 50.0;
        @DecimalMin(value = "0.0", inclusive = false)
        private double rateOfChangeHigh = 30.0;
        /** Per-metric limits, keyed by metric name. */
        @Valid
        private Map<String, MetricRules> metrics = defaultMetricRules();

        public AnomalyRules rulesFor(String metric) {
            MetricRules overrides = metrics.get(metric);
            AnomalyRules.AnomalyRulesBuilder rules = AnomalyRules.builder()
                    .threshold(threshold)
                    .minPoints(minPoints)
                    .rateOfChangeHigh(rateOfChangeHigh)
                    .predictionErrorPercent(predictionErrorPercent)
                    .predictionErrorHighPercent(predictionErrorHighPercent);
            if (overrides != null) {
                if (overrides.getThreshold() != null) {
                    rules.threshold(overrides.getThreshold());
                }
                rules.criticalLevel(overrides.getCriticalLevel())
                        .rateOfChange(overrides.getRateOfChange());
            }
            return rules.build();
        }

        private static Map<String, MetricRules> defaultMetricRules() {
            Map<String, MetricRules> defaults = new LinkedHashMap<>();
            defaults.put("cpu.usage.average", new MetricRules(null, 80.0, 20.0));
            defaults.put("memory.usage.average", new MetricRules(null, 90.0, 15.0));
            return defaults;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MetricRules {
        /** Overrides the global z-score threshold. */
        @DecimalMin(value = "0.0", inclusive = false)
        private Double threshold;
        private Double criticalLevel;
        @DecimalMin(value = "0.0", inclusive = false)
        private Double rateOfChange;
    }

    @Data
    public static class Completeness {
        @DecimalMin("1.0")
        private double tolerance = 1.5;
    }

    @Data
    public static class ModelStore {
        /** {@code redis} or {@code filesystem} */
        private String type = "redis";
        private String keyPrefix = "fc:model:";
        private Duration ttl = Duration.ofDays(30);
        private Path directory = Paths.get("models");
    }

    @Data
    public static class Refresh {
        private boolean enabled = true;
        private String cron = "0 */30 * * * *";
        private int horizon = 48;
        private String frequency = "30min";
    }

    @Data
    public static class Cleanup {
        private boolean enabled = true;
        private String cron = "0 0 3 * * *";
        private Duration retention = Duration.ofDays(30);
    }
}
