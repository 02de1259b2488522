package com.company.forecasting.domain;

import com.company.forecasting.domain.enums.SeasonalityMode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Value;

/**
 * One immutable point in the tuning search space.
 */
@Value
@Builder(toBuilder = true)
@JsonDeserialize(builder = HyperparameterSet.HyperparameterSetBuilder.class)
public class HyperparameterSet {

    @Builder.Default
    SeasonalityMode seasonalityMode = SeasonalityMode.ADDITIVE;

    @Builder.Default
    double changepointPriorScale = 0.05;

    @Builder.Default
    double seasonalityPriorScale = 10.0;

    @Builder.Default
    double holidayPriorScale = 10.0;

    /** Fraction of the history in which trend changepoints may be placed. */
    @Builder.Default
    double changepointRange = 0.8;

    @Builder.Default
    int changepointCount = 25;

    @Builder.Default
    boolean dailySeasonality = true;

    @Builder.Default
    boolean weeklySeasonality = true;

    public static HyperparameterSet defaults() {
        return HyperparameterSet.builder().build();
    }

    public String describe() {
        return String.format("mode=%s cps=%s sps=%s hps=%s range=%s changepoints=%d daily=%s weekly=%s",
                seasonalityMode, changepointPriorScale, seasonalityPriorScale, holidayPriorScale,
                changepointRange, changepointCount, dailySeasonality, weeklySeasonality);
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class HyperparameterSetBuilder {
    }
}
