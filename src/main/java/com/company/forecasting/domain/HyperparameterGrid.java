package com.company.forecasting.domain;

import com.company.forecasting.domain.enums.SeasonalityMode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered candidate list searched by the tuner, plus the set used when tuning is skipped.
 * Candidate order is part of the contract: ties during selection go to the lower index.
 */
@Getter
@ToString
public final class HyperparameterGrid {

    private final List<HyperparameterSet> candidates;
    private final HyperparameterSet defaultSet;

    public HyperparameterGrid(List<HyperparameterSet> candidates, HyperparameterSet defaultSet) {
        Objects.requireNonNull(candidates, "candidates");
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("Hyperparameter grid must contain at least one candidate");
        }
        this.candidates = List.copyOf(candidates);
        this.defaultSet = Objects.requireNonNull(defaultSet, "defaultSet");
    }

    public static HyperparameterGrid singleton(HyperparameterSet set) {
        return new HyperparameterGrid(List.of(set), set);
    }

    public int size() {
        return candidates.size();
    }

    public HyperparameterSet get(int index) {
        return candidates.get(index);
    }

    /**
     * Cartesian product of the option lists. The first list varies slowest:
     * mode, changepoint prior, seasonality prior, holiday prior, changepoint range,
     * changepoint count, daily toggle, weekly toggle.
     */
    public static HyperparameterGrid cartesian(List<SeasonalityMode> modes,
                                               List<Double> changepointPriorScales,
                                               List<Double> seasonalityPriorScales,
                                               List<Double> holidayPriorScales,
                                               List<Double> changepointRanges,
                                               List<Integer> changepointCounts,
                                               List<Boolean> dailyOptions,
                                               List<Boolean> weeklyOptions,
                                               HyperparameterSet defaultSet) {
        List<HyperparameterSet> candidates = new ArrayList<>();
        for (SeasonalityMode mode : nonEmpty(modes, "seasonality modes")) {
            for (Double cps : nonEmpty(changepointPriorScales, "changepoint prior scales")) {
                for (Double sps : nonEmpty(seasonalityPriorScales, "seasonality prior scales")) {
                    for (Double hps : nonEmpty(holidayPriorScales, "holiday prior scales")) {
                        for (Double range : nonEmpty(changepointRanges, "changepoint ranges")) {
                            for (Integer count : nonEmpty(changepointCounts, "changepoint counts")) {
                                for (Boolean daily : nonEmpty(dailyOptions, "daily seasonality options")) {
                                    for (Boolean weekly : nonEmpty(weeklyOptions, "weekly seasonality options")) {
                                        candidates.add(HyperparameterSet.builder()
                                                .seasonalityMode(mode)
                                                .changepointPriorScale(cps)
                                                .seasonalityPriorScale(sps)
                                                .holidayPriorScale(hps)
                                                .changepointRange(range)
                                                .changepointCount(count)
                                                .dailySeasonality(daily)
                                                .weeklySeasonality(weekly)
                                                .build());
                                    }
                                }
                            }
                        }
                    }
                }
            }
        }
        return new HyperparameterGrid(candidates, defaultSet);
    }

    /**
     * Caps the grid at {@code maxCandidates} by taking every candidate at index
     * {@code floor(i * size / maxCandidates)}. The selection is deterministic and keeps grid order.
     */
    public HyperparameterGrid limitTo(int maxCandidates) {
        if (maxCandidates <= 0) {
            throw new IllegalArgumentException("maxCandidates must be positive: " + maxCandidates);
        }
        if (candidates.size() <= maxCandidates) {
            return this;
        }
        List<HyperparameterSet> subset = new ArrayList<>(maxCandidates);
        for (int i = 0; i < maxCandidates; i++) {
            subset.add(candidates.get((int) ((long) i * candidates.size() / maxCandidates)));
        }
        return new HyperparameterGrid(subset, defaultSet);
    }

    private static <T> List<T> nonEmpty(List<T> options, String name) {
        if (options == null || options.isEmpty()) {
            throw new IllegalArgumentException("Grid option list is empty: " + name);
        }
        return options;
    }
}
