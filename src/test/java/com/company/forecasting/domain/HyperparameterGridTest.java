package com.company.forecasting.domain;

import com.company.forecasting.domain.enums.SeasonalityMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HyperparameterGrid")
class HyperparameterGridTest {

    @Test
    @DisplayName("Cartesian product varies the first option list slowest")
    void cartesianOrder() {
        // When
        HyperparameterGrid grid = HyperparameterGrid.cartesian(
                List.of(SeasonalityMode.ADDITIVE, SeasonalityMode.MULTIPLICATIVE),
                List.of(0.01, 0.1),
                List.of(10.0),
                List.of(10.0),
                List.of(0.8),
                List.of(25),
                List.of(true),
                List.of(true, false),
                HyperparameterSet.defaults());

        // Then
        assertThat(grid.size()).isEqualTo(8);
        assertThat(grid.get(0).getSeasonalityMode()).isEqualTo(SeasonalityMode.ADDITIVE);
        assertThat(grid.get(0).getChangepointPriorScale()).isEqualTo(0.01);
        assertThat(grid.get(0).isWeeklySeasonality()).isTrue();
        assertThat(grid.get(1).isWeeklySeasonality()).isFalse();
        assertThat(grid.get(2).getChangepointPriorScale()).isEqualTo(0.1);
        assertThat(grid.get(4).getSeasonalityMode()).isEqualTo(SeasonalityMode.MULTIPLICATIVE);
        assertThat(grid.get(7).getChangepointPriorScale()).isEqualTo(0.1);
        assertThat(grid.get(7).isWeeklySeasonality()).isFalse();
    }

    @Test
    @DisplayName("Limiting takes evenly spaced candidates in grid order")
    void limitToStride() {
        // Given 10 candidates distinguished by changepoint count
        List<Integer> counts = List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        HyperparameterGrid grid = HyperparameterGrid.cartesian(
                List.of(SeasonalityMode.ADDITIVE), List.of(0.05), List.of(10.0), List.of(10.0),
                List.of(0.8), counts, List.of(true), List.of(true), HyperparameterSet.defaults());

        // When
        HyperparameterGrid limited = grid.limitTo(4);

        // Then indices floor(i * 10 / 4) = 0, 2, 5, 7
        assertThat(limited.getCandidates()).extracting(HyperparameterSet::getChangepointCount)
                .containsExactly(0, 2, 5, 7);
        assertThat(limited.getDefaultSet()).isSameAs(grid.getDefaultSet());
    }

    @Test
    @DisplayName("Limiting a small grid leaves it unchanged")
    void limitToNoop() {
        HyperparameterGrid grid = HyperparameterGrid.singleton(HyperparameterSet.defaults());

        assertThat(grid.limitTo(50)).isSameAs(grid);
        assertThatThrownBy(() -> grid.limitTo(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Empty option lists are rejected")
    void emptyOptions() {
        assertThatThrownBy(() -> HyperparameterGrid.cartesian(
                List.of(), List.of(0.05), List.of(10.0), List.of(10.0),
                List.of(0.8), List.of(25), List.of(true), List.of(true), HyperparameterSet.defaults()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("seasonality modes");
        assertThatThrownBy(() -> new HyperparameterGrid(List.of(), HyperparameterSet.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
