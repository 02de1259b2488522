package com.company.forecasting.domain;

import com.company.forecasting.domain.enums.EvaluationType;
import lombok.Builder;
import lombok.Value;

import java.util.OptionalDouble;

@Value
@Builder
public class TuningResult {
    HyperparameterSet bestParams;
    OptionalDouble bestScore;
    EvaluationType evaluationType;
    boolean skipped;
    int candidatesEvaluated;
    int candidatesFailed;

    public static TuningResult skipped(HyperparameterSet defaults) {
        return TuningResult.builder()
                .bestParams(defaults)
                .bestScore(OptionalDouble.empty())
                .evaluationType(EvaluationType.SKIPPED)
                .skipped(true)
                .candidatesEvaluated(0)
                .candidatesFailed(0)
                .build();
    }
}
