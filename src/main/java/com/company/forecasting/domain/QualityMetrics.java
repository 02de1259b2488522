package com.company.forecasting.domain;

import com.company.forecasting.domain.enums.EvaluationType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Value;

import java.util.OptionalDouble;

/**
 * Accuracy of a model against a set of actual values.
 * MAPE and SMAPE are percentages; {@code mape} is null when every actual value is zero.
 */
@Value
@Builder
@JsonDeserialize(builder = QualityMetrics.QualityMetricsBuilder.class)
public class QualityMetrics {
    Double mape;
    double mae;
    double rmse;
    Double smape;
    Double coverage;
    EvaluationType evaluationType;

    @JsonIgnore
    public OptionalDouble mapeValue() {
        return mape == null ? OptionalDouble.empty() : OptionalDouble.of(mape);
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class QualityMetricsBuilder {
    }
}
