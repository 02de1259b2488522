package com.company.forecasting.domain.enums;

public enum EvaluationType {
    CROSS_VALIDATION,
    HOLDOUT,
    IN_SAMPLE,
    SKIPPED
}
