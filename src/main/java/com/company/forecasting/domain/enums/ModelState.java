package com.company.forecasting.domain.enums;

public enum ModelState {
    NO_MODEL("No model has been trained for the key"),
    TRAINING("A training run is in flight"),
    READY("A current model is stored"),
    STALE("The stored model predates the latest data or exceeded its maximum age");

    private final String description;

    ModelState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isUsable() {
        return this == READY;
    }
}
