package com.company.forecasting.domain.enums;

public enum SeasonalityMode {
    ADDITIVE("Seasonal terms are added to the trend"),
    MULTIPLICATIVE("Seasonal terms scale the trend; requires strictly positive values");

    private final String description;

    SeasonalityMode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static SeasonalityMode fromString(String mode) {
        if (mode == null) {
            return ADDITIVE;
        }
        try {
            return SeasonalityMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return ADDITIVE;
        }
    }
}
