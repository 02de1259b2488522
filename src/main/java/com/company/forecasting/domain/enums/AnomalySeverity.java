package com.company.forecasting.domain.enums;

public enum AnomalySeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Severity by absolute deviation: 4σ critical, 3σ high, 2σ medium.
     */
    public static AnomalySeverity fromDeviation(double deviation) {
        double magnitude = Math.abs(deviation);
        if (magnitude >= 4.0) return CRITICAL;
        if (magnitude >= 3.0) return HIGH;
        if (magnitude >= 2.0) return MEDIUM;
        return LOW;
    }
}
