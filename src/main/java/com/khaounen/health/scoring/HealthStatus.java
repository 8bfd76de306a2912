package com.khaounen.health.scoring;

public enum HealthStatus {
    CRITICAL,
    WARNING,
    HEALTHY;

    static final double CRITICAL_CEILING = 60.0;
    static final double WARNING_CEILING = 75.0;

    public static HealthStatus of(double healthScore) {
        if (healthScore <= CRITICAL_CEILING) {
            return CRITICAL;
        }
        if (healthScore <= WARNING_CEILING) {
            return WARNING;
        }
        return HEALTHY;
    }
}
