package com.khaounen.health.risk;

import com.khaounen.health.errors.ValidationException;

/**
 * Maps a risk score to its severity tier. Each tier includes its lower
 * bound, so exactly 90 is CRITICAL and exactly 75 is HIGH.
 */
public final class RiskClassifier {

    public static final double CRITICAL_THRESHOLD = 90.0;
    public static final double HIGH_THRESHOLD = 75.0;
    public static final double MEDIUM_THRESHOLD = 50.0;

    private RiskClassifier() {}

    public static SeverityLevel classify(double score) {
        ValidationException.requireInRange("score", score, 0.0, 100.0);
        if (score >= CRITICAL_THRESHOLD) {
            return SeverityLevel.CRITICAL;
        }
        if (score >= HIGH_THRESHOLD) {
            return SeverityLevel.HIGH;
        }
        if (score >= MEDIUM_THRESHOLD) {
            return SeverityLevel.MEDIUM;
        }
        return SeverityLevel.LOW;
    }
}
