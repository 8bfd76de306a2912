package com.khaounen.health.risk;

import com.khaounen.health.errors.ValidationException;

import java.util.Locale;

public record RiskFactor(
        String category,
        double impactScore,
        double weight,
        double confidence,
        String description
) {
    public RiskFactor {
        if (category == null || category.isBlank()) {
            throw new ValidationException("Risk factor category is required", "category");
        }
        ValidationException.requireInRange("impactScore", impactScore, 0.0, 1.0);
        ValidationException.requireInRange("weight", weight, 0.0, 1.0);
        ValidationException.requireInRange("confidence", confidence, 0.0, 1.0);
        description = description == null ? "" : description;
    }

    public static RiskFactor of(String category, FactorSignal signal, double confidence) {
        double impact = Math.max(0.0, Math.min(1.0, signal.impact()));
        String description = String.format(Locale.ROOT,
                "%s at %.2f severity with weight %.2f", category, signal.value(), signal.weight());
        return new RiskFactor(category, impact, signal.weight(), confidence, description);
    }
}
