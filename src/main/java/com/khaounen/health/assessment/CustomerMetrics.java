package com.khaounen.health.assessment;

import com.khaounen.health.errors.MissingDataException;
import com.khaounen.health.errors.ValidationException;
import com.khaounen.health.risk.FactorSignal;
import com.khaounen.health.scoring.HealthCategory;
import com.khaounen.health.scoring.ScoreAggregator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized inputs of one assessment. Category sub-scores are in [0, 100].
 * Factor signals are optional; when empty they are derived from the
 * sub-scores by {@link RiskFactorAnalyzer}.
 */
public record CustomerMetrics(
        Map<HealthCategory, Double> categoryScores,
        Map<String, FactorSignal> factorSignals
) {
    public CustomerMetrics {
        Map<HealthCategory, Double> scores = new EnumMap<>(HealthCategory.class);
        if (categoryScores != null) {
            categoryScores.forEach((category, score) -> {
                if (category == null) {
                    throw new ValidationException("Health category is required", "category");
                }
                if (score == null) {
                    throw new MissingDataException("Missing sub-score for category " + category.key(), category.key());
                }
                ValidationException.requireInRange(category.key(), score, ScoreAggregator.MIN_SCORE, ScoreAggregator.MAX_SCORE);
                scores.put(category, score);
            });
        }
        Map<String, FactorSignal> signals = new LinkedHashMap<>();
        if (factorSignals != null) {
            factorSignals.forEach((factor, signal) -> {
                if (factor == null || factor.isBlank()) {
                    throw new ValidationException("Risk factor name is required", "factors");
                }
                if (signal == null) {
                    throw new ValidationException("Missing weight/value for factor " + factor, "factors." + factor);
                }
                signals.put(factor, signal);
            });
        }
        categoryScores = Collections.unmodifiableMap(scores);
        factorSignals = Collections.unmodifiableMap(signals);
    }

    public static CustomerMetrics of(Map<String, Double> categoryScores) {
        return of(categoryScores, Map.of());
    }

    public static CustomerMetrics of(Map<String, Double> categoryScores, Map<String, FactorSignal> factorSignals) {
        Map<HealthCategory, Double> scores = new EnumMap<>(HealthCategory.class);
        if (categoryScores != null) {
            categoryScores.forEach((key, score) -> scores.put(HealthCategory.fromKey(key), score));
        }
        return new CustomerMetrics(scores, factorSignals);
    }
}
