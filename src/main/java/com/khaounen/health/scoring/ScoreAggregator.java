package com.khaounen.health.scoring;

import com.khaounen.health.errors.MissingDataException;
import com.khaounen.health.errors.ValidationException;

import java.util.Map;

/**
 * Blends category sub-scores into a composite health score in [0, 100].
 * A category absent from the input is an error, never a silent zero.
 */
public class ScoreAggregator {

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 100.0;

    private final CategoryWeights weights;

    public ScoreAggregator(CategoryWeights weights) {
        this.weights = weights;
    }

    public double aggregate(Map<HealthCategory, Double> subscores) {
        if (subscores == null) {
            throw new MissingDataException("Category sub-scores are required", "subscores");
        }
        double composite = 0.0;
        for (HealthCategory category : HealthCategory.values()) {
            Double subscore = subscores.get(category);
            if (subscore == null) {
                throw new MissingDataException("Missing sub-score for category " + category.key(), category.key());
            }
            ValidationException.requireInRange(category.key(), subscore, MIN_SCORE, MAX_SCORE);
            composite += weights.weight(category) * subscore;
        }
        return clamp(composite);
    }

    public CategoryWeights weights() {
        return weights;
    }

    static double clamp(double value) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, value));
    }
}
