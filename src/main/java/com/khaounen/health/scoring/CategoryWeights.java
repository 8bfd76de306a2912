package com.khaounen.health.scoring;

import com.khaounen.health.errors.ConfigurationException;
import com.khaounen.health.errors.ValidationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Validated composite weight table. Built once at configuration time; every
 * category must be present and the weights must sum to 1.0.
 */
public final class CategoryWeights {

    private static final double SUM_TOLERANCE = 1e-9;

    private final Map<HealthCategory, Double> weights;

    private CategoryWeights(Map<HealthCategory, Double> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    public static CategoryWeights defaults() {
        Map<HealthCategory, Double> weights = new EnumMap<>(HealthCategory.class);
        for (HealthCategory category : HealthCategory.values()) {
            weights.put(category, category.defaultWeight());
        }
        return of(weights);
    }

    public static CategoryWeights of(Map<HealthCategory, Double> configured) {
        if (configured == null) {
            throw new ConfigurationException("Category weights are required", "category-weights");
        }
        Map<HealthCategory, Double> weights = new EnumMap<>(HealthCategory.class);
        double sum = 0.0;
        for (HealthCategory category : HealthCategory.values()) {
            Double weight = configured.get(category);
            String field = "category-weights." + category.key();
            if (weight == null) {
                throw new ConfigurationException("Missing weight for category " + category.key(), field);
            }
            if (weight.isNaN() || weight < 0.0 || weight > 1.0) {
                throw new ConfigurationException("Weight for " + category.key() + " must be between 0 and 1 but was " + weight, field);
            }
            weights.put(category, weight);
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new ConfigurationException("Category weights must sum to 1.0 but sum to " + sum, "category-weights");
        }
        return new CategoryWeights(weights);
    }

    public static CategoryWeights fromKeys(Map<String, Double> configured) {
        if (configured == null) {
            throw new ConfigurationException("Category weights are required", "category-weights");
        }
        Map<HealthCategory, Double> weights = new EnumMap<>(HealthCategory.class);
        configured.forEach((key, value) -> {
            try {
                weights.put(HealthCategory.fromKey(key), value);
            } catch (ValidationException ex) {
                throw new ConfigurationException("Unknown category in weight table: " + key, "category-weights." + key);
            }
        });
        return of(weights);
    }

    public double weight(HealthCategory category) {
        return weights.get(category);
    }

    public Map<HealthCategory, Double> asMap() {
        return weights;
    }
}
