package com.khaounen.health.scoring;

import com.khaounen.health.errors.ValidationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record HealthScore(
        double value,
        Map<HealthCategory, Double> components,
        HealthStatus status
) {
    public HealthScore {
        ValidationException.requireInRange("healthScore", value, ScoreAggregator.MIN_SCORE, ScoreAggregator.MAX_SCORE);
        components = components == null || components.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(components));
        status = status == null ? HealthStatus.of(value) : status;
    }
}
