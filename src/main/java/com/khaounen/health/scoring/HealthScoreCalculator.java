package com.khaounen.health.scoring;

import com.khaounen.health.errors.MissingDataException;
import com.khaounen.health.errors.ValidationException;

import java.util.EnumMap;
import java.util.Map;

public class HealthScoreCalculator {

    private final ScoreAggregator aggregator;

    public HealthScoreCalculator(ScoreAggregator aggregator) {
        this.aggregator = aggregator;
    }

    /**
     * Builds each category sub-score from its finer metrics, e.g.
     * {@code usage = 0.4 * active_users + 0.4 * feature_adoption + 0.2 * login_frequency}.
     *
     * @param rawMetrics finer metrics per category, each already normalized to [0, 100]
     * @return the sub-score of every category, capped at 100
     * @throws MissingDataException when a category or one of its metrics is absent
     */
    public Map<HealthCategory, Double> componentScores(Map<HealthCategory, Map<String, Double>> rawMetrics) {
        if (rawMetrics == null) {
            throw new MissingDataException("Raw metrics are required", "metrics");
        }
        Map<HealthCategory, Double> scores = new EnumMap<>(HealthCategory.class);
        for (HealthCategory category : HealthCategory.values()) {
            Map<String, Double> metrics = rawMetrics.get(category);
            if (metrics == null) {
                throw new MissingDataException("Missing metrics for category " + category.key(), category.key());
            }
            double score = 0.0;
            for (Map.Entry<String, Double> component : category.componentWeights().entrySet()) {
                String field = category.key() + "." + component.getKey();
                Double metric = metrics.get(component.getKey());
                if (metric == null) {
                    throw new MissingDataException("Missing metric " + field, field);
                }
                ValidationException.requireInRange(field, metric, ScoreAggregator.MIN_SCORE, ScoreAggregator.MAX_SCORE);
                score += component.getValue() * metric;
            }
            scores.put(category, Math.min(ScoreAggregator.MAX_SCORE, score));
        }
        return scores;
    }

    public HealthScore calculate(Map<HealthCategory, Double> subscores) {
        double composite = aggregator.aggregate(subscores);
        double rounded = Math.round(composite * 100.0) / 100.0;
        return new HealthScore(rounded, subscores, HealthStatus.of(rounded));
    }

    public HealthScore calculateFromRaw(Map<HealthCategory, Map<String, Double>> rawMetrics) {
        return calculate(componentScores(rawMetrics));
    }
}
