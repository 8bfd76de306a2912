package com.khaounen.health.assessment;

import com.khaounen.health.scoring.HealthScore;

/**
 * Produces the raw risk score of a customer. Typically backed by a trained
 * model; the service clamps the score to [0, 100] and rejects NaN.
 */
@FunctionalInterface
public interface RiskScorer {
    RiskEstimate estimate(String customerId, CustomerMetrics metrics, HealthScore health);
}
