package com.khaounen.health.assessment;

import com.khaounen.health.scoring.HealthScore;

public class HealthInverseRiskScorer implements RiskScorer {
    @Override
    public RiskEstimate estimate(String customerId, CustomerMetrics metrics, HealthScore health) {
        return RiskEstimate.certain(100.0 - health.value());
    }
}
