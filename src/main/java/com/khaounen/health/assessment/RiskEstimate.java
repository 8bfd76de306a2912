package com.khaounen.health.assessment;

public record RiskEstimate(double score, double confidence) {

    public static RiskEstimate certain(double score) {
        return new RiskEstimate(score, 1.0);
    }
}
