package com.khaounen.health.risk;

import com.khaounen.health.errors.ValidationException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one assessment. Later assessments supersede a profile; nothing
 * mutates it. {@code id} is null until the profile has been stored.
 */
public record RiskProfile(
        UUID id,
        String customerId,
        double score,
        SeverityLevel severityLevel,
        List<RiskFactor> factors,
        List<Recommendation> recommendations,
        Instant assessedAt
) {
    public RiskProfile {
        if (customerId == null || customerId.isBlank()) {
            throw new ValidationException("Customer id is required", "customerId");
        }
        SeverityLevel expected = RiskClassifier.classify(score);
        if (severityLevel != expected) {
            throw new ValidationException(
                    "Severity " + severityLevel + " does not match score " + score + " (expected " + expected + ")",
                    customerId,
                    "severityLevel"
            );
        }
        factors = factors == null ? List.of() : List.copyOf(factors);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        assessedAt = assessedAt == null ? Instant.now() : assessedAt;
    }

    public static RiskProfile assessed(
            String customerId,
            double score,
            List<RiskFactor> factors,
            List<Recommendation> recommendations,
            Instant assessedAt
    ) {
        return new RiskProfile(null, customerId, score, RiskClassifier.classify(score), factors, recommendations, assessedAt);
    }

    public RiskProfile withId(UUID newId) {
        if (newId == null || newId.equals(id)) {
            return this;
        }
        return new RiskProfile(newId, customerId, score, severityLevel, factors, recommendations, assessedAt);
    }

    public long highPriorityCount() {
        return recommendations.stream().filter(r -> r.priority() == Priority.HIGH).count();
    }
}
