package com.khaounen.health.risk;

import com.khaounen.health.errors.ValidationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns weighted risk factors into intervention recommendations. Factors with
 * an impact of 0.3 or less produce nothing. Output is ordered by descending
 * impact; equal impacts keep the input order.
 */
public class RecommendationEngine {

    static final double HIGH_IMPACT = 0.6;
    static final double MEDIUM_IMPACT = 0.3;

    static final List<String> FALLBACK_ACTIONS = List.of("Review and assess factor impact");

    private static final Map<String, List<String>> ACTIONS = Map.of(
            "usage_decline", List.of(
                    "Schedule product training session",
                    "Review feature adoption metrics",
                    "Send usage best practices guide"),
            "payment_issues", List.of(
                    "Schedule financial review meeting",
                    "Review billing history",
                    "Discuss payment terms flexibility"),
            "support_tickets", List.of(
                    "Analyze ticket patterns",
                    "Schedule technical review",
                    "Provide self-service resources"),
            "engagement_drop", List.of(
                    "Schedule executive check-in",
                    "Review success plan",
                    "Increase touchpoint frequency")
    );

    /**
     * @param factors factor name to signal, iterated in the map's own order
     *                (pass a {@link java.util.LinkedHashMap} for reproducible ties)
     */
    public List<Recommendation> recommend(Map<String, FactorSignal> factors) {
        if (factors == null) {
            throw new ValidationException("Risk factors are required", "factors");
        }
        List<Recommendation> recommendations = new ArrayList<>();
        for (Map.Entry<String, FactorSignal> entry : factors.entrySet()) {
            String factor = entry.getKey();
            FactorSignal signal = entry.getValue();
            if (factor == null || factor.isBlank()) {
                throw new ValidationException("Risk factor name is required", "factors");
            }
            if (signal == null) {
                throw new ValidationException("Missing weight/value for factor " + factor, "factors." + factor);
            }
            double impact = signal.impact();
            Priority priority;
            if (impact > HIGH_IMPACT) {
                priority = Priority.HIGH;
            } else if (impact > MEDIUM_IMPACT) {
                priority = Priority.MEDIUM;
            } else {
                continue;
            }
            recommendations.add(new Recommendation(factor, impact, priority, actionsFor(factor), priority.timeline()));
        }
        // List.sort is stable
        recommendations.sort(Comparator.comparingDouble(Recommendation::impact).reversed());
        return List.copyOf(recommendations);
    }

    public static List<String> actionsFor(String factor) {
        return ACTIONS.getOrDefault(factor, FALLBACK_ACTIONS);
    }
}
