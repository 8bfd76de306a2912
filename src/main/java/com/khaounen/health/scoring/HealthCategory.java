package com.khaounen.health.scoring;

import com.khaounen.health.errors.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The four signal families blended into a composite health score. Each
 * category knows its default composite weight and how its own sub-score is
 * built from finer, pre-normalized metrics.
 */
public enum HealthCategory {
    USAGE("usage", 0.4, metrics("active_users", 0.4, "feature_adoption", 0.4, "login_frequency", 0.2)),
    ENGAGEMENT("engagement", 0.3, metrics("meeting_attendance", 0.3, "response_time", 0.3, "feedback_score", 0.4)),
    SUPPORT("support", 0.2, metrics("ticket_resolution", 0.4, "satisfaction_score", 0.4, "response_time", 0.2)),
    FINANCIAL("financial", 0.1, metrics("payment_history", 0.4, "mrr_growth", 0.4, "expansion_revenue", 0.2));

    private final String key;
    private final double defaultWeight;
    private final Map<String, Double> componentWeights;

    HealthCategory(String key, double defaultWeight, Map<String, Double> componentWeights) {
        this.key = key;
        this.defaultWeight = defaultWeight;
        this.componentWeights = componentWeights;
    }

    public String key() {
        return key;
    }

    public double defaultWeight() {
        return defaultWeight;
    }

    public Map<String, Double> componentWeights() {
        return componentWeights;
    }

    public static HealthCategory fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (HealthCategory category : values()) {
                if (category.key.equals(normalized)) {
                    return category;
                }
            }
        }
        throw new ValidationException("Unknown health category: " + key, "category");
    }

    private static Map<String, Double> metrics(String a, double wa, String b, double wb, String c, double wc) {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(a, wa);
        weights.put(b, wb);
        weights.put(c, wc);
        return Collections.unmodifiableMap(weights);
    }
}
