package com.khaounen.health.assessment;

import com.khaounen.health.errors.ConfigurationException;
import com.khaounen.health.errors.MissingDataException;
import com.khaounen.health.risk.FactorSignal;
import com.khaounen.health.risk.RiskFactor;
import com.khaounen.health.scoring.HealthCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the risk signals of an assessment. Caller-supplied signals win;
 * otherwise each category contributes its shortfall from a perfect score,
 * {@code 1 - subscore / 100}, under the configured factor weight.
 */
public class RiskFactorAnalyzer {

    public static final Map<HealthCategory, String> FACTOR_NAMES;
    public static final Map<String, Double> DEFAULT_FACTOR_WEIGHTS;

    static {
        Map<HealthCategory, String> names = new EnumMap<>(HealthCategory.class);
        names.put(HealthCategory.USAGE, "usage_decline");
        names.put(HealthCategory.ENGAGEMENT, "engagement_drop");
        names.put(HealthCategory.SUPPORT, "support_tickets");
        names.put(HealthCategory.FINANCIAL, "payment_issues");
        FACTOR_NAMES = Collections.unmodifiableMap(names);

        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("usage_decline", 0.9);
        weights.put("engagement_drop", 0.8);
        weights.put("support_tickets", 0.7);
        weights.put("payment_issues", 0.8);
        DEFAULT_FACTOR_WEIGHTS = Collections.unmodifiableMap(weights);
    }

    private final Map<String, Double> factorWeights;

    public RiskFactorAnalyzer() {
        this(DEFAULT_FACTOR_WEIGHTS);
    }

    public RiskFactorAnalyzer(Map<String, Double> configured) {
        Map<String, Double> weights = new LinkedHashMap<>(DEFAULT_FACTOR_WEIGHTS);
        if (configured != null) {
            configured.forEach((factor, weight) -> {
                if (weight == null || weight.isNaN() || weight < 0.0 || weight > 1.0) {
                    throw new ConfigurationException(
                            "Factor weight for " + factor + " must be between 0 and 1 but was " + weight,
                            "factor-weights." + factor
                    );
                }
                weights.put(factor, weight);
            });
        }
        this.factorWeights = Collections.unmodifiableMap(weights);
    }

    public Map<String, FactorSignal> signals(CustomerMetrics metrics) {
        if (!metrics.factorSignals().isEmpty()) {
            return metrics.factorSignals();
        }
        Map<String, FactorSignal> signals = new LinkedHashMap<>();
        for (HealthCategory category : HealthCategory.values()) {
            Double subscore = metrics.categoryScores().get(category);
            if (subscore == null) {
                throw new MissingDataException("Missing sub-score for category " + category.key(), category.key());
            }
            String factor = FACTOR_NAMES.get(category);
            double shortfall = Math.max(0.0, Math.min(1.0, 1.0 - subscore / 100.0));
            signals.put(factor, new FactorSignal(factorWeights.get(factor), shortfall));
        }
        return Collections.unmodifiableMap(signals);
    }

    public List<RiskFactor> factors(Map<String, FactorSignal> signals, double confidence) {
        List<RiskFactor> factors = new ArrayList<>(signals.size());
        signals.forEach((factor, signal) -> factors.add(RiskFactor.of(factor, signal, confidence)));
        return List.copyOf(factors);
    }

    public Map<String, Double> factorWeights() {
        return factorWeights;
    }
}
