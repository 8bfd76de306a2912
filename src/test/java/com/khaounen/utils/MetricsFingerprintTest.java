package com.khaounen.utils;

import com.khaounen.health.assessment.CustomerMetrics;
import com.khaounen.health.risk.FactorSignal;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class MetricsFingerprintTest {

    @Test
    void insertionOrderDoesNotMatter() {
        Map<String, Double> a = new LinkedHashMap<>();
        a.put("usage", 62.0);
        a.put("financial", 68.0);
        a.put("support", 54.0);
        a.put("engagement", 81.0);
        Map<String, Double> b = new LinkedHashMap<>();
        b.put("engagement", 81.0);
        b.put("usage", 62.0);
        b.put("support", 54.0);
        b.put("financial", 68.0);

        assertEquals(MetricsFingerprint.of(CustomerMetrics.of(a)), MetricsFingerprint.of(CustomerMetrics.of(b)));
    }

    @Test
    void anyScoreChangeChangesFingerprint() {
        String base = MetricsFingerprint.of(CustomerMetrics.of(
                Map.of("usage", 62.0, "engagement", 81.0, "support", 54.0, "financial", 68.0)));
        String changed = MetricsFingerprint.of(CustomerMetrics.of(
                Map.of("usage", 62.0, "engagement", 81.0, "support", 54.5, "financial", 68.0)));

        assertNotEquals(base, changed);
        assertEquals(64, base.length());
    }

    @Test
    void factorSignalsAreIncluded() {
        Map<String, Double> scores = Map.of("usage", 62.0, "engagement", 81.0, "support", 54.0, "financial", 68.0);

        String derived = MetricsFingerprint.of(CustomerMetrics.of(scores));
        String supplied = MetricsFingerprint.of(CustomerMetrics.of(scores,
                Map.of("usage_decline", new FactorSignal(0.9, 0.4))));

        assertNotEquals(derived, supplied);
    }

    @Test
    void subMicroDifferencesChangeFingerprint() {
        Map<String, Double> scores = Map.of("usage", 62.0, "engagement", 81.0, "support", 54.0, "financial", 68.0);

        String above = MetricsFingerprint.of(CustomerMetrics.of(scores,
                Map.of("usage_decline", new FactorSignal(1.0, 0.3000001))));
        String atThreshold = MetricsFingerprint.of(CustomerMetrics.of(scores,
                Map.of("usage_decline", new FactorSignal(1.0, 0.3))));
        String nudgedScore = MetricsFingerprint.of(CustomerMetrics.of(
                Map.of("usage", 62.0000001, "engagement", 81.0, "support", 54.0, "financial", 68.0)));

        assertNotEquals(above, atThreshold);
        assertNotEquals(MetricsFingerprint.of(CustomerMetrics.of(scores)), nudgedScore);
    }

    @Test
    void factorNamesContainingSeparatorsDoNotCollide() {
        Map<String, Double> scores = Map.of("usage", 62.0, "engagement", 81.0, "support", 54.0, "financial", 68.0);
        Map<String, FactorSignal> two = new LinkedHashMap<>();
        two.put("p", new FactorSignal(0.5, 0.5));
        two.put("q", new FactorSignal(0.5, 0.5));
        Map<String, FactorSignal> one = new LinkedHashMap<>();
        one.put("p=0.5x0.5|q", new FactorSignal(0.5, 0.5));

        assertNotEquals(MetricsFingerprint.of(CustomerMetrics.of(scores, two)),
                MetricsFingerprint.of(CustomerMetrics.of(scores, one)));
    }

    @Test
    void sha256IsHex() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", MetricsFingerprint.sha256(""));
    }
}
