package com.khaounen.utils;

import com.khaounen.health.assessment.CustomerMetrics;
import com.khaounen.health.risk.FactorSignal;
import com.khaounen.health.scoring.HealthCategory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;

/**
 * Stable SHA-256 over the metrics an assessment was computed from. Values are
 * rendered exactly, so two metric sets share a fingerprint only when every
 * sub-score, factor name and signal is identical.
 */
public final class MetricsFingerprint {

    private MetricsFingerprint() {}

    public static String of(CustomerMetrics metrics) {
        StringBuilder raw = new StringBuilder();
        for (HealthCategory category : HealthCategory.values()) {
            Double score = metrics.categoryScores().get(category);
            raw.append(category.key()).append('=').append(normalize(score)).append('|');
        }
        raw.append('#');
        for (Map.Entry<String, FactorSignal> signal : metrics.factorSignals().entrySet()) {
            // length prefix keeps names containing separators apart
            raw.append(signal.getKey().length()).append(':').append(signal.getKey())
                    .append('=').append(normalize(signal.getValue().weight()))
                    .append('x').append(normalize(signal.getValue().value()))
                    .append('|');
        }
        return sha256(raw.toString());
    }

    private static String normalize(Double value) {
        if (value == null) return "-";
        return Double.toString(value);
    }

    static String sha256(String raw) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(raw.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Fingerprint error", e);
        }
    }
}
