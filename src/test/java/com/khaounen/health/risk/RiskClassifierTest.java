package com.khaounen.health.risk;

import com.khaounen.health.errors.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RiskClassifierTest {

    @Test
    void tierBoundariesIncludeTheirLowerBound() {
        assertEquals(SeverityLevel.CRITICAL, RiskClassifier.classify(100.0));
        assertEquals(SeverityLevel.CRITICAL, RiskClassifier.classify(90.0));
        assertEquals(SeverityLevel.HIGH, RiskClassifier.classify(89.999));
        assertEquals(SeverityLevel.HIGH, RiskClassifier.classify(75.0));
        assertEquals(SeverityLevel.MEDIUM, RiskClassifier.classify(74.999));
        assertEquals(SeverityLevel.MEDIUM, RiskClassifier.classify(50.0));
        assertEquals(SeverityLevel.LOW, RiskClassifier.classify(49.999));
        assertEquals(SeverityLevel.LOW, RiskClassifier.classify(0.0));
    }

    @Test
    void everyScoreInRangeMapsToOneTier() {
        for (int i = 0; i <= 10_000; i++) {
            assertNotNull(RiskClassifier.classify(i / 100.0));
        }
    }

    @Test
    void rejectsScoresOutsideRange() {
        assertThrows(ValidationException.class, () -> RiskClassifier.classify(-0.001));
        assertThrows(ValidationException.class, () -> RiskClassifier.classify(100.001));
        assertThrows(ValidationException.class, () -> RiskClassifier.classify(Double.NaN));
    }
}
