package com.khaounen.health.scoring;

import com.khaounen.health.errors.MissingDataException;
import com.khaounen.health.errors.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoreAggregatorTest {

    private final ScoreAggregator aggregator = new ScoreAggregator(CategoryWeights.defaults());

    @Test
    void perfectSubscoresAggregateToExactlyOneHundred() {
        double composite = aggregator.aggregate(subscores(100, 100, 100, 100));
        assertEquals(100.0, composite);
    }

    @Test
    void weightsEachCategory() {
        assertEquals(66.7, aggregator.aggregate(subscores(62, 81, 54, 68)), 1e-9);
        assertEquals(40.0, aggregator.aggregate(subscores(100, 0, 0, 0)), 1e-9);
        assertEquals(10.0, aggregator.aggregate(subscores(0, 0, 0, 100)), 1e-9);
        assertEquals(0.0, aggregator.aggregate(subscores(0, 0, 0, 0)));
    }

    @Test
    void compositeStaysWithinBoundsForAnyValidInput() {
        double[] samples = {0.0, 0.001, 12.5, 49.999, 50.0, 99.999, 100.0};
        for (double usage : samples) {
            for (double support : samples) {
                double composite = aggregator.aggregate(subscores(usage, 100.0 - usage, support, 100.0));
                assertTrue(composite >= 0.0 && composite <= 100.0, "composite out of range: " + composite);
            }
        }
    }

    @Test
    void missingCategoryIsRejectedRatherThanTreatedAsZero() {
        Map<HealthCategory, Double> partial = subscores(80, 80, 80, 80);
        partial.remove(HealthCategory.SUPPORT);

        MissingDataException ex = assertThrows(MissingDataException.class, () -> aggregator.aggregate(partial));
        assertEquals("support", ex.getField());
    }

    @Test
    void outOfRangeSubscoreIsRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> aggregator.aggregate(subscores(101, 50, 50, 50)));
        assertEquals("usage", ex.getField());
        assertThrows(ValidationException.class, () -> aggregator.aggregate(subscores(50, -1, 50, 50)));
        assertThrows(ValidationException.class, () -> aggregator.aggregate(subscores(50, 50, Double.NaN, 50)));
    }

    static Map<HealthCategory, Double> subscores(double usage, double engagement, double support, double financial) {
        Map<HealthCategory, Double> scores = new EnumMap<>(HealthCategory.class);
        scores.put(HealthCategory.USAGE, usage);
        scores.put(HealthCategory.ENGAGEMENT, engagement);
        scores.put(HealthCategory.SUPPORT, support);
        scores.put(HealthCategory.FINANCIAL, financial);
        return scores;
    }
}
