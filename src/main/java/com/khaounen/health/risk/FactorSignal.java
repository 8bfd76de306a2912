package com.khaounen.health.risk;

import com.khaounen.health.errors.ValidationException;

/**
 * One weighted risk signal: {@code value} is how bad the factor currently is,
 * {@code weight} how much it matters. Both in [0, 1].
 */
public record FactorSignal(double weight, double value) {

    public FactorSignal {
        ValidationException.requireInRange("weight", weight, 0.0, 1.0);
        ValidationException.requireInRange("value", value, 0.0, 1.0);
    }

    public double impact() {
        return weight * value;
    }
}
