package com.khaounen.health.errors;

public class ValidationException extends RiskAssessmentException {

    public ValidationException(String message, String field) {
        super(message, null, field);
    }

    public ValidationException(String message, String customerId, String field) {
        super(message, customerId, field);
    }

    public static double requireInRange(String field, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new ValidationException(field + " must be between " + min + " and " + max + " but was " + value, field);
        }
        return value;
    }
}
