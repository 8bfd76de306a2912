package com.khaounen.health.errors;

public class ComputationException extends RiskAssessmentException {

    public ComputationException(String message, String customerId) {
        super(message, customerId, null);
    }

    public ComputationException(String message, String customerId, Throwable cause) {
        super(message, customerId, null, cause);
    }
}
