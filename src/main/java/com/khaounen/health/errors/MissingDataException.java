package com.khaounen.health.errors;

public class MissingDataException extends RiskAssessmentException {

    public MissingDataException(String message, String field) {
        super(message, null, field);
    }

    public MissingDataException(String message, String customerId, String field) {
        super(message, customerId, field);
    }
}
