package com.khaounen.health.errors;

public class ConfigurationException extends RiskAssessmentException {

    public ConfigurationException(String message, String field) {
        super(message, null, field);
    }
}
