package com.khaounen.health.errors;

/**
 * Root of the scoring failures. Carries the customer and the offending field
 * when they are known so callers can decide whether to retry, alert or report.
 */
public class RiskAssessmentException extends RuntimeException {

    private String customerId;
    private final String field;

    public RiskAssessmentException(String message, String customerId, String field) {
        super(message);
        this.customerId = customerId;
        this.field = field;
    }

    public RiskAssessmentException(String message, String customerId, String field, Throwable cause) {
        super(message, cause);
        this.customerId = customerId;
        this.field = field;
    }

    /**
     * Attaches the customer to a failure raised below the point where the
     * customer is known. An id already present is kept.
     */
    public RiskAssessmentException withCustomer(String id) {
        if (customerId == null) {
            customerId = id;
        }
        return this;
    }

    public String getCustomerId() {
        return customerId;
    }

    public String getField() {
        return field;
    }
}
