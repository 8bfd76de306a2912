package com.khaounen.health.assessment;

import java.util.Map;

/**
 * Supplies a customer's current category sub-scores keyed by category name
 * ({@code usage}, {@code engagement}, {@code support}, {@code financial}),
 * each normalized to [0, 100].
 */
@FunctionalInterface
public interface MetricsProvider {
    Map<String, Double> getCustomerMetrics(String customerId);
}
