package com.khaounen.health.assessment;

import com.khaounen.health.scoring.HealthCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "customer-health")
public class CustomerHealthProperties {

    private boolean enabled = true;
    private Map<String, Double> categoryWeights = defaultCategoryWeights();
    private Map<String, Double> factorWeights = new LinkedHashMap<>(RiskFactorAnalyzer.DEFAULT_FACTOR_WEIGHTS);
    private double interventionThreshold = 80.0;
    private double confidenceThreshold = 0.9;
    private Cache cache = new Cache();
    private Store store = new Store();

    @Data
    public static class Cache {
        private Duration profileTtl = Duration.ofSeconds(300);
        private Duration healthTtl = Duration.ofSeconds(300);
    }

    @Data
    public static class Store {
        private StoreType type = StoreType.AUTO;
        private String keyPrefix = "risk";
        private Duration redisRetention = Duration.ofDays(30);
    }

    public enum StoreType {
        AUTO,
        MEMORY,
        REDIS
    }

    private static Map<String, Double> defaultCategoryWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (HealthCategory category : HealthCategory.values()) {
            weights.put(category.key(), category.defaultWeight());
        }
        return weights;
    }
}
