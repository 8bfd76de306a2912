package com.khaounen.health.assessment;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.khaounen.health.alert.InterventionListener;
import com.khaounen.health.cache.RiskProfileCache;
import com.khaounen.health.errors.ComputationException;
import com.khaounen.health.errors.ConfigurationException;
import com.khaounen.health.errors.MissingDataException;
import com.khaounen.health.errors.RiskAssessmentException;
import com.khaounen.health.errors.ValidationException;
import com.khaounen.health.risk.FactorSignal;
import com.khaounen.health.risk.Recommendation;
import com.khaounen.health.risk.RecommendationEngine;
import com.khaounen.health.risk.RiskFactor;
import com.khaounen.health.risk.RiskProfile;
import com.khaounen.health.scoring.HealthScore;
import com.khaounen.health.scoring.HealthScoreCalculator;
import com.khaounen.utils.MetricsFingerprint;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point of the scoring core: health score, risk score, severity and
 * recommendations for one customer, served through {@link RiskProfileCache}.
 * Whoever mutates a customer's metrics must call {@link #invalidate(String)}.
 *
 * <p>Each invalidation bumps the customer's generation. A computation that
 * started under an older generation still answers its own callers but is
 * neither stored nor kept in either cache.
 */
@Slf4j
public class RiskAssessmentService {

    private final HealthScoreCalculator healthCalculator;
    private final RiskScorer riskScorer;
    private final RiskFactorAnalyzer factorAnalyzer;
    private final RecommendationEngine recommendationEngine;
    private final RiskProfileCache profileCache;
    private final RiskProfileStore store;
    private final MetricsProvider metricsProvider;
    private final InterventionListener interventionListener;
    private final double interventionThreshold;
    private final double confidenceThreshold;
    private final Clock clock;
    private final Cache<String, HealthScore> healthCache;
    private final ConcurrentMap<String, AtomicLong> generations = new ConcurrentHashMap<>();

    public RiskAssessmentService(
            HealthScoreCalculator healthCalculator,
            RiskScorer riskScorer,
            RiskFactorAnalyzer factorAnalyzer,
            RecommendationEngine recommendationEngine,
            RiskProfileCache profileCache,
            RiskProfileStore store,
            MetricsProvider metricsProvider,
            InterventionListener interventionListener,
            CustomerHealthProperties properties
    ) {
        this(healthCalculator, riskScorer, factorAnalyzer, recommendationEngine, profileCache, store,
                metricsProvider, interventionListener, properties, Clock.systemUTC());
    }

    public RiskAssessmentService(
            HealthScoreCalculator healthCalculator,
            RiskScorer riskScorer,
            RiskFactorAnalyzer factorAnalyzer,
            RecommendationEngine recommendationEngine,
            RiskProfileCache profileCache,
            RiskProfileStore store,
            MetricsProvider metricsProvider,
            InterventionListener interventionListener,
            CustomerHealthProperties properties,
            Clock clock
    ) {
        this.healthCalculator = healthCalculator;
        this.riskScorer = riskScorer;
        this.factorAnalyzer = factorAnalyzer;
        this.recommendationEngine = recommendationEngine;
        this.profileCache = profileCache;
        this.store = store;
        this.metricsProvider = metricsProvider;
        this.interventionListener = interventionListener;
        this.interventionThreshold = configured("intervention-threshold", properties.getInterventionThreshold(), 100.0);
        this.confidenceThreshold = configured("confidence-threshold", properties.getConfidenceThreshold(), 1.0);
        this.clock = clock;
        this.healthCache = Caffeine.newBuilder()
                .expireAfterWrite(positive(properties.getCache().getHealthTtl()))
                .build();
    }

    /**
     * Scores a customer from the given metrics, or returns the cached profile
     * when it was computed from identical metrics within the cache window.
     */
    public RiskProfile assess(String customerId, CustomerMetrics metrics) {
        requireCustomerId(customerId);
        return assess(customerId, metrics, generation(customerId));
    }

    private RiskProfile assess(String customerId, CustomerMetrics metrics, long generation) {
        if (metrics == null) {
            throw new MissingDataException("Customer metrics are required", customerId, "metrics");
        }
        String fingerprint = MetricsFingerprint.of(metrics);
        AtomicBoolean computed = new AtomicBoolean();
        AtomicBoolean stored = new AtomicBoolean();
        RiskProfile profile = profileCache.getOrCompute(customerId, fingerprint, () -> {
            computed.set(true);
            return computeAndStore(customerId, metrics, generation, stored);
        });
        if (computed.get() && !stored.get()) {
            // computed from metrics an invalidation has since replaced
            profileCache.invalidate(customerId, profile);
            return profile;
        }
        if (computed.get() && profile.score() >= interventionThreshold) {
            notifyIntervention(profile);
        }
        return profile;
    }

    /**
     * Serves the fresh cached profile if there is one; otherwise loads the
     * customer's metrics and assesses them.
     */
    public RiskProfile getCachedOrAssess(String customerId) {
        requireCustomerId(customerId);
        Optional<RiskProfile> cached = profileCache.getIfPresent(customerId);
        if (cached.isPresent()) {
            return cached.get();
        }
        long generation = generation(customerId);
        return assess(customerId, loadMetrics(customerId), generation);
    }

    public void invalidate(String customerId) {
        requireCustomerId(customerId);
        // bump before evicting so a racing writer either sees the new generation or is evicted after its write
        generations.computeIfAbsent(customerId, id -> new AtomicLong()).incrementAndGet();
        profileCache.invalidate(customerId);
        healthCache.invalidate(customerId);
    }

    public HealthScore healthScore(String customerId) {
        requireCustomerId(customerId);
        return healthCache.get(customerId, id -> healthCalculator.calculate(loadMetrics(id).categoryScores()));
    }

    public Optional<RiskProfile> findLatest(String customerId) {
        requireCustomerId(customerId);
        return store.loadLatest(customerId);
    }

    public List<RiskProfile> highRiskProfiles() {
        return store.findLatestAtOrAbove(interventionThreshold).stream()
                .sorted(Comparator.comparingDouble(RiskProfile::score).reversed())
                .toList();
    }

    private RiskProfile computeAndStore(String customerId, CustomerMetrics metrics, long generation, AtomicBoolean stored) {
        try {
            HealthScore health = healthCalculator.calculate(metrics.categoryScores());
            RiskEstimate estimate = riskScorer.estimate(customerId, metrics, health);
            if (estimate == null) {
                throw new ComputationException("Risk scorer returned no estimate", customerId);
            }
            double score = bounded(customerId, "score", estimate.score(), 100.0);
            double confidence = bounded(customerId, "confidence", estimate.confidence(), 1.0);
            if (confidence < confidenceThreshold) {
                log.warn("low-confidence risk estimate customer={} confidence={}", customerId, confidence);
            }

            Map<String, FactorSignal> signals = factorAnalyzer.signals(metrics);
            List<RiskFactor> factors = factorAnalyzer.factors(signals, confidence);
            List<Recommendation> recommendations = recommendationEngine.recommend(signals);

            RiskProfile profile = RiskProfile.assessed(customerId, score, factors, recommendations, clock.instant());
            if (generation(customerId) != generation) {
                log.debug("risk assessment superseded by invalidation customer={}, not stored", customerId);
                return profile;
            }
            RiskProfile saved = store.save(profile);
            stored.set(true);
            healthCache.put(customerId, health);
            if (generation(customerId) != generation) {
                healthCache.invalidate(customerId);
            }
            log.info("risk assessed customer={} health={} score={} severity={} recommendations={}",
                    customerId, health.value(), saved.score(), saved.severityLevel(), recommendations.size());
            return saved;
        } catch (RiskAssessmentException ex) {
            throw ex.withCustomer(customerId);
        }
    }

    private long generation(String customerId) {
        AtomicLong current = generations.get(customerId);
        return current == null ? 0L : current.get();
    }

    private CustomerMetrics loadMetrics(String customerId) {
        if (metricsProvider == null) {
            throw new ConfigurationException("No MetricsProvider configured", "metrics-provider");
        }
        Map<String, Double> raw;
        try {
            raw = metricsProvider.getCustomerMetrics(customerId);
        } catch (RiskAssessmentException ex) {
            throw ex.withCustomer(customerId);
        } catch (RuntimeException ex) {
            throw new ComputationException("Failed to load metrics for customer " + customerId, customerId, ex);
        }
        if (raw == null) {
            throw new MissingDataException("No metrics available for customer " + customerId, customerId, "metrics");
        }
        try {
            return CustomerMetrics.of(raw);
        } catch (RiskAssessmentException ex) {
            throw ex.withCustomer(customerId);
        }
    }

    private void notifyIntervention(RiskProfile profile) {
        if (interventionListener == null) {
            return;
        }
        try {
            interventionListener.onHighRisk(profile);
        } catch (RuntimeException ex) {
            log.warn("intervention listener failed customer={}: {}", profile.customerId(), ex.getMessage(), ex);
        }
    }

    private static double bounded(String customerId, String field, double value, double max) {
        if (Double.isNaN(value)) {
            throw new ComputationException("Risk scorer produced NaN " + field, customerId);
        }
        return Math.max(0.0, Math.min(max, value));
    }

    private static double configured(String field, double value, double max) {
        if (Double.isNaN(value) || value < 0.0 || value > max) {
            throw new ConfigurationException(field + " must be between 0 and " + max + " but was " + value, field);
        }
        return value;
    }

    private static Duration positive(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new ConfigurationException("Cache ttl must be positive", "cache.health-ttl");
        }
        return ttl;
    }

    private static void requireCustomerId(String customerId) {
        if (customerId == null || customerId.isBlank()) {
            throw new ValidationException("Customer id is required", "customerId");
        }
    }
}
