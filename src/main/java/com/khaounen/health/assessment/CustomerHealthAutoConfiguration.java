package com.khaounen.health.assessment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.health.alert.InterventionAlertDispatcher;
import com.khaounen.health.alert.InterventionAlertProperties;
import com.khaounen.health.alert.InterventionListener;
import com.khaounen.health.cache.RiskProfileCache;
import com.khaounen.health.errors.ConfigurationException;
import com.khaounen.health.risk.RecommendationEngine;
import com.khaounen.health.scoring.CategoryWeights;
import com.khaounen.health.scoring.HealthScoreCalculator;
import com.khaounen.health.scoring.ScoreAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.mail.javamail.JavaMailSender;

@Slf4j
@AutoConfiguration
@ConditionalOnProperty(prefix = "customer-health", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties({CustomerHealthProperties.class, InterventionAlertProperties.class})
public class CustomerHealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CategoryWeights categoryWeights(CustomerHealthProperties properties) {
        return CategoryWeights.fromKeys(properties.getCategoryWeights());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScoreAggregator scoreAggregator(CategoryWeights categoryWeights) {
        return new ScoreAggregator(categoryWeights);
    }

    @Bean
    @ConditionalOnMissingBean
    public HealthScoreCalculator healthScoreCalculator(ScoreAggregator scoreAggregator) {
        return new HealthScoreCalculator(scoreAggregator);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecommendationEngine recommendationEngine() {
        return new RecommendationEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public RiskFactorAnalyzer riskFactorAnalyzer(CustomerHealthProperties properties) {
        return new RiskFactorAnalyzer(properties.getFactorWeights());
    }

    @Bean
    @ConditionalOnMissingBean
    public RiskScorer riskScorer() {
        return new HealthInverseRiskScorer();
    }

    @Bean
    @ConditionalOnMissingBean
    public RiskProfileCache riskProfileCache(CustomerHealthProperties properties) {
        return new RiskProfileCache(properties.getCache().getProfileTtl());
    }

    @Bean
    @ConditionalOnMissingBean
    public RiskProfileStore riskProfileStore(
            CustomerHealthProperties properties,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider
    ) {
        CustomerHealthProperties.Store store = properties.getStore();
        StringRedisTemplate redis = store.getType() == CustomerHealthProperties.StoreType.MEMORY
                ? null
                : redisTemplateProvider.getIfAvailable();
        if (redis == null) {
            if (store.getType() == CustomerHealthProperties.StoreType.REDIS) {
                throw new ConfigurationException("Redis store requested but no StringRedisTemplate is available", "store.type");
            }
            log.info("customer-health: using in-memory risk profile store");
            return new InMemoryRiskProfileStore();
        }
        ObjectMapper objectMapper = objectMapperProvider.getIfAvailable(() -> new ObjectMapper().findAndRegisterModules());
        log.info("customer-health: using redis risk profile store prefix={}", store.getKeyPrefix());
        return new RedisRiskProfileStore(redis, objectMapper, store.getRedisRetention(), store.getKeyPrefix());
    }

    @Bean
    @ConditionalOnMissingBean
    public InterventionListener interventionListener(
            InterventionAlertProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<JavaMailSender> mailSenderProvider
    ) {
        return new InterventionAlertDispatcher(properties, objectMapperProvider, mailSenderProvider);
    }

    @Bean
    @ConditionalOnMissingBean
    public RiskAssessmentService riskAssessmentService(
            HealthScoreCalculator healthScoreCalculator,
            RiskScorer riskScorer,
            RiskFactorAnalyzer riskFactorAnalyzer,
            RecommendationEngine recommendationEngine,
            RiskProfileCache riskProfileCache,
            RiskProfileStore riskProfileStore,
            ObjectProvider<MetricsProvider> metricsProvider,
            InterventionListener interventionListener,
            CustomerHealthProperties properties
    ) {
        return new RiskAssessmentService(
                healthScoreCalculator,
                riskScorer,
                riskFactorAnalyzer,
                recommendationEngine,
                riskProfileCache,
                riskProfileStore,
                metricsProvider.getIfAvailable(),
                interventionListener,
                properties
        );
    }
}
