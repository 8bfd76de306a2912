package com.khaounen.health.assessment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.health.errors.ComputationException;
import com.khaounen.health.risk.RiskProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Keeps the latest profile per customer as JSON under
 * {@code <prefix>:profile:<customerId>} and the latest scores in the sorted
 * set {@code <prefix>:latest-scores}. An older assessment never replaces a
 * newer one; the check and the write are not atomic across processes.
 */
@Slf4j
public class RedisRiskProfileStore implements RiskProfileStore {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Duration retention;
    private final String keyPrefix;

    public RedisRiskProfileStore(StringRedisTemplate redis, ObjectMapper objectMapper, Duration retention, String keyPrefix) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.retention = retention;
        this.keyPrefix = keyPrefix == null || keyPrefix.isBlank() ? "risk" : keyPrefix;
    }

    @Override
    public RiskProfile save(RiskProfile profile) {
        RiskProfile stored = profile.id() == null ? profile.withId(UUID.randomUUID()) : profile;
        Optional<RiskProfile> existing = loadLatest(stored.customerId());
        if (existing.isPresent() && stored.assessedAt().isBefore(existing.get().assessedAt())) {
            log.debug("kept newer risk profile customer={} assessedAt={}", stored.customerId(), existing.get().assessedAt());
            return stored;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(stored);
        } catch (JsonProcessingException ex) {
            throw new ComputationException("Failed to serialize risk profile", stored.customerId(), ex);
        }
        String key = profileKey(stored.customerId());
        if (retention != null && !retention.isZero() && !retention.isNegative()) {
            redis.opsForValue().set(key, json, retention);
        } else {
            redis.opsForValue().set(key, json);
        }
        redis.opsForZSet().add(scoresKey(), stored.customerId(), stored.score());
        return stored;
    }

    @Override
    public Optional<RiskProfile> loadLatest(String customerId) {
        String json = redis.opsForValue().get(profileKey(customerId));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, RiskProfile.class));
        } catch (JsonProcessingException ex) {
            throw new ComputationException("Failed to read stored risk profile", customerId, ex);
        }
    }

    @Override
    public List<RiskProfile> findLatestAtOrAbove(double minScore) {
        Set<String> customerIds = redis.opsForZSet().reverseRangeByScore(scoresKey(), minScore, Double.MAX_VALUE);
        if (customerIds == null || customerIds.isEmpty()) {
            return List.of();
        }
        List<RiskProfile> profiles = new ArrayList<>(customerIds.size());
        for (String customerId : customerIds) {
            Optional<RiskProfile> profile = loadLatest(customerId);
            if (profile.isPresent()) {
                profiles.add(profile.get());
            } else {
                // profile expired under its retention; drop the dangling score
                redis.opsForZSet().remove(scoresKey(), customerId);
                log.debug("dropped expired risk score customer={}", customerId);
            }
        }
        profiles.sort(Comparator.comparingDouble(RiskProfile::score).reversed());
        return profiles;
    }

    private String profileKey(String customerId) {
        return keyPrefix + ":profile:" + customerId;
    }

    private String scoresKey() {
        return keyPrefix + ":latest-scores";
    }
}
