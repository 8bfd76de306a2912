package com.khaounen.health.assessment;

import com.khaounen.health.risk.RiskProfile;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRiskProfileStore implements RiskProfileStore {

    private final Map<String, RiskProfile> latest = new ConcurrentHashMap<>();

    @Override
    public RiskProfile save(RiskProfile profile) {
        RiskProfile stored = profile.id() == null ? profile.withId(UUID.randomUUID()) : profile;
        latest.merge(stored.customerId(), stored, (existing, incoming) ->
                incoming.assessedAt().isBefore(existing.assessedAt()) ? existing : incoming);
        return stored;
    }

    @Override
    public Optional<RiskProfile> loadLatest(String customerId) {
        return Optional.ofNullable(latest.get(customerId));
    }

    @Override
    public List<RiskProfile> findLatestAtOrAbove(double minScore) {
        return latest.values().stream()
                .filter(profile -> profile.score() >= minScore)
                .sorted(Comparator.comparingDouble(RiskProfile::score).reversed())
                .toList();
    }
}
