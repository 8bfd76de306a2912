package com.khaounen.health.assessment;

import com.khaounen.health.risk.RiskProfile;

import java.util.List;
import java.util.Optional;

public interface RiskProfileStore {

    /**
     * Persists a profile as the customer's latest assessment.
     *
     * @return the stored profile, carrying its id
     */
    RiskProfile save(RiskProfile profile);

    Optional<RiskProfile> loadLatest(String customerId);

    /**
     * Latest profiles scoring at least {@code minScore}, highest score first.
     */
    List<RiskProfile> findLatestAtOrAbove(double minScore);
}
