package com.khaounen.health.alert;

import com.khaounen.health.risk.RiskProfile;

/**
 * Notified once per freshly computed assessment whose score reaches the
 * intervention threshold.
 */
public interface InterventionListener {
    void onHighRisk(RiskProfile profile);
}
