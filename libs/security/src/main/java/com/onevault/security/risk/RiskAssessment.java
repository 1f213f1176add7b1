package com.onevault.security.risk;

import java.util.Map;
import java.util.Set;

/**
 * Result of scoring one request.
 *
 * @param score    weighted mean in [0, 100]
 * @param tier     tier the score falls into
 * @param signals  individual signal scores, after degradation
 * @param degraded signals whose source failed and were scored 100
 */
public record RiskAssessment(double score, AccessTier tier, Map<RiskSignalType, Double> signals,
                             Set<RiskSignalType> degraded) {

    public RiskAssessment {
        signals = Map.copyOf(signals);
        degraded = Set.copyOf(degraded);
    }

    public Set<RequiredControl> requiredControls() {
        return tier.requiredControls();
    }

    public boolean denied() {
        return tier == AccessTier.DENIED;
    }
}
