package com.onevault.audit;

import java.time.Instant;

/**
 * Outcome of one authorization decision.
 *
 * @param timestamp      when the decision was taken
 * @param actor          hex hash key of the acting user or agent
 * @param decision       {@code ALLOWED} or {@code DENIED}
 * @param reason         denial reason code, null when allowed
 * @param resourceDomain knowledge domain of the requested resource (null for pure session checks)
 * @param action         requested action, e.g. {@code READ}
 * @param riskScore      risk score in [0, 100] at decision time, null if no session was resolved
 * @param tier           access tier at decision time, null if no session was resolved
 */
public record AuthorizationAudit(
        Instant timestamp,
        String actor,
        String decision,
        String reason,
        String resourceDomain,
        String action,
        Double riskScore,
        String tier) {

    public static final String ALLOWED = "ALLOWED";
    public static final String DENIED = "DENIED";

    public boolean allowed() {
        return ALLOWED.equals(decision);
    }
}
