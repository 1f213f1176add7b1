package com.onevault.security.session;

import java.time.Duration;

/**
 * Defaults for {@link SessionEngine}.
 *
 * @param defaultTtl           lifetime used when the caller gives none
 * @param defaultLimits        usage caps used when the caller gives none
 * @param maxTransitionRetries optimistic write attempts before a conflict is surfaced
 */
public record SessionSettings(Duration defaultTtl, SessionLimits defaultLimits, int maxTransitionRetries) {

    public SessionSettings {
        if (defaultTtl == null || defaultTtl.isZero() || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
        if (defaultLimits == null) {
            throw new IllegalArgumentException("defaultLimits must not be null");
        }
        if (maxTransitionRetries < 1) {
            throw new IllegalArgumentException("maxTransitionRetries must be >= 1");
        }
    }

    public static SessionSettings defaults() {
        return new SessionSettings(Duration.ofMinutes(30), SessionLimits.unlimited(), 8);
    }
}
