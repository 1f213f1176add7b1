package com.onevault.security.session;

import com.onevault.security.DenialReason;
import java.util.EnumSet;
import java.util.Set;

/**
 * Session lifecycle: {@code ISSUED -> ACTIVE -> {EXPIRED | REVOKED | EXHAUSTED}}. Terminal states
 * are absorbing.
 */
public enum SessionState {

    ISSUED,
    ACTIVE,
    EXPIRED,
    REVOKED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == EXPIRED || this == REVOKED || this == EXHAUSTED;
    }

    public Set<SessionState> allowedNext() {
        return switch (this) {
            case ISSUED -> EnumSet.of(ACTIVE, REVOKED);
            case ACTIVE -> EnumSet.of(EXPIRED, REVOKED, EXHAUSTED);
            case EXPIRED, REVOKED, EXHAUSTED -> EnumSet.noneOf(SessionState.class);
        };
    }

    public boolean canTransitionTo(SessionState next) {
        return allowedNext().contains(next);
    }

    /** Denial reason a session in this state produces, or null if the state is not terminal. */
    public DenialReason denialReason() {
        return switch (this) {
            case EXPIRED -> DenialReason.EXPIRED;
            case REVOKED -> DenialReason.REVOKED;
            case EXHAUSTED -> DenialReason.EXHAUSTED;
            case ISSUED, ACTIVE -> null;
        };
    }
}
