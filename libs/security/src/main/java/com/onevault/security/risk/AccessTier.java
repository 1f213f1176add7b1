package com.onevault.security.risk;

import java.util.EnumSet;
import java.util.Set;

/**
 * Ordered access tiers, lowest risk first. Declaration order is the severity order.
 */
public enum AccessTier {

    FULL,
    STANDARD,
    /** Allowed only after step-up authentication. */
    ELEVATED,
    DENIED;

    public Set<RequiredControl> requiredControls() {
        return switch (this) {
            case FULL -> EnumSet.noneOf(RequiredControl.class);
            case STANDARD -> EnumSet.of(RequiredControl.ENHANCED_LOGGING);
            case ELEVATED -> EnumSet.of(RequiredControl.MFA_STEP_UP, RequiredControl.ENHANCED_MONITORING);
            case DENIED -> EnumSet.of(RequiredControl.ACCESS_BLOCKED, RequiredControl.SECURITY_REVIEW);
        };
    }

    public boolean isStricterThan(AccessTier other) {
        return compareTo(other) > 0;
    }
}
