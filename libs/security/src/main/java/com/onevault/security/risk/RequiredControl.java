package com.onevault.security.risk;

/** Controls a caller must apply before acting at a given {@link AccessTier}. */
public enum RequiredControl {
    ENHANCED_LOGGING,
    MFA_STEP_UP,
    ENHANCED_MONITORING,
    ACCESS_BLOCKED,
    SECURITY_REVIEW
}
