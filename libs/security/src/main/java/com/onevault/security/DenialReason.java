package com.onevault.security;

/**
 * Stable, enumerable reason for a refused session or access check. Downstream layers branch on
 * {@link #code()} and never parse messages.
 */
public enum DenialReason {

    // ---- Session ----
    NOT_FOUND("NOT_FOUND"),
    EXPIRED("EXPIRED"),
    REVOKED("REVOKED"),
    EXHAUSTED("EXHAUSTED"),

    // ---- Resource ----
    RESOURCE_NOT_FOUND("RESOURCE_NOT_FOUND"),

    // ---- Risk ----
    RISK_DENIED("RISK_DENIED"),

    // ---- Domain isolation ----
    NO_DOMAIN_ASSIGNED("NO_DOMAIN_ASSIGNED"),
    CROSS_DOMAIN_VIOLATION("CROSS_DOMAIN_VIOLATION"),
    FORBIDDEN_CATEGORY("FORBIDDEN_CATEGORY"),
    CATEGORY_NOT_ALLOWED("CATEGORY_NOT_ALLOWED"),
    ACTION_NOT_PERMITTED("ACTION_NOT_PERMITTED");

    private final String code;

    DenialReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
