package com.onevault.audit;

import java.util.Optional;

/**
 * Every kind of audit record the core emits.
 *
 * <p>WHY an enum: compile-time safety and a canonical string for JSON.
 */
public enum AuditEventType {

    // ---- Decisions ----
    ACCESS_ALLOWED("AccessAllowed"),
    ACCESS_DENIED("AccessDenied"),
    RISK_TIER_DENIED("RiskTierDenied"),

    // ---- Sessions ----
    SESSION_STATE_CHANGED("SessionStateChanged"),

    // ---- Mutations ----
    HUB_CREATED("HubCreated"),
    VERSION_APPENDED("VersionAppended"),
    LINK_CREATED("LinkCreated");

    private final String value;

    AuditEventType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<AuditEventType> fromString(String value) {
        for (AuditEventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
