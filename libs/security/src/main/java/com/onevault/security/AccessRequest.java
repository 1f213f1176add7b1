package com.onevault.security;

import com.onevault.identity.HashKey;
import com.onevault.observability.SensitiveDataRedactor;
import com.onevault.security.risk.RiskContext;

/**
 * One request as handed over by request routing.
 *
 * @param sessionToken     bearer token of the caller's session
 * @param actorKey         hash key the caller claims to act as
 * @param resourceDomain   knowledge domain of the target resource
 * @param action           what the caller wants to do
 * @param resourceCategory data category of the target, null if uncategorized
 * @param riskContext      device, network and timing facts for risk scoring
 */
public record AccessRequest(
        String sessionToken,
        HashKey actorKey,
        String resourceDomain,
        AccessAction action,
        String resourceCategory,
        RiskContext riskContext) {

    public AccessRequest {
        if (actorKey == null) {
            throw new IllegalArgumentException("actorKey must not be null");
        }
        if (resourceDomain == null || resourceDomain.isBlank()) {
            throw new IllegalArgumentException("resourceDomain must not be blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        if (riskContext == null) {
            throw new IllegalArgumentException("riskContext must not be null");
        }
    }

    public AccessRequest withAction(AccessAction newAction) {
        return new AccessRequest(sessionToken, actorKey, resourceDomain, newAction, resourceCategory, riskContext);
    }

    @Override
    public String toString() {
        return "AccessRequest[session=%s, actor=%s, domain=%s, action=%s, category=%s]".formatted(
                SensitiveDataRedactor.reference(sessionToken), actorKey.shortHex(), resourceDomain, action,
                resourceCategory);
    }
}
