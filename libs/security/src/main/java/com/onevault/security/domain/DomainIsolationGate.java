package com.onevault.security.domain;

import com.onevault.identity.HashKey;
import com.onevault.security.AccessAction;
import com.onevault.security.DenialReason;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an actor may act on a resource of a knowledge domain.
 *
 * <p>The gate knows nothing about risk. A low risk score never widens what it allows, and there is
 * no default-allow path: an actor without an active assignment is refused everything.
 *
 * <p>Checks run in a fixed order and the first failure wins:
 * <ol>
 *   <li>no active assignment: {@code NO_DOMAIN_ASSIGNED}</li>
 *   <li>resource domain differs from the assigned one, or is on the forbidden list:
 *       {@code CROSS_DOMAIN_VIOLATION}</li>
 *   <li>category on the deny-list: {@code FORBIDDEN_CATEGORY}</li>
 *   <li>category missing from a non-empty allow-list: {@code CATEGORY_NOT_ALLOWED}</li>
 *   <li>action not permitted: {@code ACTION_NOT_PERMITTED}</li>
 * </ol>
 */
public final class DomainIsolationGate {

    private static final Logger log = LoggerFactory.getLogger(DomainIsolationGate.class);

    private final DomainAssignmentRegistry registry;

    public DomainIsolationGate(DomainAssignmentRegistry registry) {
        this.registry = registry;
    }

    public AccessDecision authorize(HashKey actorKey, String resourceDomain, AccessAction action) {
        return authorize(actorKey, resourceDomain, action, null);
    }

    /**
     * @param resourceCategory data category of the resource, null when the caller has none; an
     *                         uncategorized resource passes the deny-list but not an allow-list
     */
    public AccessDecision authorize(HashKey actorKey, String resourceDomain, AccessAction action,
                                    String resourceCategory) {
        if (actorKey == null || resourceDomain == null || action == null) {
            throw new IllegalArgumentException("actorKey, resourceDomain and action are required");
        }
        Optional<DomainAssignment> assignment = registry.current(actorKey);
        if (assignment.isEmpty()) {
            return deny(actorKey, resourceDomain, action, DenialReason.NO_DOMAIN_ASSIGNED);
        }
        DomainGrant grant = assignment.get().grant();

        if (!grant.domain().equals(resourceDomain) || grant.forbiddenDomains().contains(resourceDomain)) {
            return deny(actorKey, resourceDomain, action, DenialReason.CROSS_DOMAIN_VIOLATION);
        }
        if (resourceCategory != null && grant.forbiddenCategories().contains(resourceCategory)) {
            return deny(actorKey, resourceDomain, action, DenialReason.FORBIDDEN_CATEGORY);
        }
        if (!grant.allowedCategories().isEmpty()
                && (resourceCategory == null || !grant.allowedCategories().contains(resourceCategory))) {
            return deny(actorKey, resourceDomain, action, DenialReason.CATEGORY_NOT_ALLOWED);
        }
        if (!grant.permittedActions().contains(action)) {
            return deny(actorKey, resourceDomain, action, DenialReason.ACTION_NOT_PERMITTED);
        }
        return AccessDecision.allow();
    }

    private AccessDecision deny(HashKey actorKey, String resourceDomain, AccessAction action, DenialReason reason) {
        log.info("Domain gate refused {} {} on {}: {}", actorKey.shortHex(), action, resourceDomain, reason.code());
        return AccessDecision.deny(reason);
    }
}
