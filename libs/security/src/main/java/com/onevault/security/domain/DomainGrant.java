package com.onevault.security.domain;

import com.onevault.security.AccessAction;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * What an actor may touch inside its one knowledge domain.
 *
 * <p>An empty {@code allowedCategories} means "every category not forbidden". An empty
 * {@code permittedActions} permits nothing.
 *
 * @param domain              the knowledge domain the actor is bound to
 * @param allowedCategories   data categories the actor may access, empty for no allow-list
 * @param forbiddenCategories data categories always refused, even if allowed
 * @param forbiddenDomains    domains the actor must never reach, checked with the domain itself
 * @param permittedActions    actions the actor may perform
 */
public record DomainGrant(
        String domain,
        SortedSet<String> allowedCategories,
        SortedSet<String> forbiddenCategories,
        SortedSet<String> forbiddenDomains,
        Set<AccessAction> permittedActions) {

    public DomainGrant {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain must not be blank");
        }
        allowedCategories = sorted(allowedCategories);
        forbiddenCategories = sorted(forbiddenCategories);
        forbiddenDomains = sorted(forbiddenDomains);
        permittedActions = permittedActions == null || permittedActions.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(AccessAction.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(permittedActions));
    }

    /** Grant with no category restrictions and the given actions. */
    public static DomainGrant of(String domain, AccessAction... actions) {
        return new DomainGrant(domain, null, null, null, actions.length == 0 ? null : EnumSet.of(actions[0], actions));
    }

    public DomainGrant withAllowedCategories(String... categories) {
        return new DomainGrant(domain, new TreeSet<>(Set.of(categories)), forbiddenCategories, forbiddenDomains,
                permittedActions);
    }

    public DomainGrant withForbiddenCategories(String... categories) {
        return new DomainGrant(domain, allowedCategories, new TreeSet<>(Set.of(categories)), forbiddenDomains,
                permittedActions);
    }

    public DomainGrant withForbiddenDomains(String... domains) {
        return new DomainGrant(domain, allowedCategories, forbiddenCategories, new TreeSet<>(Set.of(domains)),
                permittedActions);
    }

    private static SortedSet<String> sorted(Collection<String> values) {
        TreeSet<String> copy = new TreeSet<>();
        if (values != null) {
            for (String value : values) {
                if (value == null || value.isBlank()) {
                    throw new IllegalArgumentException("category and domain names must not be blank");
                }
                copy.add(value);
            }
        }
        return Collections.unmodifiableSortedSet(copy);
    }
}
