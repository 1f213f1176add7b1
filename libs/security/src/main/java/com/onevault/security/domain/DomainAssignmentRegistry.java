package com.onevault.security.domain;

import com.onevault.identity.HashKey;
import com.onevault.identity.HubRecord;
import com.onevault.identity.IdentityResolver;
import com.onevault.identity.IdentityValidationException;
import com.onevault.identity.NotFoundException;
import com.onevault.versioning.PayloadCodec;
import com.onevault.versioning.Version;
import com.onevault.versioning.VersionConflictException;
import com.onevault.versioning.VersionStore;
import com.onevault.versioning.link.LinkStore;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds each actor to at most one knowledge domain at a time.
 *
 * <p>Assignments are satellites of the actor hub in their own {@link VersionStore}, so the full
 * grant/revoke history stays queryable with {@link VersionStore#asOf}. Each grant also links the
 * actor to the domain's hub ({@code knowledge-domain | <name>}) in the grantee's tenant.
 */
public final class DomainAssignmentRegistry {

    private static final Logger log = LoggerFactory.getLogger(DomainAssignmentRegistry.class);

    public static final String RECORD_SOURCE = "domain_isolation";

    private final IdentityResolver identities;
    private final VersionStore assignments;
    private final LinkStore links;
    private final Clock clock;

    public DomainAssignmentRegistry(IdentityResolver identities, VersionStore assignments, LinkStore links,
                                    Clock clock) {
        this.identities = identities;
        this.assignments = assignments;
        this.links = links;
        this.clock = clock;
    }

    /**
     * Assigns a domain to an actor of the given tenant.
     *
     * @throws NotFoundException                  if the actor has no hub
     * @throws IdentityValidationException        if the actor belongs to another tenant
     * @throws DomainAssignmentConflictException  if the actor already holds an active assignment
     */
    public DomainAssignment grant(HashKey tenantKey, HashKey actorKey, DomainGrant grant) {
        if (tenantKey == null || grant == null) {
            throw new IllegalArgumentException("tenantKey and grant are required");
        }
        HubRecord actor = identities.require(actorKey);
        if (!actor.tenantKey().equals(tenantKey)) {
            throw new IdentityValidationException(
                    "actor %s does not belong to tenant %s".formatted(actorKey.shortHex(), tenantKey.shortHex()));
        }

        Version current = assignments.current(actorKey).orElse(null);
        if (current != null && decode(current).isActive()) {
            throw new DomainAssignmentConflictException(actorKey,
                    "actor %s already assigned to %s".formatted(actorKey.shortHex(), decode(current).domain()));
        }

        DomainAssignment assignment = DomainAssignment.active(actorKey, tenantKey, grant, now());
        try {
            assignments.putIfCurrent(actorKey, current, PayloadCodec.encode(assignment), RECORD_SOURCE);
        } catch (VersionConflictException e) {
            throw new DomainAssignmentConflictException(actorKey,
                    "assignment of %s changed concurrently".formatted(actorKey.shortHex()), e);
        }

        HashKey domainHub = identities.ensureHub(tenantKey,
                IdentityResolver.compositeKey("knowledge-domain", grant.domain()), RECORD_SOURCE).hashKey();
        links.link(actorKey, domainHub, RECORD_SOURCE);
        log.info("Assigned {} to knowledge domain {} (actions {})",
                actorKey.shortHex(), grant.domain(), grant.permittedActions());
        return assignment;
    }

    /**
     * Revokes the actor's active assignment.
     *
     * @throws NotFoundException                 if the actor holds no active assignment
     * @throws DomainAssignmentConflictException if the assignment changed concurrently
     */
    public DomainAssignment revoke(HashKey actorKey, String reason) {
        Version current = assignments.current(actorKey)
                .orElseThrow(() -> new NotFoundException("domain assignment", actorKey.toHex()));
        DomainAssignment active = decode(current);
        if (!active.isActive()) {
            throw new NotFoundException("domain assignment", actorKey.toHex());
        }
        DomainAssignment revoked = active.revoked(now(), reason == null || reason.isBlank() ? "revoked" : reason);
        try {
            assignments.putIfCurrent(actorKey, current, PayloadCodec.encode(revoked), RECORD_SOURCE);
        } catch (VersionConflictException e) {
            throw new DomainAssignmentConflictException(actorKey,
                    "assignment of %s changed concurrently".formatted(actorKey.shortHex()), e);
        }
        log.info("Revoked knowledge domain {} from {}: {}",
                active.domain(), actorKey.shortHex(), revoked.revocationReason());
        return revoked;
    }

    /** The actor's active assignment, empty if none was granted or it was revoked. */
    public Optional<DomainAssignment> current(HashKey actorKey) {
        return assignments.current(actorKey).map(this::decode).filter(DomainAssignment::isActive);
    }

    /** The assignment in force at {@code instant}, empty if none was. */
    public Optional<DomainAssignment> asOf(HashKey actorKey, Instant instant) {
        return assignments.asOf(actorKey, instant).map(this::decode).filter(DomainAssignment::isActive);
    }

    public List<DomainAssignment> history(HashKey actorKey) {
        return assignments.history(actorKey).stream().map(this::decode).toList();
    }

    private DomainAssignment decode(Version version) {
        return PayloadCodec.decode(version, DomainAssignment.class);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
