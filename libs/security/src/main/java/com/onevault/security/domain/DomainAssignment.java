package com.onevault.security.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.onevault.identity.HashKey;
import java.time.Instant;
import java.util.Objects;

/**
 * One version of an actor's knowledge-domain assignment, stored as a JSON satellite of the actor
 * hub. Revocation writes a new version with status {@code REVOKED}; nothing is deleted.
 */
public record DomainAssignment(
        HashKey actorKey,
        HashKey tenantKey,
        DomainGrant grant,
        Status status,
        Instant grantedAt,
        Instant revokedAt,
        String revocationReason) {

    public enum Status {
        ACTIVE,
        REVOKED
    }

    public DomainAssignment {
        Objects.requireNonNull(actorKey, "actorKey");
        Objects.requireNonNull(tenantKey, "tenantKey");
        Objects.requireNonNull(grant, "grant");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(grantedAt, "grantedAt");
    }

    static DomainAssignment active(HashKey actorKey, HashKey tenantKey, DomainGrant grant, Instant grantedAt) {
        return new DomainAssignment(actorKey, tenantKey, grant, Status.ACTIVE, grantedAt, null, null);
    }

    DomainAssignment revoked(Instant at, String reason) {
        return new DomainAssignment(actorKey, tenantKey, grant, Status.REVOKED, grantedAt, at, reason);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    public String domain() {
        return grant.domain();
    }
}
