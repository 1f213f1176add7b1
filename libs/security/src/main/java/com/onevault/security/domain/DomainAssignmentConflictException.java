package com.onevault.security.domain;

import com.onevault.identity.HashKey;

/**
 * Thrown when a grant is attempted for an actor that already holds an active assignment, or when
 * a concurrent grant or revocation won the race. Revoke first, then grant again.
 */
public class DomainAssignmentConflictException extends RuntimeException {

    private final HashKey actorKey;

    public DomainAssignmentConflictException(HashKey actorKey, String message) {
        super(message);
        this.actorKey = actorKey;
    }

    public DomainAssignmentConflictException(HashKey actorKey, String message, Throwable cause) {
        super(message, cause);
        this.actorKey = actorKey;
    }

    public HashKey actorKey() {
        return actorKey;
    }
}
