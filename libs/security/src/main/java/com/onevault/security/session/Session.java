package com.onevault.security.session;

import com.onevault.identity.HashKey;
import com.onevault.security.risk.AccessTier;
import java.time.Instant;
import java.util.Objects;

/**
 * One version of a session, stored as a JSON satellite of the session hub. The raw token is
 * never part of it.
 *
 * @param sessionKey   hash key of the session hub
 * @param actorKey     user or agent the session was issued to
 * @param tenantKey    tenant of the actor
 * @param state        lifecycle state
 * @param issuedAt     issue time
 * @param expiresAt    the session is expired from this instant on
 * @param riskScore    score of the latest validation, null before the first
 * @param tier         tier of the latest validation, null before the first
 * @param requestsMade requests accounted so far
 * @param bytesMoved   data volume accounted so far
 * @param limits       usage caps
 * @param stateReason  why the session entered its current state
 */
public record Session(
        HashKey sessionKey,
        HashKey actorKey,
        HashKey tenantKey,
        SessionState state,
        Instant issuedAt,
        Instant expiresAt,
        Double riskScore,
        AccessTier tier,
        long requestsMade,
        long bytesMoved,
        SessionLimits limits,
        String stateReason) {

    public Session {
        Objects.requireNonNull(sessionKey, "sessionKey");
        Objects.requireNonNull(actorKey, "actorKey");
        Objects.requireNonNull(tenantKey, "tenantKey");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        Objects.requireNonNull(limits, "limits");
    }

    static Session issued(HashKey sessionKey, HashKey actorKey, HashKey tenantKey, Instant issuedAt,
                          Instant expiresAt, SessionLimits limits) {
        return new Session(sessionKey, actorKey, tenantKey, SessionState.ISSUED, issuedAt, expiresAt,
                null, null, 0, 0, limits, "issued");
    }

    /** True once {@code now} has reached the expiry instant. */
    public boolean expiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * @throws IllegalStateException if the lifecycle does not allow the move
     */
    Session transitionTo(SessionState next, String reason) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("session %s cannot move from %s to %s"
                    .formatted(sessionKey.shortHex(), state, next));
        }
        return new Session(sessionKey, actorKey, tenantKey, next, issuedAt, expiresAt, riskScore, tier,
                requestsMade, bytesMoved, limits, reason);
    }

    Session withRisk(double score, AccessTier newTier) {
        return new Session(sessionKey, actorKey, tenantKey, state, issuedAt, expiresAt, score, newTier,
                requestsMade, bytesMoved, limits, stateReason);
    }

    Session withUsage(long requests, long bytes) {
        return new Session(sessionKey, actorKey, tenantKey, state, issuedAt, expiresAt, riskScore, tier,
                Math.addExact(requestsMade, requests), Math.addExact(bytesMoved, bytes), limits, stateReason);
    }

    boolean limitReached() {
        return limits.reachedBy(requestsMade, bytesMoved);
    }
}
