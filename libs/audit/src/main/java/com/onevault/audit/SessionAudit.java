package com.onevault.audit;

import java.time.Instant;

/**
 * A session moved between lifecycle states.
 *
 * @param sessionRef log-safe session reference, never the token
 */
public record SessionAudit(
        Instant timestamp, String sessionRef, String actor, String fromState, String toState, String reason) {}
