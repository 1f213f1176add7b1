package com.onevault.audit;

import java.time.Instant;

/**
 * Envelope every audit record travels in, whatever the sink.
 *
 * <p>Immutable: once an outcome has been audited the record cannot change.
 *
 * @param <T> payload type, one of {@link AuthorizationAudit}, {@link MutationAudit} or
 *            {@link SessionAudit}
 */
public record AuditEnvelope<T>(
        /** Unique identifier for this record (UUID v4); sinks use it to drop redeliveries. */
        String eventId,

        /** Canonical {@link AuditEventType#value()}. */
        String eventType,

        /** Schema version of the payload, starting at 1. */
        int eventVersion,

        /** When the audited outcome happened. */
        Instant occurredAt,

        /** Service that produced the record. */
        String producer,

        /** Hex tenant hash key; null only for records outside any tenant. */
        String tenantKey,

        /** Correlation ID of the decision or write that caused this record. */
        String correlationId,

        /** Hex hash key of the hub, link or session the record is about. */
        String subjectKey,

        T payload) {}
