package com.onevault.observability;

import java.util.UUID;

/**
 * Immutable correlation data for one access decision or write.
 * <p>
 * Established by the gateway when a request enters the core and bridged into SLF4J MDC by
 * {@link CorrelationContextHolder}, so every log line of the decision carries the same ids.
 * Keys are hex hash keys, never business keys, so logs do not leak personal identifiers.
 *
 * @param correlationId unique ID for the business flow
 * @param tenantKey     hex tenant hash key (nullable before the session is resolved)
 * @param actorKey      hex actor hash key (nullable for system work)
 * @param sessionRef    redacted session reference, never the raw token (nullable)
 * @param spanId        current OpenTelemetry span ID (nullable if tracing is not active)
 * @param traceId       current OpenTelemetry trace ID (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String tenantKey,
        String actorKey,
        String sessionRef,
        String spanId,
        String traceId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_TENANT_KEY = "tenantKey";
    public static final String MDC_ACTOR_KEY = "actorKey";
    public static final String MDC_SESSION_REF = "sessionRef";
    public static final String MDC_SPAN_ID = "spanId";
    public static final String MDC_TRACE_ID = "traceId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Fresh context with a random correlation ID. */
    public static CorrelationContext start(String tenantKey, String actorKey, String sessionRef) {
        return new CorrelationContext(UUID.randomUUID().toString(), tenantKey, actorKey, sessionRef, null, null);
    }

    /** Copy with the span and trace of the active OpenTelemetry span. */
    public CorrelationContext withTrace(String spanId, String traceId) {
        return new CorrelationContext(correlationId, tenantKey, actorKey, sessionRef, spanId, traceId);
    }

    /** Copy with the tenant learned once the session was resolved. */
    public CorrelationContext withTenant(String tenantKey) {
        return new CorrelationContext(correlationId, tenantKey, actorKey, sessionRef, spanId, traceId);
    }
}
