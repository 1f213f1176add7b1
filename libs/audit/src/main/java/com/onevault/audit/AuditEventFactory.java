package com.onevault.audit;

import com.onevault.observability.CorrelationContext;
import com.onevault.observability.CorrelationContextHolder;
import java.time.Clock;
import java.util.UUID;

/**
 * Builds {@link AuditEnvelope}s with generated ids and the caller's correlation id.
 * <p>
 * WHY a factory: id generation, timestamps and correlation lookup are the same for every record,
 * and callers should not repeat them.
 */
public final class AuditEventFactory {

    public static final int CURRENT_VERSION = 1;

    private final String producer;
    private final Clock clock;

    public AuditEventFactory(String producer, Clock clock) {
        if (producer == null || producer.isBlank()) {
            throw new IllegalArgumentException("producer must not be null or blank");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.producer = producer;
        this.clock = clock;
    }

    /**
     * Creates an envelope stamped now. The correlation id comes from the current
     * {@link CorrelationContextHolder}, or is generated if no context is set.
     */
    public <T> AuditEnvelope<T> create(AuditEventType type, String tenantKey, String subjectKey, T payload) {
        String correlationId = CorrelationContextHolder.get()
                .map(CorrelationContext::correlationId)
                .orElseGet(() -> UUID.randomUUID().toString());
        return new AuditEnvelope<>(
                UUID.randomUUID().toString(),
                type.value(),
                CURRENT_VERSION,
                clock.instant(),
                producer,
                tenantKey,
                correlationId,
                subjectKey,
                payload);
    }

    public String producer() {
        return producer;
    }
}
