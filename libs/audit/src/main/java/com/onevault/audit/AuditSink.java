package com.onevault.audit;

/**
 * Destination for audit records (log pipeline, SIEM, message bus).
 *
 * <p>Implementations may throw {@link AuditDeliveryException} or any runtime exception; the
 * {@link AuditPublisher} absorbs it and queues the record for redelivery. Delivery may repeat, so
 * sinks should de-duplicate on {@link AuditEnvelope#eventId()}.
 */
@FunctionalInterface
public interface AuditSink {

    void deliver(AuditEnvelope<?> envelope);
}
