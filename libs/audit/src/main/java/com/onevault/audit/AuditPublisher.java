package com.onevault.audit;

import com.onevault.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands audit records to an {@link AuditSink} without ever failing the caller.
 *
 * <p>Delivery is fire-and-forget from the decision's point of view: a sink failure is logged at
 * WARN, counted, and the record goes to a bounded redelivery queue drained by
 * {@link #retryPending()}. When the queue is full the oldest record is dropped and counted, so a
 * dead sink cannot exhaust memory.
 *
 * <p>Invalid envelopes are programming errors and are rejected with
 * {@link IllegalArgumentException} before any delivery attempt.
 */
public final class AuditPublisher {

    private static final Logger log = LoggerFactory.getLogger(AuditPublisher.class);

    public static final int DEFAULT_RETRY_CAPACITY = 10_000;

    private final AuditSink sink;
    private final BlockingQueue<AuditEnvelope<?>> pending;
    private final Counter deliveryFailures;
    private final Counter dropped;

    public AuditPublisher(AuditSink sink, MetricFactory metrics) {
        this(sink, metrics, DEFAULT_RETRY_CAPACITY);
    }

    public AuditPublisher(AuditSink sink, MetricFactory metrics, int retryCapacity) {
        if (sink == null) {
            throw new IllegalArgumentException("sink must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (retryCapacity < 1) {
            throw new IllegalArgumentException("retryCapacity must be >= 1");
        }
        this.sink = sink;
        this.pending = new ArrayBlockingQueue<>(retryCapacity);
        this.deliveryFailures = metrics.counter("onevault.audit.delivery.failures",
                "Audit records a sink failed to accept");
        this.dropped = metrics.counter("onevault.audit.dropped",
                "Audit records dropped because the redelivery queue was full");
        metrics.gauge("onevault.audit.retry.pending", "Audit records awaiting redelivery", pending::size);
    }

    /**
     * Delivers one record. Never throws for sink failures.
     *
     * @throws IllegalArgumentException if the envelope fails {@link AuditValidator}
     */
    public void publish(AuditEnvelope<?> envelope) {
        ValidationResult validation = AuditValidator.validate(envelope);
        if (!validation.valid()) {
            throw new IllegalArgumentException("Invalid audit record: " + String.join("; ", validation.errors()));
        }
        if (!tryDeliver(envelope)) {
            enqueue(envelope);
        }
    }

    /**
     * Attempts redelivery of every queued record once. Records that fail again go back on the
     * queue.
     *
     * @return number of records delivered in this pass
     */
    public int retryPending() {
        List<AuditEnvelope<?>> batch = new ArrayList<>();
        pending.drainTo(batch);
        int delivered = 0;
        for (AuditEnvelope<?> envelope : batch) {
            if (tryDeliver(envelope)) {
                delivered++;
            } else {
                enqueue(envelope);
            }
        }
        if (!batch.isEmpty()) {
            log.info("Audit redelivery pass: {} of {} delivered", delivered, batch.size());
        }
        return delivered;
    }

    public int pendingCount() {
        return pending.size();
    }

    private boolean tryDeliver(AuditEnvelope<?> envelope) {
        try {
            sink.deliver(envelope);
            return true;
        } catch (RuntimeException e) {
            deliveryFailures.increment();
            log.warn("Audit delivery failed for {} {}: {}", envelope.eventType(), envelope.eventId(), e.toString());
            return false;
        }
    }

    private void enqueue(AuditEnvelope<?> envelope) {
        while (!pending.offer(envelope)) {
            AuditEnvelope<?> oldest = pending.poll();
            if (oldest != null) {
                dropped.increment();
                log.error("Audit redelivery queue full, dropped {} {}", oldest.eventType(), oldest.eventId());
            }
        }
    }
}
