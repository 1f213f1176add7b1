package com.onevault.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.onevault.audit.testing.InMemoryAuditSink;
import com.onevault.identity.HashKey;
import com.onevault.identity.MutationRecord;
import com.onevault.identity.RecordFamily;
import com.onevault.observability.CorrelationContextHolder;
import com.onevault.observability.MetricFactory;
import com.onevault.observability.testing.TestCorrelationContextFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AuditPublisher")
class AuditPublisherTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");

    private SimpleMeterRegistry registry;
    private InMemoryAuditSink sink;
    private AuditEventFactory events;
    private AuditPublisher publisher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        sink = new InMemoryAuditSink();
        events = new AuditEventFactory("access-service", Clock.fixed(NOW, ZoneOffset.UTC));
        publisher = new AuditPublisher(sink, new MetricFactory(registry, "access-service"), 3);
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private AuditEnvelope<AuthorizationAudit> denial(String actor) {
        var payload = new AuthorizationAudit(NOW, actor, AuthorizationAudit.DENIED,
                "CROSS_DOMAIN_VIOLATION", "financial", "READ", 12.5, "FULL");
        return events.create(AuditEventType.ACCESS_DENIED, "t".repeat(64), actor, payload);
    }

    private double failures() {
        return registry.get("onevault.audit.delivery.failures").counter().count();
    }

    @Nested
    @DisplayName("publish")
    class Publish {

        @Test
        @DisplayName("should deliver to the sink")
        void shouldDeliver() {
            publisher.publish(denial("actor-1"));

            assertThat(sink.payloads(AuthorizationAudit.class))
                    .singleElement()
                    .satisfies(p -> assertThat(p.reason()).isEqualTo("CROSS_DOMAIN_VIOLATION"));
            assertThat(publisher.pendingCount()).isZero();
        }

        @Test
        @DisplayName("should absorb sink failure, count it and queue the record")
        void shouldQueueOnFailure() {
            sink.setDown(true);

            publisher.publish(denial("actor-1"));

            assertThat(sink.delivered()).isEmpty();
            assertThat(publisher.pendingCount()).isEqualTo(1);
            assertThat(failures()).isEqualTo(1.0);
            assertThat(registry.get("onevault.audit.retry.pending").gauge().value()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should reject an invalid envelope")
        void shouldRejectInvalid() {
            var bad = new AuditEnvelope<>("", "NoSuchType", 0, null, "svc", null, "c", "s",
                    new MutationAudit(NOW, "k", "v", "src"));

            assertThatThrownBy(() -> publisher.publish(bad))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("eventId")
                    .hasMessageContaining("eventType");
            assertThat(sink.delivered()).isEmpty();
        }

        @Test
        @DisplayName("should drop the oldest record when the queue is full")
        void shouldDropOldest() {
            sink.setDown(true);
            for (int i = 0; i < 5; i++) {
                publisher.publish(denial("actor-" + i));
            }

            assertThat(publisher.pendingCount()).isEqualTo(3);
            assertThat(registry.get("onevault.audit.dropped").counter().count()).isEqualTo(2.0);

            sink.setDown(false);
            publisher.retryPending();
            assertThat(sink.payloads(AuthorizationAudit.class))
                    .extracting(AuthorizationAudit::actor)
                    .containsExactly("actor-2", "actor-3", "actor-4");
        }
    }

    @Nested
    @DisplayName("retryPending")
    class RetryPending {

        @Test
        @DisplayName("should redeliver queued records once the sink recovers")
        void shouldRedeliver() {
            sink.setDown(true);
            publisher.publish(denial("actor-1"));
            publisher.publish(denial("actor-2"));

            sink.setDown(false);
            int delivered = publisher.retryPending();

            assertThat(delivered).isEqualTo(2);
            assertThat(publisher.pendingCount()).isZero();
            assertThat(sink.delivered()).hasSize(2);
        }

        @Test
        @DisplayName("should keep records that fail again")
        void shouldRequeue() {
            sink.failNext(1);
            publisher.publish(denial("actor-1"));
            sink.setDown(true);

            assertThat(publisher.retryPending()).isZero();
            assertThat(publisher.pendingCount()).isEqualTo(1);
            assertThat(failures()).isEqualTo(2.0);
        }
    }

    @Test
    @DisplayName("MutationAuditListener maps record families to event types")
    void mutationListener() {
        CorrelationContextHolder.set(TestCorrelationContextFactory.createDefault());
        var listener = new MutationAuditListener(events, publisher);
        HashKey key = HashKey.fromHex("c".repeat(64));

        listener.onMutation(new MutationRecord(NOW, RecordFamily.HUB, key, key.toHex(), "auth"));
        listener.onMutation(new MutationRecord(NOW, RecordFamily.SATELLITE, key, key.toHex() + "@" + NOW, "auth"));
        listener.onMutation(new MutationRecord(NOW, RecordFamily.LINK, key, key.toHex(), "auth"));

        assertThat(sink.delivered()).extracting(AuditEnvelope::eventType)
                .containsExactly("HubCreated", "VersionAppended", "LinkCreated");
        assertThat(sink.delivered()).allSatisfy(e -> {
            assertThat(e.tenantKey()).isEqualTo(TestCorrelationContextFactory.DEFAULT_TENANT_KEY);
            assertThat(e.correlationId()).isEqualTo(TestCorrelationContextFactory.DEFAULT_CORRELATION_ID);
        });
    }
}
