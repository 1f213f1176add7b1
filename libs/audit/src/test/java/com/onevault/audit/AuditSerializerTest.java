package com.onevault.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuditSerializer")
class AuditSerializerTest {

    private static final Instant NOW = Instant.parse("2025-02-03T04:05:06.000007Z");

    private final AuditEventFactory events = new AuditEventFactory("access-service", Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("writes ISO-8601 timestamps and the canonical event type")
    void json() {
        var envelope = events.create(AuditEventType.SESSION_STATE_CHANGED, "t", "s",
                new SessionAudit(NOW, "ref:abc", "actor", "ACTIVE", "EXPIRED", "ttl elapsed"));

        String json = AuditSerializer.serialize(envelope);

        assertThat(json).contains("\"eventType\":\"SessionStateChanged\"")
                .contains("\"occurredAt\":\"2025-02-03T04:05:06.000007Z\"")
                .contains("\"toState\":\"EXPIRED\"");
    }

    @Test
    @DisplayName("reads back an authorization record with its typed payload")
    void readBack() {
        var payload = new AuthorizationAudit(NOW, "actor", AuthorizationAudit.ALLOWED, null, "medical", "READ",
                10.0, "FULL");
        var envelope = events.create(AuditEventType.ACCESS_ALLOWED, "t", "actor", payload);

        var parsed = AuditSerializer.deserialize(AuditSerializer.serialize(envelope), AuthorizationAudit.class);

        assertThat(parsed.payload()).isEqualTo(payload);
        assertThat(parsed.eventId()).isEqualTo(envelope.eventId());
    }

    @Test
    @DisplayName("malformed JSON raises AuditSerializationException")
    void malformed() {
        assertThatThrownBy(() -> AuditSerializer.deserialize("{", MutationAudit.class))
                .isInstanceOf(AuditSerializer.AuditSerializationException.class);
    }
}
