package com.onevault.audit;

import com.onevault.identity.MutationListener;
import com.onevault.identity.MutationRecord;
import com.onevault.observability.CorrelationContext;
import com.onevault.observability.CorrelationContextHolder;

/**
 * Turns store mutations into {@link MutationAudit} records. Register it on the hub, satellite and
 * link stores so every appended row is audited.
 */
public final class MutationAuditListener implements MutationListener {

    private final AuditEventFactory events;
    private final AuditPublisher publisher;

    public MutationAuditListener(AuditEventFactory events, AuditPublisher publisher) {
        this.events = events;
        this.publisher = publisher;
    }

    @Override
    public void onMutation(MutationRecord mutation) {
        AuditEventType type = switch (mutation.family()) {
            case HUB -> AuditEventType.HUB_CREATED;
            case SATELLITE -> AuditEventType.VERSION_APPENDED;
            case LINK -> AuditEventType.LINK_CREATED;
        };
        String tenantKey = CorrelationContextHolder.get().map(CorrelationContext::tenantKey).orElse(null);
        var payload = new MutationAudit(mutation.timestamp(), mutation.hashKey().toHex(),
                mutation.versionId(), mutation.recordSource());
        publisher.publish(events.create(type, tenantKey, mutation.hashKey().toHex(), payload));
    }
}
