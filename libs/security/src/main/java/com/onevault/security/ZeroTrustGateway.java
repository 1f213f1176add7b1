package com.onevault.security;

import com.onevault.audit.AuditEventFactory;
import com.onevault.audit.AuditEventType;
import com.onevault.audit.AuditPublisher;
import com.onevault.audit.AuthorizationAudit;
import com.onevault.identity.HashKey;
import com.onevault.identity.HubRecord;
import com.onevault.identity.IdentityResolver;
import com.onevault.identity.NotFoundException;
import com.onevault.observability.CorrelationContext;
import com.onevault.observability.CorrelationContextHolder;
import com.onevault.observability.MetricFactory;
import com.onevault.observability.SensitiveDataRedactor;
import com.onevault.observability.SpanHelper;
import com.onevault.security.domain.AccessDecision;
import com.onevault.security.domain.DomainIsolationGate;
import com.onevault.security.risk.RiskAssessment;
import com.onevault.security.session.Session;
import com.onevault.security.session.SessionCheck;
import com.onevault.security.session.SessionEngine;
import com.onevault.versioning.Version;
import com.onevault.versioning.VersionStore;
import com.onevault.versioning.link.LinkRecord;
import com.onevault.versioning.link.LinkStore;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for request routing: session lookup, then the domain gate, then risk
 * scoring, then audit, then the requested operation.
 *
 * <p>The domain gate runs before risk is scored, so a cross-domain request is refused as such at
 * any risk level and never moves the session's tier. Risk baselines learn only from requests that
 * passed every check, including the resource checks of the operation.
 *
 * <p>Every decision, allowed or denied, is published as an audit event before the caller sees it.
 * Audit delivery never changes the decision (see {@link AuditPublisher}).
 *
 * <p>Each call runs with a {@link CorrelationContext} installed (the caller's, or a fresh one) and
 * inside an OpenTelemetry span, so every log line it produces carries the correlation id, actor
 * and session reference in MDC.
 */
public final class ZeroTrustGateway {

    private static final Logger log = LoggerFactory.getLogger(ZeroTrustGateway.class);

    private final SessionEngine sessions;
    private final DomainIsolationGate gate;
    private final IdentityResolver identities;
    private final VersionStore records;
    private final LinkStore links;
    private final AuditEventFactory auditEvents;
    private final AuditPublisher audit;
    private final MetricFactory metrics;
    private final SpanHelper spans;
    private final Clock clock;

    public ZeroTrustGateway(SessionEngine sessions, DomainIsolationGate gate, IdentityResolver identities,
                            VersionStore records, LinkStore links, AuditEventFactory auditEvents,
                            AuditPublisher audit, MetricFactory metrics, SpanHelper spans, Clock clock) {
        this.sessions = sessions;
        this.gate = gate;
        this.identities = identities;
        this.records = records;
        this.links = links;
        this.auditEvents = auditEvents;
        this.audit = audit;
        this.metrics = metrics;
        this.spans = spans;
        this.clock = clock;
    }

    /** Decides a request without touching any data. */
    public GatewayOutcome authorize(AccessRequest request) {
        return run("gateway.authorize", request, session -> { }, outcome -> outcome);
    }

    /**
     * Authorizes {@code request} as a {@code WRITE}, then records {@code payload} as a new version
     * of the hub for {@code businessKey} in the session's tenant, and accounts the usage.
     */
    public GatewayOutcome write(AccessRequest request, String businessKey, byte[] payload, String recordSource) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        IdentityResolver.requireText(businessKey, "businessKey");
        IdentityResolver.requireText(recordSource, "recordSource");
        return run("gateway.write", request.withAction(AccessAction.WRITE), session -> { }, outcome -> {
            HashKey tenantKey = outcome.session().tenantKey();
            HashKey hub = identities.ensureHub(tenantKey, businessKey, recordSource).hashKey();
            Version version = records.put(hub, payload, recordSource);
            sessions.recordUsage(request.sessionToken(), 1, payload.length);
            log.debug("Wrote version {} for {}", version.versionId(), request.actorKey().shortHex());
            return outcome.withVersion(version);
        });
    }

    /**
     * Authorizes {@code request} as a {@code READ}, then returns the current version of
     * {@code hashKey}. The hub must belong to the session's tenant.
     *
     * @throws NotFoundException if the hub is unknown or owned by another tenant
     */
    public GatewayOutcome read(AccessRequest request, HashKey hashKey) {
        requireKey(hashKey);
        return run("gateway.read", request.withAction(AccessAction.READ),
                session -> requireInTenant(hashKey, session), outcome -> {
            Optional<Version> current = records.current(hashKey);
            long bytes = current.map(version -> (long) version.payload().length).orElse(0L);
            sessions.recordUsage(request.sessionToken(), 1, bytes);
            return outcome.withVersion(current.orElse(null));
        });
    }

    /**
     * Authorizes {@code request} as a {@code WRITE}, then links two hubs of the session's tenant.
     *
     * @throws NotFoundException if either hub is unknown or owned by another tenant
     */
    public GatewayOutcome associate(AccessRequest request, HashKey first, HashKey second, String recordSource) {
        requireKey(first);
        requireKey(second);
        IdentityResolver.requireText(recordSource, "recordSource");
        return run("gateway.associate", request.withAction(AccessAction.WRITE), session -> {
            requireInTenant(first, session);
            requireInTenant(second, session);
        }, outcome -> {
            LinkRecord link = links.link(first, second, recordSource);
            sessions.recordUsage(request.sessionToken(), 1, 0);
            return outcome.withLink(link);
        });
    }

    /**
     * Decides {@code request}, runs {@code resourceCheck} against the session of an allowed
     * decision, audits the result and only then applies {@code onAllowed}. A resource check that
     * throws {@link NotFoundException} is audited as {@code RESOURCE_NOT_FOUND} before the
     * exception propagates.
     */
    private GatewayOutcome run(String spanName, AccessRequest request, Consumer<Session> resourceCheck,
                               Function<GatewayOutcome, GatewayOutcome> onAllowed) {
        String sessionRef = SensitiveDataRedactor.reference(request.sessionToken());
        CorrelationContext context = CorrelationContextHolder.get()
                .map(outer -> new CorrelationContext(outer.correlationId(), outer.tenantKey(),
                        request.actorKey().toHex(), sessionRef, outer.spanId(), outer.traceId()))
                .orElseGet(() -> CorrelationContext.start(null, request.actorKey().toHex(), sessionRef));

        Map<String, String> attributes = Map.of(
                "onevault.resource_domain", request.resourceDomain(),
                "onevault.action", request.action().name());
        Timer.Sample sample = Timer.start(metrics.registry());
        try {
            return CorrelationContextHolder.callWithContext(context, () -> spans.inSpan(spanName, attributes, () -> {
                GatewayOutcome outcome = decide(request);
                if (outcome.allowed()) {
                    try {
                        resourceCheck.accept(outcome.session());
                    } catch (NotFoundException e) {
                        record(request, GatewayOutcome.deny(
                                DenialReason.RESOURCE_NOT_FOUND, outcome.session(), outcome.assessment()));
                        throw e;
                    }
                }
                record(request, outcome);
                if (!outcome.allowed()) {
                    return outcome;
                }
                sessions.recordAllowed(outcome.session(), request.riskContext());
                return onAllowed.apply(outcome);
            }));
        } finally {
            sample.stop(metrics.timer("onevault.gateway.duration", "Gateway call latency", "operation", spanName));
        }
    }

    private GatewayOutcome decide(AccessRequest request) {
        SessionCheck resolved = sessions.resolve(request.sessionToken());
        if (resolved instanceof SessionCheck.Rejected rejected) {
            return GatewayOutcome.deny(rejected.reason(), rejected.session().orElse(null), null);
        }
        Session session = resolved.session().orElseThrow();
        if (!session.actorKey().equals(request.actorKey())) {
            // A token presented by someone other than its holder is treated as unknown.
            log.warn("Session {} presented by {} but issued to {}",
                    SensitiveDataRedactor.reference(request.sessionToken()),
                    request.actorKey().shortHex(), session.actorKey().shortHex());
            return GatewayOutcome.deny(DenialReason.NOT_FOUND, null, null);
        }
        CorrelationContextHolder.get().ifPresent(current ->
                CorrelationContextHolder.set(current.withTenant(session.tenantKey().toHex())));
        SpanHelper.annotate(SpanHelper.ATTR_TENANT_KEY, session.tenantKey().toHex());

        AccessDecision decision = gate.authorize(request.actorKey(), request.resourceDomain(), request.action(),
                request.resourceCategory());
        if (decision instanceof AccessDecision.Denied denied) {
            return GatewayOutcome.deny(denied.reason(), session, null);
        }

        SessionCheck scored = sessions.score(session, request.riskContext());
        Session current = scored.session().orElse(session);
        RiskAssessment assessment = scored.assessment().orElse(null);
        if (assessment != null) {
            SpanHelper.annotate("onevault.risk_tier", assessment.tier().name());
        }
        if (scored instanceof SessionCheck.Rejected rejected) {
            return GatewayOutcome.deny(rejected.reason(), current, assessment);
        }
        return GatewayOutcome.allow(current, assessment);
    }

    private void record(AccessRequest request, GatewayOutcome outcome) {
        String reason = outcome.allowed() ? null : outcome.reason().code();
        String tier = outcome.assessment() == null ? "NONE" : outcome.assessment().tier().name();
        metrics.counter("onevault.gateway.decisions", "Access decisions by outcome",
                "decision", outcome.allowed() ? AuthorizationAudit.ALLOWED : AuthorizationAudit.DENIED,
                "reason", reason == null ? "NONE" : reason,
                "tier", tier).increment();

        if (!outcome.allowed()) {
            log.info("Denied {} on {} for {}: {}", request.action(), request.resourceDomain(),
                    request.actorKey().shortHex(), reason);
        }

        var payload = new AuthorizationAudit(
                clock.instant().truncatedTo(ChronoUnit.MICROS),
                request.actorKey().toHex(),
                outcome.allowed() ? AuthorizationAudit.ALLOWED : AuthorizationAudit.DENIED,
                reason,
                request.resourceDomain(),
                request.action().name(),
                outcome.assessment() == null ? null : outcome.assessment().score(),
                outcome.assessment() == null ? null : outcome.assessment().tier().name());
        String tenantKey = outcome.session() == null ? null : outcome.session().tenantKey().toHex();
        audit.publish(auditEvents.create(
                outcome.allowed() ? AuditEventType.ACCESS_ALLOWED : AuditEventType.ACCESS_DENIED,
                tenantKey, request.actorKey().toHex(), payload));
    }

    private static void requireKey(HashKey hashKey) {
        if (hashKey == null) {
            throw new IllegalArgumentException("hashKey must not be null");
        }
    }

    private void requireInTenant(HashKey hashKey, Session session) {
        boolean owned = identities.find(hashKey)
                .map(HubRecord::tenantKey)
                .filter(session.tenantKey()::equals)
                .isPresent();
        if (!owned) {
            throw new NotFoundException("hub", hashKey.toHex());
        }
    }
}
