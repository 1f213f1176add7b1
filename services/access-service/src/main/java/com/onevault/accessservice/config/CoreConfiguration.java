package com.onevault.accessservice.config;

import com.onevault.audit.AuditEventFactory;
import com.onevault.audit.AuditPublisher;
import com.onevault.audit.AuditSink;
import com.onevault.audit.LoggingAuditSink;
import com.onevault.audit.MutationAuditListener;
import com.onevault.identity.HubStore;
import com.onevault.identity.IdentityResolver;
import com.onevault.identity.InMemoryHubStore;
import com.onevault.observability.MetricFactory;
import com.onevault.observability.SpanHelper;
import com.onevault.security.ZeroTrustGateway;
import com.onevault.security.domain.DomainAssignmentRegistry;
import com.onevault.security.domain.DomainIsolationGate;
import com.onevault.security.risk.BehavioralAnomalySignal;
import com.onevault.security.risk.ContentSensitivitySignal;
import com.onevault.security.risk.DeviceTrustSignal;
import com.onevault.security.risk.NetworkOriginSignal;
import com.onevault.security.risk.RiskEngine;
import com.onevault.security.session.SessionEngine;
import com.onevault.versioning.InMemoryVersionStore;
import com.onevault.versioning.LoadDateClock;
import com.onevault.versioning.VersionStore;
import com.onevault.versioning.link.InMemoryLinkStore;
import com.onevault.versioning.link.LinkStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import java.time.Clock;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the in-memory core. Every store reports its mutations to the audit sink through one
 * {@link MutationAuditListener}.
 *
 * <p>The session and domain-assignment satellite stores are private to the beans that own them;
 * only the data store ({@link #recordStore}) and the link store are shared.
 */
@Configuration(proxyBeanMethods = false)
public class CoreConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LoadDateClock loadDateClock(Clock clock) {
        return new LoadDateClock(clock);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, AccessProperties properties) {
        return new MetricFactory(registry, properties.serviceName());
    }

    /** No-op unless an OpenTelemetry SDK or agent registered itself globally. */
    @Bean
    @ConditionalOnMissingBean
    public Tracer tracer(AccessProperties properties) {
        return GlobalOpenTelemetry.getTracer(properties.serviceName());
    }

    @Bean
    public SpanHelper spanHelper(Tracer tracer) {
        return new SpanHelper(tracer);
    }

    // ---- Audit ----

    @Bean
    @ConditionalOnMissingBean
    public AuditSink auditSink() {
        return new LoggingAuditSink();
    }

    @Bean
    public AuditPublisher auditPublisher(AuditSink sink, MetricFactory metrics, AccessProperties properties) {
        return new AuditPublisher(sink, metrics, properties.audit().retryCapacity());
    }

    @Bean
    public AuditEventFactory auditEventFactory(AccessProperties properties, Clock clock) {
        return new AuditEventFactory(properties.serviceName(), clock);
    }

    @Bean
    public MutationAuditListener mutationAuditListener(AuditEventFactory events, AuditPublisher publisher) {
        return new MutationAuditListener(events, publisher);
    }

    // ---- Identity and storage ----

    @Bean
    public HubStore hubStore() {
        return new InMemoryHubStore();
    }

    @Bean
    public IdentityResolver identityResolver(HubStore hubStore, Clock clock, MutationAuditListener audit) {
        IdentityResolver resolver = new IdentityResolver(hubStore, clock);
        resolver.addListener(audit);
        return resolver;
    }

    @Bean
    public VersionStore recordStore(LoadDateClock loadDates, AccessProperties properties,
                                    MutationAuditListener audit) {
        return audited(new InMemoryVersionStore(loadDates, properties.store().lockTimeout()), audit);
    }

    @Bean
    public LinkStore linkStore(LoadDateClock loadDates, AccessProperties properties, MutationAuditListener audit) {
        VersionStore attributes = audited(new InMemoryVersionStore(loadDates, properties.store().lockTimeout()), audit);
        LinkStore links = new InMemoryLinkStore(loadDates, attributes);
        links.addListener(audit);
        return links;
    }

    // ---- Zero trust ----

    @Bean
    public NetworkOriginSignal networkOriginSignal(AccessProperties properties) {
        return new NetworkOriginSignal(properties.risk().flaggedAddresses());
    }

    @Bean
    public RiskEngine riskEngine(NetworkOriginSignal networkOrigin, AccessProperties properties,
                                 MetricFactory metrics) {
        return new RiskEngine(
                List.of(new DeviceTrustSignal(), networkOrigin, new BehavioralAnomalySignal(),
                        new ContentSensitivitySignal()),
                properties.risk().weights().toRiskWeights(),
                properties.risk().tiers().toBoundaries(),
                metrics);
    }

    @Bean
    public SessionEngine sessionEngine(IdentityResolver identities, LoadDateClock loadDates, LinkStore links,
                                       RiskEngine risk, AuditEventFactory events, AuditPublisher publisher,
                                       MetricFactory metrics, Clock clock, AccessProperties properties,
                                       MutationAuditListener audit) {
        VersionStore sessions = audited(new InMemoryVersionStore(loadDates, properties.store().lockTimeout()), audit);
        return new SessionEngine(identities, sessions, links, risk, events, publisher, metrics, clock,
                properties.session().toSettings());
    }

    @Bean
    public DomainAssignmentRegistry domainAssignmentRegistry(IdentityResolver identities, LoadDateClock loadDates,
                                                             LinkStore links, Clock clock,
                                                             AccessProperties properties,
                                                             MutationAuditListener audit) {
        VersionStore assignments =
                audited(new InMemoryVersionStore(loadDates, properties.store().lockTimeout()), audit);
        return new DomainAssignmentRegistry(identities, assignments, links, clock);
    }

    @Bean
    public DomainIsolationGate domainIsolationGate(DomainAssignmentRegistry registry) {
        return new DomainIsolationGate(registry);
    }

    @Bean
    public ZeroTrustGateway zeroTrustGateway(SessionEngine sessions, DomainIsolationGate gate,
                                             IdentityResolver identities, VersionStore recordStore,
                                             LinkStore links, AuditEventFactory events, AuditPublisher publisher,
                                             MetricFactory metrics, SpanHelper spans, Clock clock) {
        return new ZeroTrustGateway(sessions, gate, identities, recordStore, links, events, publisher, metrics,
                spans, clock);
    }

    private static VersionStore audited(VersionStore store, MutationAuditListener audit) {
        store.addListener(audit);
        return store;
    }
}
