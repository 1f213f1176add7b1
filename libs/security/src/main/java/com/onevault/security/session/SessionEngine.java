package com.onevault.security.session;

import com.onevault.audit.AuditEventFactory;
import com.onevault.audit.AuditEventType;
import com.onevault.audit.AuditPublisher;
import com.onevault.audit.AuthorizationAudit;
import com.onevault.audit.SessionAudit;
import com.onevault.identity.HashKey;
import com.onevault.identity.HubRecord;
import com.onevault.identity.IdentityResolver;
import com.onevault.identity.NotFoundException;
import com.onevault.observability.MetricFactory;
import com.onevault.observability.SensitiveDataRedactor;
import com.onevault.security.DenialReason;
import com.onevault.security.risk.AccessTier;
import com.onevault.security.risk.RiskAssessment;
import com.onevault.security.risk.RiskContext;
import com.onevault.security.risk.RiskEngine;
import com.onevault.versioning.PayloadCodec;
import com.onevault.versioning.Version;
import com.onevault.versioning.VersionConflictException;
import com.onevault.versioning.VersionStore;
import com.onevault.versioning.link.LinkStore;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues, validates, and retires sessions, and scores each validation for risk.
 *
 * <p>Every state change is a new satellite version of the session hub, written with
 * {@link VersionStore#putIfCurrent} and retried on conflict, so concurrent validations, revocations
 * and usage updates linearize per session without locks held across the risk computation.
 *
 * <p>Expiry is lazy: a session whose expiry has passed turns {@code EXPIRED} during the next
 * {@link #resolve} call. Nothing polls.
 *
 * <p>Only the SHA-256 digest of a token is kept. Tokens never appear in logs; log lines carry
 * {@link SensitiveDataRedactor#reference(String)} instead.
 */
public final class SessionEngine {

    private static final Logger log = LoggerFactory.getLogger(SessionEngine.class);

    public static final String RECORD_SOURCE = "zero_trust_session";

    private static final int TOKEN_BYTES = 32;
    private static final HexFormat HEX = HexFormat.of();

    private final IdentityResolver identities;
    private final VersionStore sessions;
    private final LinkStore links;
    private final RiskEngine risk;
    private final AuditEventFactory auditEvents;
    private final AuditPublisher audit;
    private final MetricFactory metrics;
    private final Clock clock;
    private final SessionSettings settings;
    private final SecureRandom random = new SecureRandom();
    private final ConcurrentMap<String, HashKey> tokenIndex = new ConcurrentHashMap<>();

    public SessionEngine(IdentityResolver identities, VersionStore sessions, LinkStore links, RiskEngine risk,
                         AuditEventFactory auditEvents, AuditPublisher audit, MetricFactory metrics,
                         Clock clock, SessionSettings settings) {
        this.identities = identities;
        this.sessions = sessions;
        this.links = links;
        this.risk = risk;
        this.auditEvents = auditEvents;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = settings;
    }

    public IssuedSession issue(HashKey actorKey) {
        return issue(actorKey, settings.defaultTtl(), settings.defaultLimits());
    }

    public IssuedSession issue(HashKey actorKey, Duration ttl) {
        return issue(actorKey, ttl, settings.defaultLimits());
    }

    /**
     * Issues a session to an actor that has a hub. Records {@code ISSUED} and then
     * {@code ACTIVE} as two versions.
     *
     * @throws NotFoundException        if the actor has no hub
     * @throws IllegalArgumentException if ttl is not positive
     */
    public IssuedSession issue(HashKey actorKey, Duration ttl, SessionLimits limits) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (limits == null) {
            throw new IllegalArgumentException("limits must not be null");
        }
        HubRecord actor = identities.require(actorKey);

        String token = newToken();
        String digest = digest(token);
        HashKey sessionKey = identities.ensureHub(
                actor.tenantKey(), IdentityResolver.compositeKey("session", digest), RECORD_SOURCE).hashKey();

        Instant now = now();
        Session issued = Session.issued(sessionKey, actorKey, actor.tenantKey(), now, now.plus(ttl), limits);
        Version first = sessions.putIfCurrent(sessionKey, null, PayloadCodec.encode(issued), RECORD_SOURCE);
        onStateChange(null, issued);

        Session active = issued.transitionTo(SessionState.ACTIVE, "activated");
        sessions.putIfCurrent(sessionKey, first, PayloadCodec.encode(active), RECORD_SOURCE);
        onStateChange(issued, active);

        links.link(actorKey, sessionKey, RECORD_SOURCE);
        tokenIndex.put(digest, sessionKey);
        log.info("Issued session {} to {} expiring {}",
                SensitiveDataRedactor.reference(token), actorKey.shortHex(), active.expiresAt());
        return new IssuedSession(token, active);
    }

    /**
     * Validates a token and scores the request, then feeds a passed request into the actor's risk
     * baselines. Callers that apply further checks after the session check use {@link #resolve},
     * {@link #score} and {@link #recordAllowed} instead, so that only fully allowed requests are
     * learned from.
     */
    public SessionCheck validate(String token, RiskContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        SessionCheck resolved = resolve(token);
        if (!resolved.valid()) {
            return resolved;
        }
        SessionCheck scored = score(resolved.session().orElseThrow(), context);
        if (scored.valid()) {
            recordAllowed(scored.session().orElseThrow(), context);
        }
        return scored;
    }

    /**
     * Finds the session for a token and checks its lifecycle, without scoring risk.
     *
     * <p>Rejections, in order: unknown token ({@code NOT_FOUND}); terminal state
     * ({@code EXPIRED}, {@code REVOKED}, {@code EXHAUSTED}); expiry reached, which also moves
     * the session to {@code EXPIRED}. A valid result carries no assessment.
     */
    public SessionCheck resolve(String token) {
        Optional<HashKey> found = lookup(token);
        if (found.isEmpty()) {
            log.info("Rejected unknown session {}", SensitiveDataRedactor.reference(token));
            return SessionCheck.rejected(DenialReason.NOT_FOUND, null, null);
        }
        HashKey sessionKey = found.get();
        Session session = load(sessionKey);

        if (session.state() != SessionState.ACTIVE) {
            return rejectInactive(session);
        }
        if (session.expiredAt(now())) {
            Session expired = transition(sessionKey, s -> s.state() == SessionState.ACTIVE
                    ? s.transitionTo(SessionState.EXPIRED, "ttl elapsed") : s);
            return rejectInactive(expired);
        }
        return SessionCheck.valid(session, null);
    }

    /**
     * Scores a request against a resolved session and records the score and tier on it.
     *
     * <p>Returns {@code RISK_DENIED} in tier {@code DENIED}. When the session crosses into
     * {@code DENIED} from a lower tier, the audit record is published before this method returns.
     * Nothing is learned from the request here.
     */
    public SessionCheck score(Session session, RiskContext context) {
        if (session == null || context == null) {
            throw new IllegalArgumentException("session and context must not be null");
        }
        RiskAssessment assessment = risk.assess(session.actorKey(), context);
        Session scored = transition(session.sessionKey(), s -> s.state() == SessionState.ACTIVE
                ? s.withRisk(assessment.score(), assessment.tier()) : s);
        if (scored.state() != SessionState.ACTIVE) {
            return rejectInactive(scored);
        }

        if (assessment.denied()) {
            if (session.tier() != AccessTier.DENIED) {
                publishRiskDenied(scored, assessment, session.tier());
            }
            log.info("Rejected session {}: risk {} in tier DENIED",
                    scored.sessionKey().shortHex(), assessment.score());
            return SessionCheck.rejected(DenialReason.RISK_DENIED, scored, assessment);
        }
        return SessionCheck.valid(scored, assessment);
    }

    /** Feeds an allowed request into the risk baselines of the session's actor. */
    public void recordAllowed(Session session, RiskContext context) {
        risk.recordSuccess(session.actorKey(), context);
    }

    /**
     * Revokes a session. Revoking a session that is already terminal changes nothing.
     *
     * @throws NotFoundException if the token is unknown
     */
    public Session revoke(String token, String reason) {
        HashKey sessionKey = require(token);
        String why = reason == null || reason.isBlank() ? "revoked" : reason;
        return transition(sessionKey, s -> s.state().isTerminal() ? s : s.transitionTo(SessionState.REVOKED, why));
    }

    /**
     * Adds usage to an active session and exhausts it once a limit is reached. Usage reported
     * against a session that is no longer active is ignored.
     *
     * @throws NotFoundException        if the token is unknown
     * @throws IllegalArgumentException if either amount is negative
     */
    public Session recordUsage(String token, long requests, long bytes) {
        if (requests < 0 || bytes < 0) {
            throw new IllegalArgumentException("usage must not be negative");
        }
        HashKey sessionKey = require(token);
        return transition(sessionKey, s -> {
            if (s.state() != SessionState.ACTIVE) {
                return s;
            }
            Session counted = s.withUsage(requests, bytes);
            return counted.limitReached()
                    ? counted.transitionTo(SessionState.EXHAUSTED, "usage limit reached")
                    : counted;
        });
    }

    /** The session's current version, without validating it. */
    public Optional<Session> find(String token) {
        return lookup(token).map(this::load);
    }

    /** Every recorded version of the session, oldest first. */
    public List<Session> history(String token) {
        HashKey sessionKey = require(token);
        return sessions.history(sessionKey).stream()
                .map(version -> PayloadCodec.decode(version, Session.class))
                .toList();
    }

    private SessionCheck rejectInactive(Session session) {
        DenialReason reason = session.state().denialReason();
        if (reason == null) {
            reason = DenialReason.NOT_FOUND;
        }
        log.info("Rejected session {}: {}", session.sessionKey().shortHex(), reason.code());
        return SessionCheck.rejected(reason, session, null);
    }

    private Session transition(HashKey sessionKey, UnaryOperator<Session> change) {
        for (int attempt = 1; ; attempt++) {
            Version current = sessions.current(sessionKey)
                    .orElseThrow(() -> new NotFoundException("session", sessionKey.toHex()));
            Session before = PayloadCodec.decode(current, Session.class);
            Session after = change.apply(before);
            if (after.equals(before)) {
                return before;
            }
            try {
                sessions.putIfCurrent(sessionKey, current, PayloadCodec.encode(after), RECORD_SOURCE);
            } catch (VersionConflictException e) {
                if (attempt >= settings.maxTransitionRetries()) {
                    throw e;
                }
                log.debug("Session {} changed concurrently, retrying ({})", sessionKey.shortHex(), attempt);
                continue;
            }
            if (after.state() != before.state()) {
                onStateChange(before, after);
            }
            return after;
        }
    }

    private void onStateChange(Session before, Session after) {
        metrics.counter("onevault.session.transitions", "Session lifecycle transitions",
                "state", after.state().name()).increment();
        String from = before == null ? null : before.state().name();
        if (after.state().isTerminal()) {
            log.info("Session {} of {} moved {} -> {} ({})", after.sessionKey().shortHex(),
                    after.actorKey().shortHex(), from, after.state(), after.stateReason());
        }
        var payload = new SessionAudit(now(), after.sessionKey().shortHex(), after.actorKey().toHex(),
                from, after.state().name(), after.stateReason());
        audit.publish(auditEvents.create(AuditEventType.SESSION_STATE_CHANGED,
                after.tenantKey().toHex(), after.sessionKey().toHex(), payload));
    }

    private void publishRiskDenied(Session session, RiskAssessment assessment, AccessTier previousTier) {
        log.warn("Session {} of {} crossed into risk tier DENIED from {} (score {}, degraded {})",
                session.sessionKey().shortHex(), session.actorKey().shortHex(),
                previousTier, assessment.score(), assessment.degraded());
        var payload = new AuthorizationAudit(now(), session.actorKey().toHex(), AuthorizationAudit.DENIED,
                DenialReason.RISK_DENIED.code(), null, null, assessment.score(), assessment.tier().name());
        audit.publish(auditEvents.create(AuditEventType.RISK_TIER_DENIED,
                session.tenantKey().toHex(), session.actorKey().toHex(), payload));
    }

    private Session load(HashKey sessionKey) {
        return sessions.current(sessionKey)
                .map(version -> PayloadCodec.decode(version, Session.class))
                .orElseThrow(() -> new NotFoundException("session", sessionKey.toHex()));
    }

    private Optional<HashKey> lookup(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(tokenIndex.get(digest(token)));
    }

    private HashKey require(String token) {
        return lookup(token).orElseThrow(
                () -> new NotFoundException("session", SensitiveDataRedactor.reference(token)));
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static String digest(String token) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(token.getBytes(StandardCharsets.UTF_8));
            return HEX.formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
