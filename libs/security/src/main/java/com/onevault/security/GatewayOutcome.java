package com.onevault.security;

import com.onevault.security.risk.RiskAssessment;
import com.onevault.security.session.Session;
import com.onevault.versioning.Version;
import com.onevault.versioning.link.LinkRecord;
import java.util.Optional;

/**
 * What {@link ZeroTrustGateway} decided, plus whatever the allowed operation produced.
 *
 * @param allowed    true if the request passed every check
 * @param reason     first failed check, null when allowed
 * @param assessment risk assessment, null if the session check stopped before scoring
 * @param session    session as of the decision, null if the token was unknown
 * @param version    satellite version written or read, if any
 * @param link       link recorded, if any
 */
public record GatewayOutcome(
        boolean allowed,
        DenialReason reason,
        RiskAssessment assessment,
        Session session,
        Version version,
        LinkRecord link) {

    static GatewayOutcome allow(Session session, RiskAssessment assessment) {
        return new GatewayOutcome(true, null, assessment, session, null, null);
    }

    static GatewayOutcome deny(DenialReason reason, Session session, RiskAssessment assessment) {
        return new GatewayOutcome(false, reason, assessment, session, null, null);
    }

    GatewayOutcome withVersion(Version written) {
        return new GatewayOutcome(allowed, reason, assessment, session, written, link);
    }

    GatewayOutcome withLink(LinkRecord recorded) {
        return new GatewayOutcome(allowed, reason, assessment, session, version, recorded);
    }

    public Optional<DenialReason> denialReason() {
        return Optional.ofNullable(reason);
    }
}
