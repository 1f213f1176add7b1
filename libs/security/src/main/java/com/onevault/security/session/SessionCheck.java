package com.onevault.security.session;

import com.onevault.security.DenialReason;
import com.onevault.security.risk.RiskAssessment;
import java.util.Optional;

/**
 * Outcome of {@link SessionEngine#validate}, {@link SessionEngine#resolve} or
 * {@link SessionEngine#score}: either {@link Valid} or {@link Rejected}. A rejection is a normal
 * result, not an exception.
 */
public interface SessionCheck {

    boolean valid();

    /** The session as of this check; empty only when the token was unknown. */
    Optional<Session> session();

    /** Assessment computed during the check, empty if the check stopped before risk scoring. */
    Optional<RiskAssessment> assessment();

    static SessionCheck valid(Session session, RiskAssessment assessment) {
        return new Valid(session, assessment);
    }

    static SessionCheck rejected(DenialReason reason, Session session, RiskAssessment assessment) {
        return new Rejected(reason, session, assessment);
    }

    /** Passed check; {@code risk} is null when the session was resolved but not yet scored. */
    record Valid(Session current, RiskAssessment risk) implements SessionCheck {

        public Valid {
            if (current == null) {
                throw new IllegalArgumentException("current must not be null");
            }
        }

        @Override
        public boolean valid() {
            return true;
        }

        @Override
        public Optional<Session> session() {
            return Optional.of(current);
        }

        @Override
        public Optional<RiskAssessment> assessment() {
            return Optional.ofNullable(risk);
        }
    }

    record Rejected(DenialReason reason, Session current, RiskAssessment risk) implements SessionCheck {

        public Rejected {
            if (reason == null) {
                throw new IllegalArgumentException("reason must not be null");
            }
        }

        @Override
        public boolean valid() {
            return false;
        }

        @Override
        public Optional<Session> session() {
            return Optional.ofNullable(current);
        }

        @Override
        public Optional<RiskAssessment> assessment() {
            return Optional.ofNullable(risk);
        }
    }
}
