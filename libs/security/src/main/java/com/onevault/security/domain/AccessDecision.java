package com.onevault.security.domain;

import com.onevault.security.DenialReason;

/** Result of {@link DomainIsolationGate#authorize}. */
public interface AccessDecision {

    boolean allowed();

    static AccessDecision allow() {
        return Allowed.INSTANCE;
    }

    static AccessDecision deny(DenialReason reason) {
        return new Denied(reason);
    }

    record Allowed() implements AccessDecision {

        static final Allowed INSTANCE = new Allowed();

        @Override
        public boolean allowed() {
            return true;
        }
    }

    record Denied(DenialReason reason) implements AccessDecision {

        public Denied {
            if (reason == null) {
                throw new IllegalArgumentException("reason must not be null");
            }
        }

        @Override
        public boolean allowed() {
            return false;
        }
    }
}
