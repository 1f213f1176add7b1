package com.onevault.security.session;

/**
 * Result of {@link SessionEngine#issue}. The token is returned exactly once, here; the core only
 * keeps its digest.
 */
public record IssuedSession(String token, Session session) {

    @Override
    public String toString() {
        return "IssuedSession[token=[REDACTED], session=" + session.sessionKey().shortHex() + "]";
    }
}
