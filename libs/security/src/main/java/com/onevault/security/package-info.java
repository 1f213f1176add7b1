/**
 * Zero trust access decisions.
 *
 * <p>{@link com.onevault.security.ZeroTrustGateway} composes the pieces: the
 * {@link com.onevault.security.session.SessionEngine session engine} resolves the token, the
 * {@link com.onevault.security.domain.DomainIsolationGate domain gate} checks the actor's
 * knowledge-domain assignment, and only then is the request scored with the
 * {@link com.onevault.security.risk.RiskEngine risk engine}. Refusals are values carrying a
 * {@link com.onevault.security.DenialReason}, never exceptions.
 */
package com.onevault.security;
