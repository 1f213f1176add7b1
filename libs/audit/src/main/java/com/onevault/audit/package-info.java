/**
 * Audit records for decisions, session transitions and store mutations, and their
 * fire-and-forget delivery to an {@link com.onevault.audit.AuditSink}.
 */
package com.onevault.audit;
