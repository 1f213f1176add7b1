package com.onevault.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each audit record as one JSON line to the {@code onevault.audit} logger, so the
 * logging pipeline can route it separately from application logs.
 */
public final class LoggingAuditSink implements AuditSink {

    public static final String LOGGER_NAME = "onevault.audit";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void deliver(AuditEnvelope<?> envelope) {
        audit.info(AuditSerializer.serialize(envelope));
    }
}
