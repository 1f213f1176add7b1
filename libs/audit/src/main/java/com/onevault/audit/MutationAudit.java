package com.onevault.audit;

import java.time.Instant;

/**
 * A hub, satellite version or link was appended.
 *
 * @param timestamp    load date of the new row
 * @param hashKey      hex key of the hub, entity or link
 * @param versionId    row identifier ({@code hex@effectiveFrom} for satellite versions)
 * @param recordSource provenance tag of the row
 */
public record MutationAudit(Instant timestamp, String hashKey, String versionId, String recordSource) {}
