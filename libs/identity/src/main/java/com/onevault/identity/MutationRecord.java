package com.onevault.identity;

import java.time.Instant;

/**
 * Notification that a hub, satellite or link row was appended.
 *
 * @param timestamp    load date of the new row
 * @param family       which record family was written
 * @param hashKey      hub, entity or link hash key the row belongs to
 * @param versionId    stable identifier of the row ({@code hex@effectiveFrom} for satellites)
 * @param recordSource provenance tag carried by the row
 */
public record MutationRecord(
        Instant timestamp, RecordFamily family, HashKey hashKey, String versionId, String recordSource) {}
