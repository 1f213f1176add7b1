package com.onevault.identity;

import java.time.Instant;

/**
 * Immutable hub row binding a business key to its derived hash key within a tenant.
 *
 * <p>Created exactly once per entity and never updated. A tenant's own hub has
 * {@code tenantKey == hashKey}.
 *
 * @param hashKey      derived identifier
 * @param businessKey  human-meaningful key the hash was derived from
 * @param tenantKey    hash key of the owning tenant
 * @param loadDate     when the hub was first recorded
 * @param recordSource provenance tag (the system or process that created the row)
 */
public record HubRecord(
        HashKey hashKey, String businessKey, HashKey tenantKey, Instant loadDate, String recordSource) {}
