package com.onevault.versioning;

import com.onevault.identity.HashKey;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One immutable, time-bounded satellite row.
 *
 * <p>Effective over {@code [effectiveFrom, effectiveTo)}. A {@code null} effectiveTo marks the
 * current version; at most one version per hash key has it.
 *
 * @param hashKey       entity (or link) the version belongs to
 * @param effectiveFrom load date at which this version became effective
 * @param effectiveTo   load date at which it was superseded, or {@code null} while current
 * @param fingerprint   hex SHA-256 of the payload
 * @param payload       opaque payload bytes (copied in and out)
 * @param recordSource  provenance tag
 */
public record Version(
        HashKey hashKey,
        Instant effectiveFrom,
        Instant effectiveTo,
        String fingerprint,
        byte[] payload,
        String recordSource) {

    public Version {
        Objects.requireNonNull(hashKey, "hashKey");
        Objects.requireNonNull(effectiveFrom, "effectiveFrom");
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(recordSource, "recordSource");
        if (effectiveTo != null && !effectiveTo.isAfter(effectiveFrom)) {
            throw new IllegalArgumentException("effectiveTo must be after effectiveFrom");
        }
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /** Stable identifier: {@code <hex hash key>@<effectiveFrom>}. */
    public String versionId() {
        return hashKey.toHex() + "@" + effectiveFrom;
    }

    public boolean isCurrent() {
        return effectiveTo == null;
    }

    /** True if {@code instant} falls in {@code [effectiveFrom, effectiveTo)}. */
    public boolean isEffectiveAt(Instant instant) {
        return !effectiveFrom.isAfter(instant) && (effectiveTo == null || instant.isBefore(effectiveTo));
    }

    /** Copy of this version closed at {@code effectiveTo}. */
    Version closedAt(Instant closedAt) {
        return new Version(hashKey, effectiveFrom, closedAt, fingerprint, payload, recordSource);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Version other
                && hashKey.equals(other.hashKey)
                && effectiveFrom.equals(other.effectiveFrom)
                && Objects.equals(effectiveTo, other.effectiveTo)
                && fingerprint.equals(other.fingerprint)
                && Arrays.equals(payload, other.payload)
                && recordSource.equals(other.recordSource);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hashKey, effectiveFrom, effectiveTo, fingerprint, recordSource);
    }

    @Override
    public String toString() {
        return "Version[" + versionId() + ", to=" + effectiveTo + ", fp=" + fingerprint.substring(0, 8)
                + ", source=" + recordSource + "]";
    }
}
