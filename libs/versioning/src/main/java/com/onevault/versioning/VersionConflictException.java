package com.onevault.versioning;

import com.onevault.identity.HashKey;

/**
 * Thrown by {@link VersionStore#putIfCurrent} when the current version changed since the caller
 * read it. Safe to retry after re-reading.
 */
public class VersionConflictException extends RuntimeException {

    private final HashKey hashKey;
    private final String expectedVersionId;
    private final String actualVersionId;

    public VersionConflictException(HashKey hashKey, String expectedVersionId, String actualVersionId) {
        super("Version conflict on %s: expected current %s but found %s"
                .formatted(hashKey.shortHex(), expectedVersionId, actualVersionId));
        this.hashKey = hashKey;
        this.expectedVersionId = expectedVersionId;
        this.actualVersionId = actualVersionId;
    }

    public HashKey hashKey() {
        return hashKey;
    }

    public String expectedVersionId() {
        return expectedVersionId;
    }

    public String actualVersionId() {
        return actualVersionId;
    }
}
