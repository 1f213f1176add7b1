package com.onevault.versioning;

import com.onevault.identity.HashKey;
import com.onevault.identity.MutationListener;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only satellite store with bitemporal reads.
 *
 * <p>Superseding never rewrites history: the current version is closed at {@code t1} and the new
 * one starts at {@code t1 + ε}, both in one atomic step.
 */
public interface VersionStore {

    Optional<Version> current(HashKey hashKey);

    /**
     * Records a new version unless the payload's fingerprint equals the current one.
     *
     * @return the new current version, or the unchanged current version on a no-op
     * @throws StoreUnavailableException   if the key's lock could not be acquired in time
     * @throws OperationCancelledException if the calling thread was interrupted before commit
     */
    Version put(HashKey hashKey, byte[] payload, String recordSource);

    /**
     * Like {@link #put}, but only if the current version is still {@code expectedCurrent}
     * ({@code null} meaning "no version yet").
     *
     * @throws VersionConflictException if another writer got there first
     */
    Version putIfCurrent(HashKey hashKey, Version expectedCurrent, byte[] payload, String recordSource);

    /** All versions, oldest first. Each call returns a fresh immutable snapshot. */
    List<Version> history(HashKey hashKey);

    /** The version effective at {@code instant}, if any. */
    Optional<Version> asOf(HashKey hashKey, Instant instant);

    /** Registers a listener called once per appended version, after commit. */
    void addListener(MutationListener listener);
}
