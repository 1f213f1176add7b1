package com.onevault.versioning;

import com.onevault.identity.HashKey;
import com.onevault.identity.IdentityValidationException;
import com.onevault.identity.MutationListener;
import com.onevault.identity.MutationRecord;
import com.onevault.identity.RecordFamily;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link VersionStore} held in memory.
 *
 * <p>Concurrency: each hash key owns an immutable snapshot of its history, published through a
 * volatile field, so readers never lock. Writers on the same key serialize on a per-key
 * {@link ReentrantLock}; writers on different keys never contend. The commit point is the single
 * volatile write of the new snapshot, so a reader sees either the old history or the new one,
 * never a closed version without its successor.
 */
public final class InMemoryVersionStore implements VersionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVersionStore.class);

    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private final ConcurrentMap<HashKey, Satellite> satellites = new ConcurrentHashMap<>();
    private final List<MutationListener> listeners = new CopyOnWriteArrayList<>();
    private final LoadDateClock loadDates;
    private final Duration lockTimeout;

    public InMemoryVersionStore(LoadDateClock loadDates) {
        this(loadDates, DEFAULT_LOCK_TIMEOUT);
    }

    public InMemoryVersionStore(LoadDateClock loadDates, Duration lockTimeout) {
        if (loadDates == null) {
            throw new IllegalArgumentException("loadDates must not be null");
        }
        if (lockTimeout == null || lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be positive");
        }
        this.loadDates = loadDates;
        this.lockTimeout = lockTimeout;
    }

    @Override
    public Optional<Version> current(HashKey hashKey) {
        Satellite satellite = satellites.get(hashKey);
        return satellite == null ? Optional.empty() : Optional.ofNullable(satellite.current());
    }

    @Override
    public Version put(HashKey hashKey, byte[] payload, String recordSource) {
        return write(hashKey, payload, recordSource, false, null);
    }

    @Override
    public Version putIfCurrent(HashKey hashKey, Version expectedCurrent, byte[] payload, String recordSource) {
        return write(hashKey, payload, recordSource, true, expectedCurrent);
    }

    @Override
    public List<Version> history(HashKey hashKey) {
        Satellite satellite = satellites.get(hashKey);
        return satellite == null ? List.of() : satellite.versions;
    }

    @Override
    public Optional<Version> asOf(HashKey hashKey, Instant instant) {
        if (instant == null) {
            throw new IdentityValidationException("instant must not be null");
        }
        List<Version> versions = history(hashKey);
        for (int i = versions.size() - 1; i >= 0; i--) {
            Version version = versions.get(i);
            if (version.isEffectiveAt(instant)) {
                return Optional.of(version);
            }
        }
        return Optional.empty();
    }

    @Override
    public void addListener(MutationListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        listeners.add(listener);
    }

    // visible for tests
    ReentrantLock lockOf(HashKey hashKey) {
        return satellites.computeIfAbsent(hashKey, k -> new Satellite()).lock;
    }

    private Version write(HashKey hashKey, byte[] payload, String recordSource,
                          boolean conditional, Version expectedCurrent) {
        validate(hashKey, payload, recordSource);
        String fingerprint = Fingerprints.of(payload);
        Satellite satellite = satellites.computeIfAbsent(hashKey, k -> new Satellite());

        acquire(satellite, hashKey);
        Version written;
        try {
            List<Version> snapshot = satellite.versions;
            Version current = satellite.current();

            if (conditional && !sameVersion(expectedCurrent, current)) {
                throw new VersionConflictException(hashKey, idOf(expectedCurrent), idOf(current));
            }
            if (current != null && current.fingerprint().equals(fingerprint)) {
                log.trace("No-op write on {}: payload unchanged", hashKey.shortHex());
                return current;
            }

            List<Version> next = new ArrayList<>(snapshot.size() + 1);
            if (current == null) {
                next.addAll(snapshot);
                written = new Version(hashKey, loadDates.next(), null, fingerprint, payload, recordSource);
            } else {
                Instant closedAt = loadDates.reserveAfter(current.effectiveFrom(), 2);
                next.addAll(snapshot.subList(0, snapshot.size() - 1));
                next.add(current.closedAt(closedAt));
                written = new Version(hashKey, closedAt.plus(LoadDateClock.EPSILON), null,
                        fingerprint, payload, recordSource);
            }
            next.add(written);

            if (Thread.currentThread().isInterrupted()) {
                throw new OperationCancelledException(
                        "Write on " + hashKey.shortHex() + " cancelled before commit");
            }
            satellite.versions = List.copyOf(next);
        } finally {
            satellite.lock.unlock();
        }

        log.debug("Appended version {} from {}", written.versionId(), recordSource);
        notifyAppended(written);
        return written;
    }

    private void acquire(Satellite satellite, HashKey hashKey) {
        boolean locked;
        try {
            locked = satellite.lock.tryLock(lockTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(
                    "Interrupted waiting to write " + hashKey.shortHex(), e);
        }
        if (!locked) {
            log.warn("Lock timeout on {} after {}", hashKey.shortHex(), lockTimeout);
            throw new StoreUnavailableException(hashKey, lockTimeout);
        }
    }

    private void notifyAppended(Version version) {
        var mutation = new MutationRecord(version.effectiveFrom(), RecordFamily.SATELLITE,
                version.hashKey(), version.versionId(), version.recordSource());
        for (MutationListener listener : listeners) {
            try {
                listener.onMutation(mutation);
            } catch (RuntimeException e) {
                log.warn("Mutation listener failed for {}", version.versionId(), e);
            }
        }
    }

    private static boolean sameVersion(Version expected, Version actual) {
        if (expected == null || actual == null) {
            return expected == null && actual == null;
        }
        return expected.versionId().equals(actual.versionId());
    }

    private static String idOf(Version version) {
        return version == null ? "<none>" : version.versionId();
    }

    private static void validate(HashKey hashKey, byte[] payload, String recordSource) {
        if (hashKey == null) {
            throw new IdentityValidationException("hashKey must not be null");
        }
        if (payload == null) {
            throw new IdentityValidationException("payload must not be null");
        }
        if (recordSource == null || recordSource.isBlank()) {
            throw new IdentityValidationException("recordSource must not be null or blank");
        }
    }

    /** History of one hash key. */
    private static final class Satellite {
        final ReentrantLock lock = new ReentrantLock();
        volatile List<Version> versions = List.of();

        Version current() {
            List<Version> snapshot = versions;
            if (snapshot.isEmpty()) {
                return null;
            }
            Version last = snapshot.get(snapshot.size() - 1);
            return last.isCurrent() ? last : null;
        }
    }
}
