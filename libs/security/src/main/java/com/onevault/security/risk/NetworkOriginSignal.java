package com.onevault.security.risk;

import com.onevault.identity.HashKey;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scores the request's network origin: familiar addresses score low, new ones high, and
 * addresses on the flagged list (recent high-severity threat activity) add a penalty.
 */
public final class NetworkOriginSignal implements RiskSignal {

    static final double MISSING = 50;
    static final double NEW_ADDRESS = 60;
    static final double SEEN = 30;
    static final double KNOWN = 10;
    static final double FLAGGED_PENALTY = 40;
    static final int KNOWN_AFTER = 5;

    private final Map<String, AtomicInteger> sightings = new ConcurrentHashMap<>();
    private final Set<String> flaggedAddresses = ConcurrentHashMap.newKeySet();

    public NetworkOriginSignal() {
        this(Set.of());
    }

    public NetworkOriginSignal(Set<String> flaggedAddresses) {
        this.flaggedAddresses.addAll(flaggedAddresses);
    }

    @Override
    public RiskSignalType type() {
        return RiskSignalType.NETWORK_ORIGIN;
    }

    @Override
    public double score(HashKey actor, RiskContext context) {
        String address = context.sourceAddress();
        if (address == null || address.isBlank()) {
            return MISSING;
        }
        AtomicInteger count = sightings.get(address);
        int seen = count == null ? 0 : count.get();
        double score = seen >= KNOWN_AFTER ? KNOWN : seen > 0 ? SEEN : NEW_ADDRESS;
        if (flaggedAddresses.contains(address)) {
            score += FLAGGED_PENALTY;
        }
        return Math.min(100, score);
    }

    @Override
    public void recordSuccess(HashKey actor, RiskContext context) {
        String address = context.sourceAddress();
        if (address != null && !address.isBlank()) {
            sightings.computeIfAbsent(address, k -> new AtomicInteger()).incrementAndGet();
        }
    }

    /** Marks an address as involved in recent threat activity. */
    public void flag(String address) {
        flaggedAddresses.add(address);
    }

    public void clearFlag(String address) {
        flaggedAddresses.remove(address);
    }
}
