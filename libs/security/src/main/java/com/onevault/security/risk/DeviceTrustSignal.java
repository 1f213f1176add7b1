package com.onevault.security.risk;

import com.onevault.identity.HashKey;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scores how well the actor's device is known: a device seen on several passed requests is
 * trusted, a new one is not, and a missing fingerprint is treated as unknown-but-suspicious.
 */
public final class DeviceTrustSignal implements RiskSignal {

    static final double MISSING = 50;
    static final double NEW_DEVICE = 60;
    static final double SEEN = 30;
    static final double KNOWN = 10;
    static final int KNOWN_AFTER = 5;

    private final Map<String, AtomicInteger> sightings = new ConcurrentHashMap<>();

    @Override
    public RiskSignalType type() {
        return RiskSignalType.DEVICE_TRUST;
    }

    @Override
    public double score(HashKey actor, RiskContext context) {
        if (context.deviceId() == null || context.deviceId().isBlank()) {
            return MISSING;
        }
        AtomicInteger count = sightings.get(key(actor, context.deviceId()));
        int seen = count == null ? 0 : count.get();
        if (seen >= KNOWN_AFTER) {
            return KNOWN;
        }
        return seen > 0 ? SEEN : NEW_DEVICE;
    }

    @Override
    public void recordSuccess(HashKey actor, RiskContext context) {
        if (context.deviceId() != null && !context.deviceId().isBlank()) {
            sightings.computeIfAbsent(key(actor, context.deviceId()), k -> new AtomicInteger()).incrementAndGet();
        }
    }

    private static String key(HashKey actor, String deviceId) {
        return actor.toHex() + '/' + deviceId;
    }
}
