package com.onevault.security.risk;

import java.time.Instant;
import java.util.Set;

/**
 * What the caller knows about the request being risk-scored.
 *
 * @param deviceId             client/device fingerprint, null if the caller could not supply one
 * @param sourceAddress        network origin (e.g. IP address), null if unknown
 * @param requestedAt          when the request arrived
 * @param recentFailedAttempts failed authentications for this actor in the recent window
 * @param dataCategories       categories of data the request touches, e.g. {@code "phi"}
 */
public record RiskContext(
        String deviceId,
        String sourceAddress,
        Instant requestedAt,
        int recentFailedAttempts,
        Set<String> dataCategories) {

    public RiskContext {
        if (requestedAt == null) {
            throw new IllegalArgumentException("requestedAt must not be null");
        }
        if (recentFailedAttempts < 0) {
            throw new IllegalArgumentException("recentFailedAttempts must be >= 0");
        }
        dataCategories = dataCategories == null ? Set.of() : Set.copyOf(dataCategories);
    }

    /** Context with a device and address but no failures and no sensitive data. */
    public static RiskContext of(String deviceId, String sourceAddress, Instant requestedAt) {
        return new RiskContext(deviceId, sourceAddress, requestedAt, 0, Set.of());
    }

    public RiskContext withDataCategories(Set<String> categories) {
        return new RiskContext(deviceId, sourceAddress, requestedAt, recentFailedAttempts, categories);
    }

    public RiskContext withFailedAttempts(int failedAttempts) {
        return new RiskContext(deviceId, sourceAddress, requestedAt, failedAttempts, dataCategories);
    }
}
