package com.onevault.accessservice.config;

import com.onevault.security.risk.RiskWeights;
import com.onevault.security.risk.TierBoundaries;
import com.onevault.security.session.SessionLimits;
import com.onevault.security.session.SessionSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the access core, bound from {@code onevault.access.*}:
 *
 * <pre>
 * onevault:
 *   access:
 *     service-name: access-service
 *     risk:
 *       weights: { device-trust: 25, network-origin: 25, behavioral-anomaly: 25, content-sensitivity: 25 }
 *       tiers: { full-max: 20, standard-max: 50, elevated-max: 80 }
 *       flagged-addresses: [ 203.0.113.7 ]
 *     session:
 *       ttl: 30m
 *       max-requests: 10000
 *       max-data-mb: 1024
 *     store:
 *       lock-timeout: 5s
 *     audit:
 *       retry-capacity: 10000
 * </pre>
 *
 * <p>WHY defaults in compact constructors: Spring passes null for an absent nested block, and the
 * defaults must be in place before Bean Validation runs so they satisfy the constraints.
 * Cross-field rules (tier order, non-zero weight sum) are enforced by the core's own value types
 * when {@link CoreConfiguration} builds them, so a bad file still fails at startup.
 *
 * @param serviceName tag on every meter and producer of every audit event. Required.
 */
@ConfigurationProperties(prefix = "onevault.access")
@Validated
public record AccessProperties(
        @NotBlank String serviceName, @Valid Risk risk, @Valid Session session, @Valid Store store,
        @Valid Audit audit) {

    public AccessProperties {
        risk = risk == null ? new Risk(null, null, null) : risk;
        session = session == null ? new Session(null, 0, 0, 0) : session;
        store = store == null ? new Store(null) : store;
        audit = audit == null ? new Audit(0, null) : audit;
    }

    public record Risk(@Valid Weights weights, @Valid Tiers tiers, Set<String> flaggedAddresses) {

        public Risk {
            weights = weights == null ? new Weights(25, 25, 25, 25) : weights;
            tiers = tiers == null ? new Tiers(20, 50, 80) : tiers;
            flaggedAddresses = flaggedAddresses == null ? Set.of() : Set.copyOf(flaggedAddresses);
        }
    }

    public record Weights(
            @PositiveOrZero double deviceTrust,
            @PositiveOrZero double networkOrigin,
            @PositiveOrZero double behavioralAnomaly,
            @PositiveOrZero double contentSensitivity) {

        public RiskWeights toRiskWeights() {
            return new RiskWeights(deviceTrust, networkOrigin, behavioralAnomaly, contentSensitivity);
        }
    }

    public record Tiers(@PositiveOrZero double fullMax, @Positive double standardMax, @Positive double elevatedMax) {

        public TierBoundaries toBoundaries() {
            return new TierBoundaries(fullMax, standardMax, elevatedMax);
        }
    }

    /**
     * @param ttl                  default session lifetime
     * @param maxRequests          default request cap, 0 for none
     * @param maxDataMb            default data cap in megabytes, 0 for none
     * @param maxTransitionRetries optimistic write attempts per session transition
     */
    public record Session(Duration ttl, long maxRequests, long maxDataMb, int maxTransitionRetries) {

        public Session {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                ttl = Duration.ofMinutes(30);
            }
            if (maxTransitionRetries <= 0) {
                maxTransitionRetries = 8;
            }
        }

        public SessionSettings toSettings() {
            long requests = maxRequests > 0 ? maxRequests : Long.MAX_VALUE;
            long bytes = maxDataMb > 0 ? Math.multiplyExact(maxDataMb, 1024L * 1024L) : Long.MAX_VALUE;
            return new SessionSettings(ttl, new SessionLimits(requests, bytes), maxTransitionRetries);
        }
    }

    /** @param lockTimeout how long a write waits for a contended key before failing */
    public record Store(Duration lockTimeout) {

        public Store {
            if (lockTimeout == null || lockTimeout.isZero() || lockTimeout.isNegative()) {
                lockTimeout = Duration.ofSeconds(5);
            }
        }
    }

    /**
     * @param retryCapacity audit records held for redelivery while the sink is down
     * @param retryInterval pause between redelivery attempts (ISO-8601, read by the scheduler)
     */
    public record Audit(@Positive int retryCapacity, Duration retryInterval) {

        public Audit {
            if (retryCapacity <= 0) {
                retryCapacity = 10_000;
            }
            if (retryInterval == null || retryInterval.isZero() || retryInterval.isNegative()) {
                retryInterval = Duration.ofSeconds(10);
            }
        }
    }
}
