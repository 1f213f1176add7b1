package com.onevault.security.risk;

/**
 * Non-negative weight per signal. Non-negativity keeps the score monotonic: raising one signal
 * can never lower the weighted mean.
 */
public record RiskWeights(double deviceTrust, double networkOrigin, double behavioralAnomaly,
                          double contentSensitivity) {

    public RiskWeights {
        requireWeight(deviceTrust, "deviceTrust");
        requireWeight(networkOrigin, "networkOrigin");
        requireWeight(behavioralAnomaly, "behavioralAnomaly");
        requireWeight(contentSensitivity, "contentSensitivity");
        if (deviceTrust + networkOrigin + behavioralAnomaly + contentSensitivity <= 0.0) {
            throw new IllegalArgumentException("at least one risk weight must be positive");
        }
    }

    /** Equal weights. */
    public static RiskWeights defaults() {
        return new RiskWeights(25, 25, 25, 25);
    }

    public double weightOf(RiskSignalType type) {
        return switch (type) {
            case DEVICE_TRUST -> deviceTrust;
            case NETWORK_ORIGIN -> networkOrigin;
            case BEHAVIORAL_ANOMALY -> behavioralAnomaly;
            case CONTENT_SENSITIVITY -> contentSensitivity;
        };
    }

    public double total() {
        return deviceTrust + networkOrigin + behavioralAnomaly + contentSensitivity;
    }

    private static void requireWeight(double weight, String name) {
        if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0.0) {
            throw new IllegalArgumentException(name + " weight must be a finite number >= 0");
        }
    }
}
