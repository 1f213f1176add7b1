package com.onevault.security.risk;

/** The four independent inputs to a risk score. */
public enum RiskSignalType {
    DEVICE_TRUST,
    NETWORK_ORIGIN,
    BEHAVIORAL_ANOMALY,
    CONTENT_SENSITIVITY
}
