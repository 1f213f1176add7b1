package com.onevault.security.risk;

import com.onevault.identity.HashKey;
import java.util.Locale;
import java.util.Map;

/**
 * Scores the most sensitive data category a request touches. Categories are matched
 * case-insensitively; an unlisted category scores {@link #UNKNOWN_CATEGORY}.
 */
public final class ContentSensitivitySignal implements RiskSignal {

    static final double UNKNOWN_CATEGORY = 50;

    private static final Map<String, Double> DEFAULT_SENSITIVITY = Map.of(
            "public", 0.0,
            "internal", 20.0,
            "operational", 20.0,
            "financial", 60.0,
            "pii", 60.0,
            "phi", 80.0,
            "credentials", 100.0);

    private final Map<String, Double> sensitivity;

    public ContentSensitivitySignal() {
        this(DEFAULT_SENSITIVITY);
    }

    /**
     * @param sensitivity score in [0, 100] per lower-case category name
     */
    public ContentSensitivitySignal(Map<String, Double> sensitivity) {
        sensitivity.forEach((category, score) -> {
            if (score == null || score < 0 || score > 100) {
                throw new IllegalArgumentException("sensitivity of " + category + " must be within [0, 100]");
            }
        });
        this.sensitivity = Map.copyOf(sensitivity);
    }

    @Override
    public RiskSignalType type() {
        return RiskSignalType.CONTENT_SENSITIVITY;
    }

    @Override
    public double score(HashKey actor, RiskContext context) {
        double max = 0.0;
        for (String category : context.dataCategories()) {
            double score = sensitivity.getOrDefault(category.toLowerCase(Locale.ROOT), UNKNOWN_CATEGORY);
            max = Math.max(max, score);
        }
        return max;
    }
}
