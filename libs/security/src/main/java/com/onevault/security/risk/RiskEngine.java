package com.onevault.security.risk;

import com.onevault.identity.HashKey;
import com.onevault.observability.MetricFactory;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores a request as the weighted mean of its four signals and maps the score to an
 * {@link AccessTier}.
 *
 * <p>WHY a weighted mean: with non-negative weights it is monotonic in every signal, so a worse
 * input can never buy a better tier.
 *
 * <p>A signal source that throws, or returns NaN or a value outside [0, 100], is scored 100 and
 * reported as degraded (WARN log plus the {@code onevault.risk.signal.degraded} counter).
 */
public final class RiskEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskEngine.class);

    public static final double WORST_CASE = 100.0;

    private final Map<RiskSignalType, RiskSignal> signals;
    private final RiskWeights weights;
    private final TierBoundaries boundaries;
    private final MetricFactory metrics;

    /**
     * @throws IllegalArgumentException unless exactly one signal is given per {@link RiskSignalType}
     */
    public RiskEngine(List<RiskSignal> signals, RiskWeights weights, TierBoundaries boundaries,
                      MetricFactory metrics) {
        if (weights == null || boundaries == null || metrics == null) {
            throw new IllegalArgumentException("weights, boundaries and metrics must not be null");
        }
        Map<RiskSignalType, RiskSignal> byType = new EnumMap<>(RiskSignalType.class);
        for (RiskSignal signal : signals) {
            if (byType.put(signal.type(), signal) != null) {
                throw new IllegalArgumentException("duplicate risk signal for " + signal.type());
            }
        }
        if (byType.size() != RiskSignalType.values().length) {
            Set<RiskSignalType> missing = EnumSet.allOf(RiskSignalType.class);
            missing.removeAll(byType.keySet());
            throw new IllegalArgumentException("missing risk signals: " + missing);
        }
        this.signals = byType;
        this.weights = weights;
        this.boundaries = boundaries;
        this.metrics = metrics;
    }

    public RiskAssessment assess(HashKey actor, RiskContext context) {
        Map<RiskSignalType, Double> scores = new EnumMap<>(RiskSignalType.class);
        Set<RiskSignalType> degraded = EnumSet.noneOf(RiskSignalType.class);

        double weighted = 0.0;
        for (Map.Entry<RiskSignalType, RiskSignal> entry : signals.entrySet()) {
            RiskSignalType type = entry.getKey();
            double score = scoreOf(entry.getValue(), actor, context);
            if (Double.isNaN(score)) {
                degraded.add(type);
                metrics.counter("onevault.risk.signal.degraded", "Risk signals scored worst case",
                        "signal", type.name()).increment();
                score = WORST_CASE;
            }
            scores.put(type, score);
            weighted += weights.weightOf(type) * score;
        }

        double total = Math.min(WORST_CASE, Math.max(0.0, weighted / weights.total()));
        AccessTier tier = boundaries.tierFor(total);
        log.debug("Risk for {}: {} ({}) signals={} degraded={}", actor.shortHex(), total, tier, scores, degraded);
        return new RiskAssessment(total, tier, scores, degraded);
    }

    /** Lets history-based signals learn from a request that passed. */
    public void recordSuccess(HashKey actor, RiskContext context) {
        for (RiskSignal signal : signals.values()) {
            try {
                signal.recordSuccess(actor, context);
            } catch (RuntimeException e) {
                log.warn("Risk signal {} failed to record history", signal.type(), e);
            }
        }
    }

    public TierBoundaries boundaries() {
        return boundaries;
    }

    public RiskWeights weights() {
        return weights;
    }

    /** Returns NaN when the source failed. */
    private static double scoreOf(RiskSignal signal, HashKey actor, RiskContext context) {
        try {
            double score = signal.score(actor, context);
            if (Double.isNaN(score) || score < 0.0 || score > WORST_CASE) {
                log.warn("Risk signal {} returned out-of-range score {}, assuming worst case", signal.type(), score);
                return Double.NaN;
            }
            return score;
        } catch (RuntimeException e) {
            log.warn("Risk signal {} failed, assuming worst case: {}", signal.type(), e.toString());
            return Double.NaN;
        }
    }
}
