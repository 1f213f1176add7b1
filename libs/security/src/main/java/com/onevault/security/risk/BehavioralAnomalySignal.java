package com.onevault.security.risk;

import com.onevault.identity.HashKey;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scores deviation from the actor's usual behaviour: recent failed attempts raise the score, and
 * so does a request outside the hours (UTC) the actor normally works in.
 */
public final class BehavioralAnomalySignal implements RiskSignal {

    static final double BASELINE = 10;
    static final double PER_FAILED_ATTEMPT = 15;
    static final double OFF_HOURS_PENALTY = 30;

    /** Earliest and latest hour of day seen on passed requests, per actor. */
    private final Map<HashKey, int[]> usualHours = new ConcurrentHashMap<>();

    @Override
    public RiskSignalType type() {
        return RiskSignalType.BEHAVIORAL_ANOMALY;
    }

    @Override
    public double score(HashKey actor, RiskContext context) {
        double score = BASELINE + PER_FAILED_ATTEMPT * context.recentFailedAttempts();
        int[] window = usualHours.get(actor);
        if (window != null) {
            int hour = hourOf(context);
            synchronized (window) {
                if (hour < window[0] || hour > window[1]) {
                    score += OFF_HOURS_PENALTY;
                }
            }
        }
        return Math.min(100, score);
    }

    @Override
    public void recordSuccess(HashKey actor, RiskContext context) {
        int hour = hourOf(context);
        int[] window = usualHours.computeIfAbsent(actor, k -> new int[] {hour, hour});
        synchronized (window) {
            window[0] = Math.min(window[0], hour);
            window[1] = Math.max(window[1], hour);
        }
    }

    private static int hourOf(RiskContext context) {
        return context.requestedAt().atZone(ZoneOffset.UTC).getHour();
    }
}
