package com.onevault.security.testing;

import com.onevault.identity.HashKey;
import com.onevault.security.risk.RiskContext;
import com.onevault.security.risk.RiskSignal;
import com.onevault.security.risk.RiskSignalType;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Risk signal whose score the test sets directly. Can also be made to fail, to exercise the
 * worst-case degradation. Counts the requests it was asked to learn from.
 */
public final class FixedRiskSignal implements RiskSignal {

    private final RiskSignalType type;
    private volatile double score;
    private volatile boolean failing;
    private final AtomicInteger learned = new AtomicInteger();

    public FixedRiskSignal(RiskSignalType type, double score) {
        this.type = type;
        this.score = score;
    }

    @Override
    public RiskSignalType type() {
        return type;
    }

    @Override
    public double score(HashKey actor, RiskContext context) {
        if (failing) {
            throw new IllegalStateException(type + " source unavailable");
        }
        return score;
    }

    @Override
    public void recordSuccess(HashKey actor, RiskContext context) {
        learned.incrementAndGet();
    }

    /** Number of {@link #recordSuccess} calls so far. */
    public int learnedCount() {
        return learned.get();
    }

    public void setScore(double score) {
        this.score = score;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }
}
