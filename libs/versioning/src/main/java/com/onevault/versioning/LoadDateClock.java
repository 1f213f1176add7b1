package com.onevault.versioning;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Source of load dates: microsecond resolution, strictly increasing per instance.
 *
 * <p>WHY not {@code clock.instant()} directly: two writes in the same microsecond, or a wall
 * clock stepping backwards, would otherwise produce equal or reversed effective-from values and
 * break the ordering of a satellite's history.
 */
public final class LoadDateClock {

    /** Smallest distinguishable step between two load dates. */
    public static final Duration EPSILON = Duration.of(1, ChronoUnit.MICROS);

    private final Clock clock;
    private final AtomicReference<Instant> last = new AtomicReference<>(Instant.MIN);

    public LoadDateClock(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    public static LoadDateClock systemUtc() {
        return new LoadDateClock(Clock.systemUTC());
    }

    /** Next load date, strictly after every load date this instance handed out before. */
    public Instant next() {
        return reserveAfter(null, 1);
    }

    /** Next load date, also strictly after {@code floor}. */
    public Instant nextAfter(Instant floor) {
        return reserveAfter(floor, 1);
    }

    /**
     * Reserves {@code ticks} consecutive load dates {@code t, t+ε, ...} and returns {@code t}.
     * {@code t} is strictly after {@code floor} (when given) and after every earlier reservation.
     */
    public Instant reserveAfter(Instant floor, int ticks) {
        if (ticks < 1) {
            throw new IllegalArgumentException("ticks must be >= 1");
        }
        Duration span = EPSILON.multipliedBy(ticks - 1L);
        Instant wall = clock.instant().truncatedTo(ChronoUnit.MICROS);
        Instant reservedEnd = last.updateAndGet(previous -> {
            Instant start = wall;
            if (!start.isAfter(previous)) {
                start = previous.plus(EPSILON);
            }
            if (floor != null && !start.isAfter(floor)) {
                start = floor.truncatedTo(ChronoUnit.MICROS).plus(EPSILON);
            }
            return start.plus(span);
        });
        return reservedEnd.minus(span);
    }
}
