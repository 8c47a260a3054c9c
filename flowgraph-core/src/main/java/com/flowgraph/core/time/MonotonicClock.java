package com.flowgraph.core.time;

import java.time.Clock;
import java.time.Instant;

/**
 * Source of recorded (system) time. Never goes backwards, even when the
 * underlying clock does. Readings are truncated to {@link TimeSemantics#PRECISION}.
 */
public class MonotonicClock {

    private final Clock clock;
    private Instant last = Instant.MIN;

    public MonotonicClock() {
        this(Clock.systemUTC());
    }

    public MonotonicClock(Clock clock) {
        this.clock = clock;
    }

    /**
     * Current time, never earlier than any value returned before.
     */
    public synchronized Instant now() {
        Instant current = TimeSemantics.atStoredPrecision(clock.instant());
        if (current.isAfter(last)) {
            last = current;
        }
        return last;
    }

    /**
     * Current time, but no earlier than {@code floor}.
     * Used to keep recorded time non-decreasing across writers with skewed clocks.
     */
    public Instant notBefore(Instant floor) {
        Instant current = now();
        floor = TimeSemantics.atStoredPrecision(floor);
        return floor != null && floor.isAfter(current) ? floor : current;
    }
}
