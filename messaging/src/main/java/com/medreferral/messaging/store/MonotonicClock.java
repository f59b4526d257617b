package com.medreferral.messaging.store;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Issues strictly increasing timestamps at microsecond precision (the precision the database keeps).
 * <p>
 * When the wall clock stalls or steps back, the next value is the previous one plus one microsecond.
 * </p>
 */
public class MonotonicClock {
    private final Clock clock;
    private final AtomicReference<Instant> last = new AtomicReference<>(Instant.EPOCH);

    public MonotonicClock(Clock clock) {
        this.clock = clock;
    }

    public Instant next() {
        return last.updateAndGet(previous -> {
            Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
            return now.isAfter(previous) ? now : previous.plus(1, ChronoUnit.MICROS);
        });
    }

    /**
     * Raises the floor, e.g. to the newest persisted timestamp after a restart.
     */
    public void advanceTo(Instant floor) {
        Instant truncated = floor.truncatedTo(ChronoUnit.MICROS);
        last.accumulateAndGet(truncated, (current, candidate) -> candidate.isAfter(current) ? candidate : current);
    }
}
