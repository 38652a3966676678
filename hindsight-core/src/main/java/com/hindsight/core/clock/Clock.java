package com.hindsight.core.clock;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only source of "now".
 */
public interface Clock {

    Instant timeNow();

    /**
     * Time elapsed between {@code start} and this clock's current reading.
     */
    default Duration elapsedSince(Instant start) {
        return Duration.between(start, timeNow());
    }
}
