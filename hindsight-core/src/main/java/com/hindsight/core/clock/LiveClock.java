package com.hindsight.core.clock;

import java.time.Instant;

/**
 * Wall clock. Only used to measure how long the engine itself takes.
 */
public class LiveClock implements Clock {

    @Override
    public Instant timeNow() {
        return Instant.now();
    }
}
