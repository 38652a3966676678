package com.hindsight.core.clock;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Controllable clock that represents simulated time inside a backtest.
 *
 * Whoever holds the TestClock reference may move time; everything else should be
 * handed the {@link Clock} view.
 */
public class TestClock implements Clock {

    private Instant time;

    public TestClock(Instant initialTime) {
        this.time = Objects.requireNonNull(initialTime, "initialTime");
    }

    @Override
    public Instant timeNow() {
        return time;
    }

    public void setTime(Instant time) {
        this.time = Objects.requireNonNull(time, "time");
    }

    public Instant advance(Duration step) {
        time = time.plus(step);
        return time;
    }
}
