package com.hindsight.runner.strategy;

import com.hindsight.engine.trading.AbstractStrategy;

import java.time.Instant;

/**
 * Never trades. Useful as a baseline and for timing the engine itself.
 */
public class NoOpStrategy extends AbstractStrategy {

    public NoOpStrategy(String id) {
        super(id);
    }

    @Override
    public void onStep(Instant time) {
    }
}
