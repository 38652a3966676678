package com.hindsight.engine.trading;

import java.time.Instant;

/**
 * A strategy driven one simulated step at a time.
 *
 * <p>The engine calls {@link #register(StrategyContext)} before the strategy takes part in a
 * run, and again whenever the strategy set is changed; a strategy should use only the
 * context it was last given.
 */
public interface TradingStrategy {

    /**
     * Unique id within a backtest; used as the owner of the strategy's orders and positions.
     */
    String id();

    void register(StrategyContext context);

    StrategyContext context();

    default void onStart() {
    }

    /**
     * Called once per step after market processing, with the step's simulated time.
     */
    void onStep(Instant time);

    default void onStop() {
    }

    /**
     * Clear internal state so the next run starts fresh.
     */
    default void onReset() {
    }

    default void onDispose() {
    }
}
