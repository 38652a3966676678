package com.hindsight.engine.trading;

import com.hindsight.core.exception.InvalidArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Owns the active strategies and drives their lifecycle. Strategies are always
 * called in list order.
 */
public class Trader {

    private static final Logger log = LoggerFactory.getLogger(Trader.class);

    private final String traderId;
    private List<TradingStrategy> strategies;
    private TraderState state = TraderState.INITIALIZED;

    public Trader(String traderId, List<TradingStrategy> strategies) {
        this.traderId = traderId;
        this.strategies = checkUniqueIds(strategies);
    }

    public void start() {
        requireNotDisposed();
        if (state == TraderState.RUNNING) {
            throw new IllegalStateException("Trader " + traderId + " is already running");
        }
        for (TradingStrategy strategy : strategies) {
            strategy.onStart();
        }
        state = TraderState.RUNNING;
        log.info("Trader {} started with {} strategies", traderId, strategies.size());
    }

    /**
     * Move every strategy's clock to {@code time} and give it the step.
     */
    public void iterate(Instant time) {
        for (TradingStrategy strategy : strategies) {
            strategy.context().advanceTo(time);
            strategy.onStep(time);
        }
    }

    public void stop() {
        requireNotDisposed();
        if (state != TraderState.RUNNING) {
            return;
        }
        for (TradingStrategy strategy : strategies) {
            strategy.onStop();
        }
        state = TraderState.STOPPED;
        log.info("Trader {} stopped", traderId);
    }

    public void reset() {
        requireNotDisposed();
        stop();
        for (TradingStrategy strategy : strategies) {
            strategy.onReset();
        }
        state = TraderState.INITIALIZED;
        log.debug("Trader {} reset", traderId);
    }

    public void dispose() {
        requireNotDisposed();
        stop();
        for (TradingStrategy strategy : strategies) {
            strategy.onDispose();
        }
        state = TraderState.DISPOSED;
        log.info("Trader {} disposed", traderId);
    }

    public void changeStrategies(List<TradingStrategy> newStrategies) {
        requireNotDisposed();
        if (state == TraderState.RUNNING) {
            throw new IllegalStateException("Cannot change strategies while trader " + traderId + " is running");
        }
        strategies = checkUniqueIds(newStrategies);
        log.info("Trader {} strategies changed to {}", traderId, strategies);
    }

    public List<TradingStrategy> strategies() {
        return strategies;
    }

    public TraderState state() {
        return state;
    }

    public String traderId() {
        return traderId;
    }

    public static List<TradingStrategy> checkUniqueIds(List<TradingStrategy> strategies) {
        Set<String> ids = new HashSet<>();
        for (TradingStrategy strategy : strategies) {
            if (!ids.add(strategy.id())) {
                throw new InvalidArgumentException("Duplicate strategy id: " + strategy.id());
            }
        }
        return List.copyOf(strategies);
    }

    private void requireNotDisposed() {
        if (state == TraderState.DISPOSED) {
            throw new IllegalStateException("Trader " + traderId + " is disposed");
        }
    }
}
