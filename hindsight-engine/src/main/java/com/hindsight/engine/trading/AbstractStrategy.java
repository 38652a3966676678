package com.hindsight.engine.trading;

import com.hindsight.core.model.OrderRequest;
import com.hindsight.execution.order.SimulatedOrder;
import org.slf4j.Logger;

import java.time.Instant;
import java.util.Objects;

/**
 * Base class holding the strategy id and its current context.
 */
public abstract class AbstractStrategy implements TradingStrategy {

    private final String id;
    private StrategyContext context;

    protected AbstractStrategy(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void register(StrategyContext context) {
        this.context = context;
    }

    @Override
    public StrategyContext context() {
        if (context == null) {
            throw new IllegalStateException("Strategy " + id + " is not registered");
        }
        return context;
    }

    protected Logger log() {
        return context().log();
    }

    protected Instant now() {
        return context().clock().timeNow();
    }

    protected SimulatedOrder submit(OrderRequest request) {
        return context().submitOrder(request);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
