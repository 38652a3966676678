package com.hindsight.runner.strategy;

import com.hindsight.core.model.Bar;
import com.hindsight.core.model.OrderRequest;
import com.hindsight.core.model.OrderSide;
import com.hindsight.core.model.PriceType;
import com.hindsight.core.model.Resolution;
import com.hindsight.core.model.Symbol;
import com.hindsight.engine.trading.AbstractStrategy;
import com.hindsight.execution.portfolio.Position;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Always-in-the-market moving average crossover on minute mid closes.
 * Goes long when the fast average crosses above the slow one, short on the opposite cross.
 */
public class MovingAverageCrossStrategy extends AbstractStrategy {

    private final Symbol symbol;
    private final int fastPeriod;
    private final int slowPeriod;
    private final double quantity;

    private int crossings;

    public MovingAverageCrossStrategy(String id, Symbol symbol, int fastPeriod, int slowPeriod, double quantity) {
        super(id);
        if (fastPeriod <= 0 || slowPeriod <= fastPeriod) {
            throw new IllegalArgumentException("Need 0 < fastPeriod < slowPeriod, got " + fastPeriod + "/" + slowPeriod);
        }
        if (!(quantity > 0)) {
            throw new IllegalArgumentException("quantity must be positive");
        }
        this.symbol = symbol;
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
        this.quantity = quantity;
    }

    @Override
    public void onStep(Instant time) {
        List<Bar> bars = context().marketData().bars(symbol, Resolution.MINUTE, PriceType.MID, slowPeriod + 1);
        if (bars.size() < slowPeriod + 1) {
            return;
        }
        int last = bars.size() - 1;
        double fastNow = average(bars, last, fastPeriod);
        double slowNow = average(bars, last, slowPeriod);
        double fastBefore = average(bars, last - 1, fastPeriod);
        double slowBefore = average(bars, last - 1, slowPeriod);

        if (fastBefore <= slowBefore && fastNow > slowNow) {
            target(OrderSide.BUY);
        } else if (fastBefore >= slowBefore && fastNow < slowNow) {
            target(OrderSide.SELL);
        }
    }

    private void target(OrderSide side) {
        Optional<Position> position = context().position(symbol);
        double size = quantity;
        if (position.isPresent()) {
            if (position.get().getSide() == side) {
                return;
            }
            size += position.get().getQuantity();
        }
        crossings++;
        log().info("{} cross #{}: {} {} {}", id(), crossings, side, size, symbol);
        submit(OrderRequest.market(symbol, side, size));
    }

    // Mean close of the `period` bars ending at `end` (inclusive)
    static double average(List<Bar> bars, int end, int period) {
        double sum = 0;
        for (int i = end - period + 1; i <= end; i++) {
            sum += bars.get(i).close();
        }
        return sum / period;
    }

    @Override
    public void onStop() {
        log().info("{} stopped after {} crossings", id(), crossings);
    }

    @Override
    public void onReset() {
        crossings = 0;
    }

    public int crossings() {
        return crossings;
    }
}
