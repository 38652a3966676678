package com.hindsight.execution.portfolio;

import com.hindsight.core.model.Fill;
import com.hindsight.core.model.OrderSide;
import com.hindsight.core.model.Symbol;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Net position of one strategy in one instrument, built only from fills.
 *
 * <p>Quantity is signed (long positive, short negative). A quantity left within
 * {@link #QUANTITY_TOLERANCE} of zero, relative to the size traded, is snapped to flat.
 * Prices and P&L are in the instrument's quote currency.
 */
public class Position {

    static final double QUANTITY_TOLERANCE = 1e-9;

    private final String strategyId;
    private final Symbol symbol;
    private final Instant openedAt;
    private final List<String> tradeIds = new ArrayList<>();

    private OrderSide side;
    private double netQuantity;
    private double avgEntryPrice;
    private double realizedPnl;
    private double commissions;
    private Instant lastFillAt;
    private Instant closedAt;

    Position(Fill opening) {
        this.strategyId = opening.strategyId();
        this.symbol = opening.symbol();
        this.openedAt = opening.timestamp();
        this.side = opening.side();
        this.netQuantity = opening.side().sign() * opening.quantity();
        this.avgEntryPrice = opening.price();
        record(opening);
    }

    /**
     * Apply a fill on the same strategy and symbol.
     *
     * @return P&L realized by the part of the fill that reduced the position
     */
    double apply(Fill fill) {
        if (isClosed()) {
            throw new IllegalStateException("Position " + strategyId + ":" + symbol + " is closed");
        }
        double pnl = 0;
        double open = Math.abs(netQuantity);

        if (fill.side() == side) {
            avgEntryPrice = (avgEntryPrice * open + fill.price() * fill.quantity()) / (open + fill.quantity());
            netQuantity += side.sign() * fill.quantity();
        } else {
            double closing = Math.min(fill.quantity(), open);
            pnl = (fill.price() - avgEntryPrice) * closing * side.sign();
            realizedPnl += pnl;

            double after = snap(netQuantity + fill.side().sign() * fill.quantity(), open + fill.quantity());
            if (after == 0) {
                closedAt = fill.timestamp();
            } else if (Math.signum(after) != side.sign()) {
                side = fill.side();
                avgEntryPrice = fill.price();
            }
            netQuantity = after;
        }
        record(fill);
        return pnl;
    }

    private void record(Fill fill) {
        tradeIds.add(fill.tradeId());
        commissions += fill.commission();
        lastFillAt = fill.timestamp();
    }

    // Zero when |quantity| is within tolerance of the traded size
    static double snap(double quantity, double scale) {
        return Math.abs(quantity) <= QUANTITY_TOLERANCE * Math.max(1.0, scale) ? 0.0 : quantity;
    }

    public boolean isClosed() {
        return netQuantity == 0;
    }

    /** Signed quantity: positive long, negative short, zero once closed. */
    public double netQuantity() {
        return netQuantity;
    }

    public double getQuantity() {
        return Math.abs(netQuantity);
    }

    /** Side of the open quantity; the last held side once closed. */
    public OrderSide getSide() { return side; }
    public String getStrategyId() { return strategyId; }
    public Symbol getSymbol() { return symbol; }
    public double getAvgEntryPrice() { return avgEntryPrice; }
    public double getRealizedPnl() { return realizedPnl; }
    public double getCommissions() { return commissions; }
    public List<String> getTradeIds() { return List.copyOf(tradeIds); }
    public Instant getOpenedAt() { return openedAt; }
    public Instant getLastFillAt() { return lastFillAt; }
    public Instant getClosedAt() { return closedAt; }

    @Override
    public String toString() {
        return String.format("%s:%s %s %s @ %s", strategyId, symbol, side, getQuantity(), avgEntryPrice);
    }
}
