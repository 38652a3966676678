package com.hindsight.core.model;

import java.time.Instant;

/**
 * Executed trade produced by the simulated exchange.
 *
 * @param commission commission charged, in account currency
 */
public record Fill(
    String tradeId,
    String orderId,
    String strategyId,
    Symbol symbol,
    OrderSide side,
    double price,
    double quantity,
    double commission,
    LiquiditySide liquiditySide,
    Instant timestamp
) {
    public double notionalValue() {
        return price * quantity;
    }
}
