package com.hindsight.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Currency;

/**
 * Diagnostics of one completed run.
 */
public record BacktestSummary(
    Duration constructionTime,
    Duration runTime,
    Instant start,
    Instant stop,
    int iterations,
    Currency currency,
    double startingBalance,
    double endingBalance,
    double totalCommissions
) {
    public double pnl() {
        return endingBalance - startingBalance;
    }
}
