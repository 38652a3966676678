package com.hindsight.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.hindsight.core.exception.InvalidConfigurationException;

/**
 * Probabilistic parameters for simulated order fills.
 *
 * <p>Limit orders are resolved by where the market stands relative to the limit price.
 * For a BUY limit the "best" level is the bid, "mid" the midpoint and "cross" the ask;
 * a SELL limit mirrors this (best = ask, cross = bid). The probability attached to the
 * deepest level the limit reaches decides whether it fills on a given step.
 *
 * <p>{@code randomSeed} seeds the simulated exchange's random source so two runs with
 * the same inputs make the same draws.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MarketModel(
    double probFillAtBest,
    double probFillAtMid,
    double probFillAtCross,
    double probFillAtStop,
    double probSlippage,
    long randomSeed
) {
    public static final long DEFAULT_SEED = 42L;

    public MarketModel {
        checkProbability("probFillAtBest", probFillAtBest);
        checkProbability("probFillAtMid", probFillAtMid);
        checkProbability("probFillAtCross", probFillAtCross);
        checkProbability("probFillAtStop", probFillAtStop);
        checkProbability("probSlippage", probSlippage);
    }

    public MarketModel(double probFillAtBest, double probFillAtMid, double probFillAtCross,
                       double probFillAtStop, double probSlippage) {
        this(probFillAtBest, probFillAtMid, probFillAtCross, probFillAtStop, probSlippage, DEFAULT_SEED);
    }

    public static MarketModel defaults() {
        return new MarketModel(0.0, 0.5, 1.0, 1.0, 0.0, DEFAULT_SEED);
    }

    /**
     * Fills every touched order with certainty and never slips.
     */
    public static MarketModel certain() {
        return new MarketModel(1.0, 1.0, 1.0, 1.0, 0.0, DEFAULT_SEED);
    }

    public MarketModel withSeed(long seed) {
        return new MarketModel(probFillAtBest, probFillAtMid, probFillAtCross, probFillAtStop, probSlippage, seed);
    }

    private static void checkProbability(String field, double value) {
        // NaN fails both comparisons
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new InvalidConfigurationException(field, "must be within [0, 1], was " + value);
        }
    }
}
