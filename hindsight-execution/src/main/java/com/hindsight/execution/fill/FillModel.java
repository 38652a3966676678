package com.hindsight.execution.fill;

import com.hindsight.core.config.MarketModel;
import com.hindsight.core.model.OrderSide;

import java.util.Random;

/**
 * Decides whether and where simulated orders fill, drawing from a seeded random source.
 */
public class FillModel {

    /**
     * Deepest level of the book a limit price reaches.
     */
    public enum LimitLevel {
        NONE,
        BEST,
        MID,
        CROSS
    }

    private final MarketModel marketModel;
    private Random random;

    public FillModel(MarketModel marketModel) {
        this.marketModel = marketModel;
        this.random = new Random(marketModel.randomSeed());
    }

    public static LimitLevel limitLevel(OrderSide side, double limitPrice, double bid, double ask) {
        double mid = (bid + ask) / 2.0;
        if (side == OrderSide.BUY) {
            if (limitPrice >= ask) return LimitLevel.CROSS;
            if (limitPrice >= mid) return LimitLevel.MID;
            if (limitPrice >= bid) return LimitLevel.BEST;
        } else {
            if (limitPrice <= bid) return LimitLevel.CROSS;
            if (limitPrice <= mid) return LimitLevel.MID;
            if (limitPrice <= ask) return LimitLevel.BEST;
        }
        return LimitLevel.NONE;
    }

    public static boolean isStopTriggered(OrderSide side, double triggerPrice, double bid, double ask) {
        return side == OrderSide.BUY ? ask >= triggerPrice : bid <= triggerPrice;
    }

    public boolean isLimitFilled(LimitLevel level) {
        return switch (level) {
            case CROSS -> draw(marketModel.probFillAtCross());
            case MID -> draw(marketModel.probFillAtMid());
            case BEST -> draw(marketModel.probFillAtBest());
            case NONE -> false;
        };
    }

    public boolean isStopFilled() {
        return draw(marketModel.probFillAtStop());
    }

    public boolean isSlipped() {
        return draw(marketModel.probSlippage());
    }

    /**
     * Reseed so the next run makes the same draws as the first.
     */
    public void reset() {
        random = new Random(marketModel.randomSeed());
    }

    public MarketModel marketModel() {
        return marketModel;
    }

    private boolean draw(double probability) {
        if (probability <= 0.0) return false;
        if (probability >= 1.0) return true;
        return random.nextDouble() < probability;
    }
}
