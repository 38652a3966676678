package com.hindsight.core.model;

/**
 * Whether a fill added liquidity (resting limit order) or took it.
 */
public enum LiquiditySide {
    MAKER,
    TAKER
}
