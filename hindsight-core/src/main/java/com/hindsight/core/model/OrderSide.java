package com.hindsight.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OrderSide {
    BUY("buy"),
    SELL("sell");

    private final String value;

    OrderSide(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * +1 for BUY, -1 for SELL.
     */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
