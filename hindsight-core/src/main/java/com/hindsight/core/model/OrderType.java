package com.hindsight.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OrderType {
    MARKET("market"),
    LIMIT("limit"),
    STOP_MARKET("stop_market");

    private final String value;

    OrderType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
