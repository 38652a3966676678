package com.hindsight.core.model;

public enum OrderStatus {
    WORKING,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isTerminal() {
        return this != WORKING;
    }
}
