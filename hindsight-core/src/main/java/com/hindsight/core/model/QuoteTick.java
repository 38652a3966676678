package com.hindsight.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Top-of-book quote at a point in time (epoch milliseconds).
 */
public record QuoteTick(
    Symbol symbol,
    double bid,
    double ask,
    long timestamp
) {
    @JsonIgnore
    public Instant time() {
        return Instant.ofEpochMilli(timestamp);
    }

    @JsonIgnore
    public double mid() {
        return (bid + ask) / 2.0;
    }

    @JsonIgnore
    public double spread() {
        return ask - bid;
    }
}
