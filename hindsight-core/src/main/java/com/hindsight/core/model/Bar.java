package com.hindsight.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * OHLCV bar for one side of the book (bid or ask).
 *
 * The timestamp is the bar's close time in epoch milliseconds: a bar is only
 * visible to the simulation once the simulated clock has reached it.
 */
public record Bar(
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    public Bar {
        if (high < low) {
            throw new IllegalArgumentException("Bar high " + high + " below low " + low + " at " + timestamp);
        }
    }

    @JsonIgnore
    public Instant time() {
        return Instant.ofEpochMilli(timestamp);
    }

    /**
     * Parse a CSV line into a Bar.
     * Format: timestamp,open,high,low,close[,volume]
     */
    public static Bar fromCsv(String line) {
        String[] parts = line.split(",");
        if (parts.length < 5) {
            throw new IllegalArgumentException("Invalid CSV line: " + line);
        }

        long timestamp = Long.parseLong(parts[0].trim());
        double open = Double.parseDouble(parts[1].trim());
        double high = Double.parseDouble(parts[2].trim());
        double low = Double.parseDouble(parts[3].trim());
        double close = Double.parseDouble(parts[4].trim());
        double volume = parts.length >= 6 ? Double.parseDouble(parts[5].trim()) : 0;

        return new Bar(timestamp, open, high, low, close, volume);
    }

    public String toCsv() {
        return String.format("%d,%.8f,%.8f,%.8f,%.8f,%.8f",
            timestamp, open, high, low, close, volume);
    }

    /**
     * Midpoint bar of a bid and an ask bar with the same timestamp.
     */
    public static Bar mid(Bar bid, Bar ask) {
        if (bid.timestamp != ask.timestamp) {
            throw new IllegalArgumentException("Bid/ask bars not aligned: " + bid.timestamp + " vs " + ask.timestamp);
        }
        return new Bar(
            bid.timestamp,
            (bid.open + ask.open) / 2.0,
            (bid.high + ask.high) / 2.0,
            (bid.low + ask.low) / 2.0,
            (bid.close + ask.close) / 2.0,
            bid.volume + ask.volume
        );
    }

    @JsonIgnore
    public double range() {
        return high - low;
    }
}
