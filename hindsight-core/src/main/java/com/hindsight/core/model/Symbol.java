package com.hindsight.core.model;

import java.util.Objects;

/**
 * Tradable symbol on a venue, written as {@code CODE.VENUE} (e.g. {@code AUDUSD.FXCM}).
 */
public record Symbol(String code, String venue) implements Comparable<Symbol> {

    public Symbol {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(venue, "venue");
    }

    public static Symbol parse(String value) {
        int dot = value.lastIndexOf('.');
        if (dot <= 0 || dot == value.length() - 1) {
            throw new IllegalArgumentException("Invalid symbol: " + value);
        }
        return new Symbol(value.substring(0, dot), value.substring(dot + 1));
    }

    @Override
    public int compareTo(Symbol other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public String toString() {
        return code + "." + venue;
    }
}
