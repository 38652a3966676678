package com.hindsight.core.model;

import java.util.Currency;
import java.util.Objects;

/**
 * Static description of a tradable instrument.
 *
 * @param baseCurrency  currency being bought or sold, null for non-FX instruments
 * @param quoteCurrency currency prices are expressed in
 * @param tickSize      minimum price increment, used to size slippage
 */
public record Instrument(
    Symbol symbol,
    Currency baseCurrency,
    Currency quoteCurrency,
    int pricePrecision,
    double tickSize
) {
    public Instrument {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(quoteCurrency, "quoteCurrency");
        if (!(tickSize > 0)) {
            throw new IllegalArgumentException("tickSize must be positive for " + symbol);
        }
    }

    /**
     * FX pair such as AUD/USD: base and quote currency taken from the six-letter code.
     */
    public static Instrument fxPair(Symbol symbol, int pricePrecision) {
        String code = symbol.code();
        if (code.length() != 6) {
            throw new IllegalArgumentException("Not a currency pair: " + symbol);
        }
        return new Instrument(
            symbol,
            Currency.getInstance(code.substring(0, 3)),
            Currency.getInstance(code.substring(3)),
            pricePrecision,
            Math.pow(10, -pricePrecision)
        );
    }

    public double roundPrice(double price) {
        double factor = Math.pow(10, pricePrecision);
        return Math.round(price * factor) / factor;
    }
}
