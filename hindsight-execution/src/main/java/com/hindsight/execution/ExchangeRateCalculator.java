package com.hindsight.execution;

import com.hindsight.core.model.Instrument;

import java.util.Collection;
import java.util.Currency;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Converts between currencies using the current mid prices of FX pairs in the universe.
 */
public class ExchangeRateCalculator {

    /**
     * Rate to multiply an amount in {@code from} by to express it in {@code to}.
     *
     * @param mids current mid price per instrument; instruments without a price are skipped
     * @return empty when no direct or inverse pair is priced
     */
    public OptionalDouble find(Currency from, Currency to, Map<Instrument, Double> mids) {
        if (from.equals(to)) {
            return OptionalDouble.of(1.0);
        }
        for (Map.Entry<Instrument, Double> e : mids.entrySet()) {
            Instrument instrument = e.getKey();
            Double mid = e.getValue();
            if (mid == null || !(mid > 0) || !connects(instrument, from, to)) {
                continue;
            }
            return OptionalDouble.of(instrument.baseCurrency().equals(from) ? mid : 1.0 / mid);
        }
        return OptionalDouble.empty();
    }

    /**
     * Whether some instrument of the universe quotes {@code from} against {@code to}, in
     * either direction. Prices are not consulted.
     */
    public boolean canConvert(Currency from, Currency to, Collection<Instrument> universe) {
        return from.equals(to) || universe.stream().anyMatch(i -> connects(i, from, to));
    }

    private static boolean connects(Instrument instrument, Currency a, Currency b) {
        Currency base = instrument.baseCurrency();
        Currency quote = instrument.quoteCurrency();
        if (base == null || quote == null) {
            return false;
        }
        return (base.equals(a) && quote.equals(b)) || (base.equals(b) && quote.equals(a));
    }
}
