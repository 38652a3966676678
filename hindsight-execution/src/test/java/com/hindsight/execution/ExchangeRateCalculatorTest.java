package com.hindsight.execution;

import com.hindsight.core.model.Instrument;
import com.hindsight.core.model.Symbol;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Currency;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExchangeRateCalculatorTest {

    private static final Currency USD = Currency.getInstance("USD");
    private static final Currency JPY = Currency.getInstance("JPY");
    private static final Currency AUD = Currency.getInstance("AUD");
    private static final Currency EUR = Currency.getInstance("EUR");

    private static final Instrument USDJPY = Instrument.fxPair(Symbol.parse("USDJPY.FXCM"), 3);
    private static final Instrument AUDUSD = Instrument.fxPair(Symbol.parse("AUDUSD.FXCM"), 5);

    private final ExchangeRateCalculator calculator = new ExchangeRateCalculator();

    @Test
    @DisplayName("Uses direct and inverse pairs")
    void directAndInverse() {
        Map<Instrument, Double> mids = new LinkedHashMap<>();
        mids.put(USDJPY, 110.0);
        mids.put(AUDUSD, 0.70);

        assertEquals(1.0, calculator.find(USD, USD, mids).getAsDouble());
        assertEquals(0.70, calculator.find(AUD, USD, mids).getAsDouble());
        assertEquals(1.0 / 110.0, calculator.find(JPY, USD, mids).getAsDouble(), 1e-15);
        assertEquals(110.0, calculator.find(USD, JPY, mids).getAsDouble());
    }

    @Test
    @DisplayName("Missing pair or price gives no rate")
    void missing() {
        Map<Instrument, Double> mids = new LinkedHashMap<>();
        mids.put(USDJPY, null);

        assertTrue(calculator.find(JPY, USD, mids).isEmpty());
        assertTrue(calculator.find(AUD, USD, Map.of()).isEmpty());
    }

    @Test
    @DisplayName("Convertibility depends on the universe, not on prices")
    void canConvert() {
        List<Instrument> universe = List.of(USDJPY, AUDUSD);

        assertTrue(calculator.canConvert(JPY, USD, universe));
        assertTrue(calculator.canConvert(USD, AUD, universe));
        assertTrue(calculator.canConvert(EUR, EUR, List.of()));
        assertFalse(calculator.canConvert(JPY, AUD, universe));
    }
}
