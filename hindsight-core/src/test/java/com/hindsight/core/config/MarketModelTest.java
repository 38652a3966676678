package com.hindsight.core.config;

import com.hindsight.core.exception.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.function.DoubleFunction;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MarketModel probability bounds.
 */
class MarketModelTest {

    private static final String[] FIELDS = {
        "probFillAtBest", "probFillAtMid", "probFillAtCross", "probFillAtStop", "probSlippage"
    };

    private static MarketModel withValueAt(int position, double value) {
        double[] p = {0.5, 0.5, 0.5, 0.5, 0.5};
        p[position] = value;
        return new MarketModel(p[0], p[1], p[2], p[3], p[4]);
    }

    @Test
    @DisplayName("Boundary values 0 and 1 are accepted for every probability")
    void boundariesAccepted() {
        for (int i = 0; i < FIELDS.length; i++) {
            final int position = i;
            assertDoesNotThrow(() -> withValueAt(position, 0.0), FIELDS[i] + " = 0");
            assertDoesNotThrow(() -> withValueAt(position, 1.0), FIELDS[i] + " = 1");
        }
    }

    @Test
    @DisplayName("Values outside [0, 1] are rejected naming the field")
    void outOfRangeRejected() {
        for (int i = 0; i < FIELDS.length; i++) {
            final int position = i;
            DoubleFunction<InvalidConfigurationException> attempt = v ->
                assertThrows(InvalidConfigurationException.class, () -> withValueAt(position, v));

            assertEquals(FIELDS[i], attempt.apply(-0.0001).getField());
            assertEquals(FIELDS[i], attempt.apply(1.0001).getField());
            assertEquals(FIELDS[i], attempt.apply(Double.NaN).getField());
        }
    }

    @Test
    @DisplayName("First offending probability is the one reported")
    void firstOffender() {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> new MarketModel(0.5, 2.0, -1.0, 0.5, 0.5));
        assertEquals("probFillAtMid", e.getField());
    }

    @Test
    @DisplayName("Defaults use the fixed seed")
    void defaults() {
        MarketModel model = MarketModel.defaults();

        assertEquals(0.0, model.probFillAtBest());
        assertEquals(0.5, model.probFillAtMid());
        assertEquals(1.0, model.probFillAtCross());
        assertEquals(1.0, model.probFillAtStop());
        assertEquals(0.0, model.probSlippage());
        assertEquals(MarketModel.DEFAULT_SEED, model.randomSeed());
        assertEquals(7L, model.withSeed(7L).randomSeed());
    }
}
