package com.hindsight.engine.trading;

import com.hindsight.core.exception.InvalidArgumentException;
import com.hindsight.engine.trading.TestStrategies.Recording;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TraderTest {

    private static final Instant T0 = Instant.parse("2020-01-01T00:00:00Z");

    private Recording a;
    private Recording b;
    private Trader trader;

    @BeforeEach
    void setUp() {
        a = register(new Recording("a"));
        b = register(new Recording("b"));
        trader = new Trader("TRADER-001", List.of(a, b));
    }

    private static Recording register(Recording strategy) {
        strategy.register(new StrategyContext(strategy.id(), T0, LoggerFactory.getLogger("test"),
            null, null, null, null));
        return strategy;
    }

    @Test
    @DisplayName("Lifecycle transitions call every strategy")
    void lifecycle() {
        trader.start();
        assertEquals(TraderState.RUNNING, trader.state());
        assertThrows(IllegalStateException.class, trader::start);

        trader.stop();
        assertEquals(TraderState.STOPPED, trader.state());

        trader.reset();
        assertEquals(TraderState.INITIALIZED, trader.state());
        assertEquals(List.of("start", "stop", "reset"), a.events);
        assertEquals(List.of("start", "stop", "reset"), b.events);
    }

    @Test
    @DisplayName("Iterate moves each strategy clock before its step")
    void iterate() {
        Instant t = T0.plusSeconds(600);
        trader.iterate(t);

        assertEquals(List.of(t), a.clockReadings);
        assertEquals(t, b.context().clock().timeNow());
    }

    @Test
    @DisplayName("Strategies cannot be changed while running")
    void changeWhileRunning() {
        trader.start();
        assertThrows(IllegalStateException.class, () -> trader.changeStrategies(List.of()));

        trader.stop();
        trader.changeStrategies(List.of(b));
        assertEquals(List.of(b), trader.strategies());
    }

    @Test
    @DisplayName("Duplicate ids are rejected")
    void duplicateIds() {
        assertThrows(InvalidArgumentException.class,
            () -> new Trader("T", List.of(new Recording("x"), new Recording("x"))));
    }

    @Test
    @DisplayName("Disposal is terminal and stops a running trader first")
    void dispose() {
        trader.start();
        trader.dispose();

        assertEquals(TraderState.DISPOSED, trader.state());
        assertEquals(List.of("start", "stop", "dispose"), a.events);
        assertThrows(IllegalStateException.class, trader::start);
        assertThrows(IllegalStateException.class, trader::reset);
        assertThrows(IllegalStateException.class, trader::dispose);
    }
}
