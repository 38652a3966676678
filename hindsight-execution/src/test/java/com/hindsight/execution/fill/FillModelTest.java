package com.hindsight.execution.fill;

import com.hindsight.core.config.MarketModel;
import com.hindsight.core.model.OrderSide;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.hindsight.execution.fill.FillModel.LimitLevel.*;
import static org.junit.jupiter.api.Assertions.*;

class FillModelTest {

    private static final double BID = 1.0000;
    private static final double ASK = 1.0010;

    @Test
    @DisplayName("Buy limit level: ask is cross, mid is mid, bid is best")
    void buyLevels() {
        assertEquals(CROSS, FillModel.limitLevel(OrderSide.BUY, 1.0010, BID, ASK));
        assertEquals(CROSS, FillModel.limitLevel(OrderSide.BUY, 1.0100, BID, ASK));
        assertEquals(MID, FillModel.limitLevel(OrderSide.BUY, 1.0005, BID, ASK));
        assertEquals(BEST, FillModel.limitLevel(OrderSide.BUY, 1.0000, BID, ASK));
        assertEquals(NONE, FillModel.limitLevel(OrderSide.BUY, 0.9990, BID, ASK));
    }

    @Test
    @DisplayName("Sell limit level mirrors the buy side")
    void sellLevels() {
        assertEquals(CROSS, FillModel.limitLevel(OrderSide.SELL, 1.0000, BID, ASK));
        assertEquals(MID, FillModel.limitLevel(OrderSide.SELL, 1.0005, BID, ASK));
        assertEquals(BEST, FillModel.limitLevel(OrderSide.SELL, 1.0010, BID, ASK));
        assertEquals(NONE, FillModel.limitLevel(OrderSide.SELL, 1.0020, BID, ASK));
    }

    @Test
    @DisplayName("Stops trigger on the side they would execute against")
    void stopTrigger() {
        assertTrue(FillModel.isStopTriggered(OrderSide.BUY, 1.0010, BID, ASK));
        assertFalse(FillModel.isStopTriggered(OrderSide.BUY, 1.0011, BID, ASK));
        assertTrue(FillModel.isStopTriggered(OrderSide.SELL, 1.0000, BID, ASK));
        assertFalse(FillModel.isStopTriggered(OrderSide.SELL, 0.9999, BID, ASK));
    }

    @Test
    @DisplayName("Probabilities 0 and 1 are certain")
    void certainOutcomes() {
        FillModel model = new FillModel(new MarketModel(0.0, 1.0, 1.0, 0.0, 1.0));
        for (int i = 0; i < 100; i++) {
            assertFalse(model.isLimitFilled(BEST));
            assertTrue(model.isLimitFilled(MID));
            assertFalse(model.isStopFilled());
            assertTrue(model.isSlipped());
            assertFalse(model.isLimitFilled(NONE));
        }
    }

    @Test
    @DisplayName("Reset replays the same draws")
    void resetReplays() {
        FillModel model = new FillModel(new MarketModel(0.5, 0.5, 0.5, 0.5, 0.5, 7L));
        List<Boolean> first = draws(model);
        model.reset();
        assertEquals(first, draws(model));
        assertTrue(first.contains(true) && first.contains(false));

        FillModel same = new FillModel(new MarketModel(0.5, 0.5, 0.5, 0.5, 0.5, 7L));
        assertEquals(first, draws(same));
    }

    private static List<Boolean> draws(FillModel model) {
        List<Boolean> result = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            result.add(model.isStopFilled());
        }
        return result;
    }
}
