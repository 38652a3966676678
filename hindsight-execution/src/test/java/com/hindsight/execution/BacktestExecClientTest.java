package com.hindsight.execution;

import com.hindsight.core.clock.TestClock;
import com.hindsight.core.commission.GenericCommissionModel;
import com.hindsight.core.config.MarketModel;
import com.hindsight.core.exception.DataInconsistencyException;
import com.hindsight.core.exception.InvalidArgumentException;
import com.hindsight.core.model.Bar;
import com.hindsight.core.model.BidAskBars;
import com.hindsight.core.model.Instrument;
import com.hindsight.core.model.LiquiditySide;
import com.hindsight.core.model.OrderRequest;
import com.hindsight.core.model.OrderSide;
import com.hindsight.core.model.OrderStatus;
import com.hindsight.core.model.Symbol;
import com.hindsight.execution.account.Account;
import com.hindsight.execution.order.SimulatedOrder;
import com.hindsight.execution.portfolio.Portfolio;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Currency;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BacktestExecClientTest {

    private static final Symbol AUDUSD = Symbol.parse("AUDUSD.FXCM");
    private static final Instrument INSTRUMENT = Instrument.fxPair(AUDUSD, 5);
    private static final Currency USD = Currency.getInstance("USD");
    private static final Instant T0 = Instant.parse("2020-01-01T00:00:00Z");
    private static final double SPREAD = 0.0002;

    // Bid closes per minute, starting at T0 + 1 minute
    private static final double[] BIDS = {1.0000, 1.0000, 0.9990, 0.9980, 1.0010, 1.0100, 1.0100, 1.0050};

    private TestClock clock;
    private Account account;

    @BeforeEach
    void setUp() {
        clock = new TestClock(T0);
        account = new Account("SIM-001", USD, 1_000_000);
    }

    private static Instant minute(int m) {
        return T0.plus(Duration.ofMinutes(m));
    }

    private static BidAskBars bars(double[] bids) {
        List<Bar> bid = new ArrayList<>();
        List<Bar> ask = new ArrayList<>();
        for (int i = 0; i < bids.length; i++) {
            long ts = minute(i + 1).toEpochMilli();
            bid.add(new Bar(ts, bids[i], bids[i], bids[i], bids[i], 1));
            double a = bids[i] + SPREAD;
            ask.add(new Bar(ts, a, a, a, a, 1));
        }
        return new BidAskBars(bid, ask);
    }

    private BacktestExecClient client(MarketModel model, int slippageTicks, boolean frozen) {
        return new BacktestExecClient(List.of(INSTRUMENT), Map.of(AUDUSD, bars(BIDS)), 1_000_000,
            slippageTicks, new GenericCommissionModel(0.20, 0), account, new Portfolio(account),
            model, clock, frozen);
    }

    private BacktestExecClient client() {
        return client(MarketModel.certain(), 0, false);
    }

    private static void stepTo(BacktestExecClient client, TestClock clock, int m) {
        clock.setTime(minute(m));
        client.processMarket();
        client.iterate();
    }

    @Nested
    @DisplayName("Iteration")
    class Iteration {

        @Test
        @DisplayName("Minute index is the common bid/ask timeline")
        void minuteIndex() {
            BacktestExecClient client = client();
            assertEquals(BIDS.length, client.minuteIndex().size());
            assertEquals(minute(1), client.minuteIndex().get(0));
        }

        @Test
        @DisplayName("Initial iteration moves the shared clock and zeroes the counter")
        void initialIteration() {
            BacktestExecClient client = client();
            client.iterate();
            client.setInitialIteration(minute(3), 2);

            assertEquals(minute(3), client.timeNow());
            assertEquals(minute(3), clock.timeNow());
            assertEquals(0, client.iteration());
            assertEquals(Duration.ofMinutes(2), client.step());
            assertThrows(InvalidArgumentException.class, () -> client.setInitialIteration(minute(3), 0));
        }

        @Test
        @DisplayName("Instrument without bars is a data inconsistency")
        void missingBars() {
            Instrument other = Instrument.fxPair(Symbol.parse("EURUSD.FXCM"), 5);
            assertThrows(DataInconsistencyException.class, () -> new BacktestExecClient(
                List.of(INSTRUMENT, other), Map.of(AUDUSD, bars(BIDS)), 1_000_000, 0,
                new GenericCommissionModel(), account, new Portfolio(account), MarketModel.defaults(),
                clock, false));
        }
    }

    @Nested
    @DisplayName("Market orders")
    class MarketOrders {

        @Test
        @DisplayName("Buy fills immediately at the ask as taker and pays commission")
        void buyAtAsk() {
            BacktestExecClient client = client();
            clock.setTime(minute(1));

            SimulatedOrder order = client.submitOrder("s1", OrderRequest.market(AUDUSD, OrderSide.BUY, 100_000));

            assertEquals(OrderStatus.FILLED, order.getStatus());
            assertEquals(1.0002, order.getAvgFillPrice(), 1e-12);
            assertEquals(LiquiditySide.TAKER, order.getFills().get(0).liquiditySide());
            assertEquals(2.00, client.totalCommissions(), 1e-9);
            assertEquals(1_000_000 - 2.00, account.getCashBalance(), 1e-9);
        }

        @Test
        @DisplayName("Rejected when no quote is visible yet")
        void rejectedWithoutQuote() {
            BacktestExecClient client = client();
            clock.setTime(minute(0));

            SimulatedOrder order = client.submitOrder("s1", OrderRequest.market(AUDUSD, OrderSide.BUY, 1000));

            assertEquals(OrderStatus.REJECTED, order.getStatus());
            assertNotNull(order.getReason());
            assertEquals(1_000_000, account.getCashBalance());
        }

        @Test
        @DisplayName("Round trip credits realized P&L less commissions")
        void roundTrip() {
            BacktestExecClient client = client();
            clock.setTime(minute(1));
            client.submitOrder("s1", OrderRequest.market(AUDUSD, OrderSide.BUY, 100_000));
            clock.setTime(minute(6));
            client.submitOrder("s1", OrderRequest.market(AUDUSD, OrderSide.SELL, 100_000));

            double pnl = (1.0100 - 1.0002) * 100_000;
            double commissions = client.totalCommissions();
            assertEquals(4.02, commissions, 1e-9);
            assertEquals(1_000_000 + pnl - commissions, account.getCashBalance(), 1e-6);
            assertTrue(client.portfolio().isFlat());
        }

        @Test
        @DisplayName("Frozen account keeps P&L off the balance but still pays commission")
        void frozenAccount() {
            BacktestExecClient client = client(MarketModel.certain(), 0, true);
            clock.setTime(minute(1));
            client.submitOrder("s1", OrderRequest.market(AUDUSD, OrderSide.BUY, 100_000));
            clock.setTime(minute(6));
            client.submitOrder("s1", OrderRequest.market(AUDUSD, OrderSide.SELL, 100_000));

            assertEquals(1_000_000 - client.totalCommissions(), account.getCashBalance(), 1e-9);
        }

        @Test
        @DisplayName("Slippage moves the fill against the order by whole ticks")
        void slippage() {
            BacktestExecClient client = client(new MarketModel(1, 1, 1, 1, 1), 3, false);
            clock.setTime(minute(1));

            SimulatedOrder buy = client.submitOrder("s1", OrderRequest.market(AUDUSD, OrderSide.BUY, 1000));
            SimulatedOrder sell = client.submitOrder("s1", OrderRequest.market(AUDUSD, OrderSide.SELL, 1000));

            assertEquals(1.00023, buy.getAvgFillPrice(), 1e-12);
            assertEquals(0.99997, sell.getAvgFillPrice(), 1e-12);
        }
    }

    @Nested
    @DisplayName("Working orders")
    class WorkingOrders {

        @Test
        @DisplayName("Buy limit below the market waits, then fills at its price as maker")
        void limitFillsWhenReached() {
            BacktestExecClient client = client();
            clock.setTime(minute(1));
            SimulatedOrder order = client.submitOrder("s1", OrderRequest.limit(AUDUSD, OrderSide.BUY, 1000, 0.9985));
            assertEquals(List.of(order), client.workingOrders("s1"));

            stepTo(client, clock, 2);
            stepTo(client, clock, 3);
            assertEquals(OrderStatus.WORKING, order.getStatus());

            stepTo(client, clock, 4);
            assertEquals(OrderStatus.FILLED, order.getStatus());
            assertEquals(0.9985, order.getAvgFillPrice());
            assertEquals(LiquiditySide.MAKER, order.getFills().get(0).liquiditySide());
            assertTrue(client.workingOrders("s1").isEmpty());
        }

        @Test
        @DisplayName("Limit inside the spread never fills when passive probabilities are zero")
        void passiveProbabilityZero() {
            BacktestExecClient client = client(new MarketModel(0.0, 0.0, 1.0, 1.0, 0.0), 0, false);
            clock.setTime(minute(1));
            SimulatedOrder order = client.submitOrder("s1", OrderRequest.limit(AUDUSD, OrderSide.BUY, 1000, 1.0001));

            stepTo(client, clock, 1);
            stepTo(client, clock, 2);

            assertEquals(OrderStatus.WORKING, order.getStatus());
        }

        @Test
        @DisplayName("Buy stop triggers when the ask reaches it and fills at the ask")
        void stopTriggers() {
            BacktestExecClient client = client();
            clock.setTime(minute(1));
            SimulatedOrder order = client.submitOrder("s1", OrderRequest.stop(AUDUSD, OrderSide.BUY, 1000, 1.0050));

            stepTo(client, clock, 5);
            assertEquals(OrderStatus.WORKING, order.getStatus());

            stepTo(client, clock, 6);
            assertEquals(OrderStatus.FILLED, order.getStatus());
            assertEquals(1.0102, order.getAvgFillPrice(), 1e-12);
        }

        @Test
        @DisplayName("Triggered stop that does not fill stays working")
        void stopRetries() {
            BacktestExecClient client = client(new MarketModel(0, 0, 0, 0, 0), 0, false);
            clock.setTime(minute(1));
            SimulatedOrder order = client.submitOrder("s1", OrderRequest.stop(AUDUSD, OrderSide.SELL, 1000, 1.0000));

            stepTo(client, clock, 2);
            stepTo(client, clock, 3);

            assertEquals(OrderStatus.WORKING, order.getStatus());
        }

        @Test
        @DisplayName("Cancel removes a working order once")
        void cancel() {
            BacktestExecClient client = client();
            clock.setTime(minute(1));
            SimulatedOrder order = client.submitOrder("s1", OrderRequest.limit(AUDUSD, OrderSide.BUY, 1000, 0.5));

            assertTrue(client.cancelOrder(order.getOrderId()));
            assertFalse(client.cancelOrder(order.getOrderId()));
            assertFalse(client.cancelOrder("nope"));
            assertEquals(OrderStatus.CANCELLED, order.getStatus());
            assertEquals(1, client.orders("s1").size());
        }

        @Test
        @DisplayName("Rejects malformed requests")
        void validation() {
            BacktestExecClient client = client();
            clock.setTime(minute(1));
            Symbol unknown = Symbol.parse("EURUSD.FXCM");

            assertThrows(InvalidArgumentException.class,
                () -> client.submitOrder("s1", OrderRequest.market(unknown, OrderSide.BUY, 1000)));
            assertThrows(InvalidArgumentException.class,
                () -> client.submitOrder("s1", OrderRequest.market(AUDUSD, OrderSide.BUY, 0)));
            assertThrows(InvalidArgumentException.class, () -> client.submitOrder("s1",
                OrderRequest.builder().symbol(AUDUSD).side(OrderSide.BUY).type(com.hindsight.core.model.OrderType.LIMIT)
                    .quantity(1000).build()));
        }
    }

    @Nested
    @DisplayName("Currency conversion")
    class CurrencyConversion {

        private final Symbol audjpy = Symbol.parse("AUDJPY.FXCM");
        private final Symbol usdjpy = Symbol.parse("USDJPY.FXCM");

        private BidAskBars flat(int firstMinute, double bid) {
            List<Bar> bidBars = new ArrayList<>();
            List<Bar> askBars = new ArrayList<>();
            for (int m = firstMinute; m <= 6; m++) {
                long ts = minute(m).toEpochMilli();
                bidBars.add(new Bar(ts, bid, bid, bid, bid, 1));
                askBars.add(new Bar(ts, bid + 0.02, bid + 0.02, bid + 0.02, bid + 0.02, 1));
            }
            return new BidAskBars(bidBars, askBars);
        }

        // USDJPY, needed to convert yen into dollars, is only priced from minute 3
        private BacktestExecClient yenClient() {
            return new BacktestExecClient(
                List.of(Instrument.fxPair(audjpy, 3), Instrument.fxPair(usdjpy, 3)),
                Map.of(audjpy, flat(1, 75.0), usdjpy, flat(3, 110.0)),
                1_000_000, 0, new GenericCommissionModel(0.20, 0), account, new Portfolio(account),
                MarketModel.certain(), clock, false);
        }

        @Test
        @DisplayName("Universe without a pair to the account currency fails construction")
        void unconvertibleUniverse() {
            Symbol eurjpy = Symbol.parse("EURJPY.FXCM");
            DataInconsistencyException e = assertThrows(DataInconsistencyException.class,
                () -> new BacktestExecClient(List.of(Instrument.fxPair(eurjpy, 3)),
                    Map.of(eurjpy, flat(1, 130.0)), 1_000_000, 0, new GenericCommissionModel(),
                    account, new Portfolio(account), MarketModel.certain(), clock, false));
            assertTrue(e.getMessage().contains("JPY"));
        }

        @Test
        @DisplayName("Market order is rejected, not left live, while the rate is unpriced")
        void marketRejectedWithoutRate() {
            BacktestExecClient client = yenClient();
            clock.setTime(minute(1));

            SimulatedOrder order = client.submitOrder("s1", OrderRequest.market(audjpy, OrderSide.BUY, 1000));

            assertEquals(OrderStatus.REJECTED, order.getStatus());
            assertFalse(client.cancelOrder(order.getOrderId()));
            assertEquals(List.of(order), client.orders("s1"));
            assertTrue(client.workingOrders("s1").isEmpty());
            assertTrue(client.portfolio().isFlat());
            assertEquals(1_000_000, account.getCashBalance());
        }

        @Test
        @DisplayName("Working order waits for the rate, then fills converted")
        void limitWaitsForRate() {
            BacktestExecClient client = yenClient();
            clock.setTime(minute(1));
            SimulatedOrder order = client.submitOrder("s1", OrderRequest.limit(audjpy, OrderSide.BUY, 100_000, 76.0));

            stepTo(client, clock, 1);
            stepTo(client, clock, 2);
            assertEquals(OrderStatus.WORKING, order.getStatus());

            stepTo(client, clock, 3);
            assertEquals(OrderStatus.FILLED, order.getStatus());
            // 7,600,000 JPY notional at 110.01 JPY per USD, 0.20 bp
            assertEquals(1.38, client.totalCommissions(), 1e-9);
        }
    }

    @Test
    @DisplayName("Reset cancels orders, restores the account and reproduces draws")
    void reset() {
        MarketModel model = new MarketModel(0.5, 0.5, 0.5, 0.5, 0.5, 11L);
        BacktestExecClient client = client(model, 1, false);

        List<OrderStatus> first = runScenario(client);
        double firstBalance = account.getCashBalance();

        client.reset();
        assertEquals(1_000_000, account.getCashBalance());
        assertEquals(0, client.iteration());
        assertEquals(0, client.totalCommissions());
        assertTrue(client.orders("s1").isEmpty());

        assertEquals(first, runScenario(client));
        assertEquals(firstBalance, account.getCashBalance());
    }

    private List<OrderStatus> runScenario(BacktestExecClient client) {
        client.setInitialIteration(minute(1), 1);
        List<SimulatedOrder> orders = new ArrayList<>();
        orders.add(client.submitOrder("s1", OrderRequest.limit(AUDUSD, OrderSide.BUY, 1000, 1.0001)));
        orders.add(client.submitOrder("s1", OrderRequest.stop(AUDUSD, OrderSide.SELL, 1000, 0.9995)));
        for (int m = 1; m <= BIDS.length; m++) {
            stepTo(client, clock, m);
            orders.add(client.submitOrder("s1", OrderRequest.market(AUDUSD, OrderSide.BUY, 1000)));
        }
        return orders.stream().map(SimulatedOrder::getStatus).toList();
    }
}
