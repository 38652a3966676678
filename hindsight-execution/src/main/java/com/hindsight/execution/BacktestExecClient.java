package com.hindsight.execution;

import com.hindsight.core.clock.TestClock;
import com.hindsight.core.commission.CommissionModel;
import com.hindsight.core.config.MarketModel;
import com.hindsight.core.exception.DataInconsistencyException;
import com.hindsight.core.exception.InvalidArgumentException;
import com.hindsight.core.model.BarSeries;
import com.hindsight.core.model.Bar;
import com.hindsight.core.model.BidAskBars;
import com.hindsight.core.model.Fill;
import com.hindsight.core.model.Instrument;
import com.hindsight.core.model.LiquiditySide;
import com.hindsight.core.model.OrderRequest;
import com.hindsight.core.model.OrderSide;
import com.hindsight.core.model.OrderStatus;
import com.hindsight.core.model.Symbol;
import com.hindsight.execution.account.Account;
import com.hindsight.execution.fill.FillModel;
import com.hindsight.execution.order.OrderGateway;
import com.hindsight.execution.order.SimulatedOrder;
import com.hindsight.execution.portfolio.Portfolio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Simulated exchange for backtests.
 *
 * <p>Prices come from the close of the latest minute bid and ask bars visible on the
 * shared clock. Market orders fill on submission; limit and stop orders are working
 * until {@link #processMarket()} resolves them through the {@link FillModel}.
 */
public class BacktestExecClient implements OrderGateway {

    private static final Logger log = LoggerFactory.getLogger(BacktestExecClient.class);

    private final Map<Symbol, Instrument> instruments = new LinkedHashMap<>();
    private final Map<Symbol, BarSeries> bidBars = new LinkedHashMap<>();
    private final Map<Symbol, BarSeries> askBars = new LinkedHashMap<>();
    private final List<Instant> minuteIndex;
    private final double startingCapital;
    private final int slippageTicks;
    private final CommissionModel commissionModel;
    private final Account account;
    private final Portfolio portfolio;
    private final FillModel fillModel;
    private final ExchangeRateCalculator exchangeRates = new ExchangeRateCalculator();
    private final TestClock clock;
    private final boolean frozenAccount;

    private final Map<String, SimulatedOrder> orders = new LinkedHashMap<>();
    private final List<SimulatedOrder> working = new ArrayList<>();
    private Duration step = Duration.ofMinutes(1);
    private int iteration;
    private double totalCommissions;
    private long orderSeq = 1;
    private long tradeSeq = 1;

    public BacktestExecClient(List<Instrument> instruments,
                              Map<Symbol, BidAskBars> minuteBars,
                              double startingCapital,
                              int slippageTicks,
                              CommissionModel commissionModel,
                              Account account,
                              Portfolio portfolio,
                              MarketModel marketModel,
                              TestClock clock,
                              boolean frozenAccount) {
        for (Instrument instrument : instruments) {
            Symbol symbol = instrument.symbol();
            BidAskBars bars = minuteBars.get(symbol);
            if (bars == null || bars.bid().isEmpty() || bars.ask().isEmpty()) {
                throw new DataInconsistencyException("No minute bid/ask bars for " + symbol);
            }
            this.instruments.put(symbol, instrument);
            this.bidBars.put(symbol, new BarSeries(symbol + " bid", bars.bid()));
            this.askBars.put(symbol, new BarSeries(symbol + " ask", bars.ask()));
        }
        for (Instrument instrument : instruments) {
            if (!exchangeRates.canConvert(instrument.quoteCurrency(), account.getCurrency(), instruments)) {
                throw new DataInconsistencyException(String.format(
                    "No instrument converts %s (quote currency of %s) to account currency %s",
                    instrument.quoteCurrency(), instrument.symbol(), account.getCurrency()));
            }
        }
        List<BarSeries> all = new ArrayList<>(bidBars.values());
        all.addAll(askBars.values());
        this.minuteIndex = BarSeries.commonTimestamps(all);
        this.startingCapital = startingCapital;
        this.slippageTicks = slippageTicks;
        this.commissionModel = commissionModel;
        this.account = account;
        this.portfolio = portfolio;
        this.fillModel = new FillModel(marketModel);
        this.clock = clock;
        this.frozenAccount = frozenAccount;
    }

    // ========== Iteration ==========

    public List<Instant> minuteIndex() {
        return minuteIndex;
    }

    public void setInitialIteration(Instant start, int stepMinutes) {
        if (stepMinutes <= 0) {
            throw new InvalidArgumentException("stepMinutes must be positive, was " + stepMinutes);
        }
        clock.setTime(start);
        step = Duration.ofMinutes(stepMinutes);
        iteration = 0;
        log.debug("Execution iteration set to {} every {}", start, step);
    }

    public void iterate() {
        iteration++;
    }

    public Instant timeNow() {
        return clock.timeNow();
    }

    public int iteration() {
        return iteration;
    }

    public Duration step() {
        return step;
    }

    public double totalCommissions() {
        return totalCommissions;
    }

    public double startingCapital() {
        return startingCapital;
    }

    /**
     * Cancel all orders, restore account and portfolio, reseed the fill model.
     */
    public void reset() {
        Instant now = clock.timeNow();
        for (SimulatedOrder order : working) {
            order.cancel(now);
        }
        working.clear();
        orders.clear();
        account.reset();
        portfolio.reset();
        fillModel.reset();
        iteration = 0;
        totalCommissions = 0;
        orderSeq = 1;
        tradeSeq = 1;
        log.debug("Execution client reset");
    }

    // ========== Market processing ==========

    /**
     * Resolve working orders against the prices visible now, then mark the portfolio.
     */
    public void processMarket() {
        Instant now = clock.timeNow();
        Iterator<SimulatedOrder> it = working.iterator();
        while (it.hasNext()) {
            SimulatedOrder order = it.next();
            Bar bid = bidBars.get(order.getSymbol()).latestAt(now);
            Bar ask = askBars.get(order.getSymbol()).latestAt(now);
            if (bid == null || ask == null) {
                continue;
            }
            if (tryFill(order, bid.close(), ask.close(), now)) {
                it.remove();
            }
        }

        markToMarket(now);
    }

    // The first instrument's mid serves as benchmark
    private void markToMarket(Instant now) {
        Symbol benchmark = instruments.isEmpty() ? null : instruments.keySet().iterator().next();
        Double benchmarkMid = benchmark != null ? mid(benchmark, now) : null;
        portfolio.markToMarket(now, benchmarkMid != null ? benchmarkMid : 0.0);
    }

    /**
     * Fill the order if the model allows it at these prices. Returns false and leaves the
     * order untouched when it does not fill or no exchange rate is priced yet.
     */
    private boolean tryFill(SimulatedOrder order, double bid, double ask, Instant now) {
        OrderRequest request = order.getRequest();
        Instrument instrument = instruments.get(order.getSymbol());
        OptionalDouble quoteRate = exchangeRates.find(
            instrument.quoteCurrency(), account.getCurrency(), currentMids(now));
        if (quoteRate.isEmpty()) {
            log.debug("No {}/{} rate at {}, {} not filled", instrument.quoteCurrency(),
                account.getCurrency(), now, order.getOrderId());
            return false;
        }
        double rate = quoteRate.getAsDouble();
        switch (request.type()) {
            case LIMIT -> {
                FillModel.LimitLevel level = FillModel.limitLevel(request.side(), request.price(), bid, ask);
                if (level != FillModel.LimitLevel.NONE && fillModel.isLimitFilled(level)) {
                    fill(order, instrument, request.price(), LiquiditySide.MAKER, rate, now);
                    return true;
                }
            }
            case STOP_MARKET -> {
                if (FillModel.isStopTriggered(request.side(), request.triggerPrice(), bid, ask)
                        && fillModel.isStopFilled()) {
                    double price = request.side() == OrderSide.BUY ? ask : bid;
                    fill(order, instrument, slip(instrument, request.side(), price), LiquiditySide.TAKER, rate, now);
                    return true;
                }
            }
            case MARKET -> {
                double price = request.side() == OrderSide.BUY ? ask : bid;
                fill(order, instrument, slip(instrument, request.side(), price), LiquiditySide.TAKER, rate, now);
                return true;
            }
        }
        return false;
    }

    private double slip(Instrument instrument, OrderSide side, double price) {
        if (slippageTicks > 0 && fillModel.isSlipped()) {
            return instrument.roundPrice(price + side.sign() * slippageTicks * instrument.tickSize());
        }
        return price;
    }

    private void fill(SimulatedOrder order, Instrument instrument, double price,
                      LiquiditySide liquidity, double rate, Instant now) {
        double quantity = order.getRemainingQuantity();
        double commission = commissionModel.calculate(instrument, quantity, price, rate, liquidity);

        Fill fill = new Fill("T-" + tradeSeq++, order.getOrderId(), order.getStrategyId(), order.getSymbol(),
            order.getSide(), price, quantity, commission, liquidity, now);
        order.applyFill(fill);

        double pnl = portfolio.onFill(fill, rate);
        if (!frozenAccount) {
            account.credit(pnl);
        }
        account.debit(commission);
        totalCommissions += commission;
        markToMarket(now);

        log.info("Filled {} {} {} {} @ {} ({}, commission {} {})", order.getOrderId(), order.getSide(),
            quantity, order.getSymbol(), price, liquidity, commission, account.getCurrency());
    }

    private Map<Instrument, Double> currentMids(Instant now) {
        Map<Instrument, Double> mids = new LinkedHashMap<>();
        for (Instrument instrument : instruments.values()) {
            mids.put(instrument, mid(instrument.symbol(), now));
        }
        return mids;
    }

    private Double mid(Symbol symbol, Instant now) {
        Bar bid = bidBars.get(symbol).latestAt(now);
        Bar ask = askBars.get(symbol).latestAt(now);
        return bid != null && ask != null ? (bid.close() + ask.close()) / 2.0 : null;
    }

    // ========== Order gateway ==========

    @Override
    public SimulatedOrder submitOrder(String strategyId, OrderRequest request) {
        validate(request);
        Instant now = clock.timeNow();
        SimulatedOrder order = new SimulatedOrder("O-" + orderSeq++, strategyId, request, now);

        // A market order leaves here filled or rejected, never working
        switch (request.type()) {
            case MARKET -> {
                Bar bid = bidBars.get(request.symbol()).latestAt(now);
                Bar ask = askBars.get(request.symbol()).latestAt(now);
                if (bid == null || ask == null) {
                    order.reject("No market for " + request.symbol() + " at " + now, now);
                } else if (!tryFill(order, bid.close(), ask.close(), now)) {
                    order.reject("No exchange rate for " + request.symbol() + " at " + now, now);
                }
                if (order.getStatus() == OrderStatus.REJECTED) {
                    log.warn("Rejected {}: {}", order.getOrderId(), order.getReason());
                }
            }
            case LIMIT, STOP_MARKET -> {
                working.add(order);
                log.debug("Working {} from {}", order, strategyId);
            }
        }
        orders.put(order.getOrderId(), order);
        return order;
    }

    @Override
    public boolean cancelOrder(String orderId) {
        SimulatedOrder order = orders.get(orderId);
        if (order == null || !order.isWorking()) {
            return false;
        }
        order.cancel(clock.timeNow());
        working.remove(order);
        log.debug("Cancelled {}", orderId);
        return true;
    }

    @Override
    public List<SimulatedOrder> workingOrders(String strategyId) {
        return working.stream()
            .filter(o -> o.getStrategyId().equals(strategyId))
            .toList();
    }

    @Override
    public List<SimulatedOrder> orders(String strategyId) {
        return orders.values().stream()
            .filter(o -> o.getStrategyId().equals(strategyId))
            .toList();
    }

    private void validate(OrderRequest request) {
        if (!instruments.containsKey(request.symbol())) {
            throw new InvalidArgumentException("Unknown instrument " + request.symbol());
        }
        if (!(request.quantity() > 0)) {
            throw new InvalidArgumentException("Order quantity must be positive, was " + request.quantity());
        }
        switch (request.type()) {
            case LIMIT -> {
                if (request.price() == null) {
                    throw new InvalidArgumentException("Limit order requires a price");
                }
            }
            case STOP_MARKET -> {
                if (request.triggerPrice() == null) {
                    throw new InvalidArgumentException("Stop order requires a trigger price");
                }
            }
            case MARKET -> { }
        }
    }

    public Account account() {
        return account;
    }

    public Portfolio portfolio() {
        return portfolio;
    }

    public MarketModel marketModel() {
        return fillModel.marketModel();
    }
}
