package com.hindsight.engine.trading;

import com.hindsight.core.clock.Clock;
import com.hindsight.core.clock.TestClock;
import com.hindsight.core.model.OrderRequest;
import com.hindsight.core.model.Symbol;
import com.hindsight.engine.data.MarketDataView;
import com.hindsight.execution.account.Account;
import com.hindsight.execution.order.OrderGateway;
import com.hindsight.execution.order.SimulatedOrder;
import com.hindsight.execution.portfolio.Portfolio;
import com.hindsight.execution.portfolio.Position;
import org.slf4j.Logger;

import java.time.Instant;
import java.util.Currency;
import java.util.List;
import java.util.Optional;

/**
 * Everything a strategy may see or do during a backtest.
 *
 * <p>The clock belongs to this context alone; the coordinator moves it to each step's time.
 * Orders are submitted under the strategy's id.
 */
public class StrategyContext {

    private final String strategyId;
    private final TestClock clock;
    private final Clock readOnlyClock;
    private final Logger logger;
    private final MarketDataView marketData;
    private final OrderGateway orderGateway;
    private final Account account;
    private final Portfolio portfolio;

    public StrategyContext(String strategyId, Instant time, Logger logger, MarketDataView marketData,
                           OrderGateway orderGateway, Account account, Portfolio portfolio) {
        this.strategyId = strategyId;
        this.clock = new TestClock(time);
        this.readOnlyClock = clock::timeNow;
        this.logger = logger;
        this.marketData = marketData;
        this.orderGateway = orderGateway;
        this.account = account;
        this.portfolio = portfolio;
    }

    void advanceTo(Instant time) {
        clock.setTime(time);
    }

    public String strategyId() {
        return strategyId;
    }

    public Clock clock() {
        return readOnlyClock;
    }

    public Logger log() {
        return logger;
    }

    public MarketDataView marketData() {
        return marketData;
    }

    // ========== Orders ==========

    public SimulatedOrder submitOrder(OrderRequest request) {
        return orderGateway.submitOrder(strategyId, request);
    }

    public boolean cancelOrder(String orderId) {
        return orderGateway.cancelOrder(orderId);
    }

    public List<SimulatedOrder> workingOrders() {
        return orderGateway.workingOrders(strategyId);
    }

    public List<SimulatedOrder> orders() {
        return orderGateway.orders(strategyId);
    }

    // ========== Account / portfolio (read only) ==========

    public double cashBalance() {
        return account.getCashBalance();
    }

    public Currency accountCurrency() {
        return account.getCurrency();
    }

    public Optional<Position> position(Symbol symbol) {
        return portfolio.getPosition(strategyId, symbol.toString());
    }

    public List<Position> openPositions() {
        return portfolio.getPositionsForStrategy(strategyId);
    }
}
