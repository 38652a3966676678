package com.hindsight.execution.portfolio;

import com.hindsight.core.model.Fill;
import com.hindsight.execution.account.Account;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks positions per strategy:symbol pair and feeds the performance analyzer.
 */
public class Portfolio {

    private static final Logger log = LoggerFactory.getLogger(Portfolio.class);

    // Key: "strategyId:symbol"
    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final List<Position> closedPositions = new ArrayList<>();
    private final Account account;
    private final PortfolioAnalyzer analyzer;

    public Portfolio(Account account) {
        this.account = account;
        this.analyzer = new PortfolioAnalyzer(account.getStartingBalance());
    }

    /**
     * Apply a fill to the tracked position.
     *
     * @param exchangeRate rate converting the instrument's quote currency into account currency
     * @return realized P&L of the fill in account currency, 0 if it only opened or added
     */
    public double onFill(Fill fill, double exchangeRate) {
        String key = positionKey(fill.strategyId(), fill.symbol().toString());
        Position position = positions.get(key);

        if (position == null) {
            position = new Position(fill);
            positions.put(key, position);
            log.debug("Position opened: {}", position);
            return 0;
        }

        boolean reducing = fill.side() != position.getSide();
        double pnl = position.apply(fill) * exchangeRate;
        if (reducing) {
            analyzer.addTrade(pnl);
        }

        if (position.isClosed()) {
            positions.remove(key);
            closedPositions.add(position);
            log.debug("Position closed: {} {} at {} PnL={}", fill.strategyId(), fill.symbol(),
                position.getClosedAt(), pnl);
        } else {
            log.debug("Position modified: {}", position);
        }
        return pnl;
    }

    /**
     * Record the account balance and benchmark price observed at {@code time}.
     */
    public void markToMarket(Instant time, double benchmarkPrice) {
        analyzer.addBalance(time, account.getCashBalance());
        if (benchmarkPrice > 0) {
            analyzer.addBenchmarkPrice(time, benchmarkPrice);
        }
    }

    public List<Position> getOpenPositions() {
        return new ArrayList<>(positions.values());
    }

    public List<Position> getClosedPositions() {
        return List.copyOf(closedPositions);
    }

    public List<Position> getPositionsForStrategy(String strategyId) {
        return positions.values().stream()
            .filter(p -> strategyId.equals(p.getStrategyId()))
            .toList();
    }

    public Optional<Position> getPosition(String strategyId, String symbol) {
        return Optional.ofNullable(positions.get(positionKey(strategyId, symbol)));
    }

    public boolean isFlat() {
        return positions.isEmpty();
    }

    public PortfolioAnalyzer analyzer() {
        return analyzer;
    }

    public Account account() {
        return account;
    }

    public void reset() {
        positions.clear();
        closedPositions.clear();
        analyzer.reset();
    }

    private String positionKey(String strategyId, String symbol) {
        return strategyId + ":" + symbol;
    }
}
