package com.hindsight.engine;

import com.hindsight.core.clock.LiveClock;
import com.hindsight.core.clock.TestClock;
import com.hindsight.core.commission.GenericCommissionModel;
import com.hindsight.core.config.BacktestConfig;
import com.hindsight.core.config.MarketModel;
import com.hindsight.core.exception.DataInconsistencyException;
import com.hindsight.core.exception.InvalidArgumentException;
import com.hindsight.core.exception.TypeMismatchException;
import com.hindsight.core.model.BarSeries;
import com.hindsight.core.model.BidAskBars;
import com.hindsight.core.model.Instrument;
import com.hindsight.core.model.Symbol;
import com.hindsight.engine.data.BacktestDataClient;
import com.hindsight.engine.trading.StrategyContext;
import com.hindsight.engine.trading.Trader;
import com.hindsight.engine.trading.TraderState;
import com.hindsight.engine.trading.TradingStrategy;
import com.hindsight.execution.BacktestExecClient;
import com.hindsight.execution.account.Account;
import com.hindsight.execution.portfolio.Portfolio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Time-stepped backtest engine.
 *
 * <p>One simulated clock is shared by the data and execution clients; only the run loop
 * writes to it. Each strategy gets its own clock through its {@link StrategyContext},
 * moved to the same instant at every step.
 *
 * <p>Every step: set the clock, process the market, advance the data and execution
 * cursors, then call each strategy in order.
 */
public class BacktestEngine {

    private static final Logger log = LoggerFactory.getLogger(BacktestEngine.class);

    /** MDC key holding the simulated time of the current step. */
    public static final String SIM_TIME_KEY = "simTime";
    public static final String STRATEGY_LOGGER_PREFIX = "com.hindsight.strategy.";

    private final BacktestConfig config;
    private final LiveClock liveClock = new LiveClock();
    private final Instant createdAt;
    private final TestClock clock;
    private final List<Instrument> instruments;
    private final List<Instant> minuteIndex;
    private final Account account;
    private final Portfolio portfolio;
    private final BacktestDataClient dataClient;
    private final BacktestExecClient execClient;
    private final Trader trader;
    private final Duration constructionTime;

    private int runCount;
    private boolean disposed;
    private BacktestSummary lastSummary;

    public BacktestEngine(List<Instrument> instruments,
                          BacktestData data,
                          List<TradingStrategy> strategies,
                          BacktestConfig config) {
        this(instruments, data, strategies, config, MarketModel.defaults());
    }

    public BacktestEngine(List<Instrument> instruments,
                          BacktestData data,
                          List<TradingStrategy> strategies,
                          BacktestConfig config,
                          MarketModel marketModel) {
        Objects.requireNonNull(data, "data");
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(marketModel, "marketModel");
        this.instruments = checkInstruments(instruments);
        List<TradingStrategy> initial = checkStrategies(strategies);

        this.createdAt = liveClock.timeNow();
        // Placeholder reading; run() sets the real start time
        this.clock = new TestClock(createdAt);

        Map<Symbol, BidAskBars> minuteBars = universeMinuteBars(data);
        List<BarSeries> series = new ArrayList<>();
        minuteBars.forEach((symbol, bars) -> {
            series.add(new BarSeries(symbol + " bid", bars.bid()));
            series.add(new BarSeries(symbol + " ask", bars.ask()));
        });
        this.minuteIndex = BarSeries.commonTimestamps(series);
        if (minuteIndex.isEmpty()) {
            throw new DataInconsistencyException("No minute timestamps common to all instruments");
        }

        this.account = new Account("SIM-001", config.accountCurrency(), config.startingCapital());
        this.portfolio = new Portfolio(account);
        this.dataClient = new BacktestDataClient(this.instruments, data, clock);
        this.execClient = new BacktestExecClient(
            this.instruments,
            minuteBars,
            config.startingCapital(),
            config.slippageTicks(),
            new GenericCommissionModel(config.commissionRateBp(), config.minimumCommission()),
            account,
            portfolio,
            marketModel,
            clock,
            config.frozenAccount());

        checkIndex("data client", dataClient.minuteIndex());
        checkIndex("execution client", execClient.minuteIndex());

        bindStrategies(initial);
        this.trader = new Trader("TRADER-001", initial);

        this.constructionTime = liveClock.elapsedSince(createdAt);
        log.info("Engine built in {} ms: {} instruments, {} strategies, {} minutes from {} to {}",
            constructionTime.toMillis(), this.instruments.size(), initial.size(), minuteIndex.size(),
            minuteIndex.get(0), minuteIndex.get(minuteIndex.size() - 1));
    }

    private Map<Symbol, BidAskBars> universeMinuteBars(BacktestData data) {
        Map<Symbol, BidAskBars> all = data.minuteBars();
        Map<Symbol, BidAskBars> result = new LinkedHashMap<>();
        for (Instrument instrument : instruments) {
            BidAskBars bars = all.get(instrument.symbol());
            if (bars == null) {
                throw new DataInconsistencyException("No minute bars for " + instrument.symbol());
            }
            result.put(instrument.symbol(), bars);
        }
        return result;
    }

    private void checkIndex(String collaborator, List<Instant> index) {
        if (!minuteIndex.equals(index)) {
            throw new DataInconsistencyException(String.format(
                "Minute index of %s (%d entries) differs from engine (%d entries)",
                collaborator, index.size(), minuteIndex.size()));
        }
    }

    private static List<Instrument> checkInstruments(List<Instrument> instruments) {
        Objects.requireNonNull(instruments, "instruments");
        for (int i = 0; i < instruments.size(); i++) {
            if (instruments.get(i) == null) {
                throw new TypeMismatchException("instruments[" + i + "] is not an instrument");
            }
        }
        return List.copyOf(instruments);
    }

    private static List<TradingStrategy> checkStrategies(List<TradingStrategy> strategies) {
        Objects.requireNonNull(strategies, "strategies");
        for (int i = 0; i < strategies.size(); i++) {
            if (strategies.get(i) == null) {
                throw new TypeMismatchException("strategies[" + i + "] is not a strategy");
            }
        }
        return Trader.checkUniqueIds(strategies);
    }

    /**
     * Give every strategy a fresh context with its own clock at the engine's current time.
     */
    private void bindStrategies(List<TradingStrategy> strategies) {
        for (TradingStrategy strategy : strategies) {
            strategy.register(new StrategyContext(
                strategy.id(),
                clock.timeNow(),
                LoggerFactory.getLogger(STRATEGY_LOGGER_PREFIX + strategy.id()),
                dataClient,
                execClient,
                account,
                portfolio));
        }
    }

    // ========== Run ==========

    /**
     * Replay [start, stop] in steps of {@code stepMinutes}. The last step is clamped to
     * {@code stop}, so both ends are visited.
     */
    public void run(Instant start, Instant stop, int stepMinutes) {
        requireNotDisposed();
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(stop, "stop");
        Instant first = minuteIndex.get(0);
        Instant last = minuteIndex.get(minuteIndex.size() - 1);
        if (!start.isBefore(stop)) {
            throw new InvalidArgumentException("start " + start + " must be before stop " + stop);
        }
        if (start.isBefore(first)) {
            throw new InvalidArgumentException("start " + start + " is before first data timestamp " + first);
        }
        if (stop.isAfter(last)) {
            throw new InvalidArgumentException("stop " + stop + " is after last data timestamp " + last);
        }
        if (stepMinutes <= 0) {
            throw new InvalidArgumentException("stepMinutes must be positive, was " + stepMinutes);
        }

        Instant runStarted = liveClock.timeNow();
        clock.setTime(start);
        bindStrategies(trader.strategies());
        trader.start();

        dataClient.setInitialIteration(start, stepMinutes);
        execClient.setInitialIteration(start, stepMinutes);
        if (dataClient.iteration() != execClient.iteration()
                || !dataClient.timeNow().equals(start)
                || !execClient.timeNow().equals(start)) {
            throw new IllegalStateException("Data and execution clients out of sync at " + start);
        }

        log.info("Running {} to {} every {} min", start, stop, stepMinutes);
        Duration step = Duration.ofMinutes(stepMinutes);
        Instant time = start;
        try {
            while (true) {
                clock.setTime(time);
                MDC.put(SIM_TIME_KEY, time.toString());
                execClient.processMarket();
                dataClient.iterate();
                execClient.iterate();
                trader.iterate(time);

                if (!time.isBefore(stop)) {
                    break;
                }
                Instant next = time.plus(step);
                time = next.isAfter(stop) ? stop : next;
            }
        } finally {
            MDC.remove(SIM_TIME_KEY);
        }

        trader.stop();
        runCount++;
        lastSummary = new BacktestSummary(
            constructionTime,
            liveClock.elapsedSince(runStarted),
            start,
            stop,
            execClient.iteration(),
            account.getCurrency(),
            account.getStartingBalance(),
            account.getCashBalance(),
            execClient.totalCommissions());
        logSummary(lastSummary);
    }

    /**
     * Replay the whole minute index one minute at a time.
     */
    public void run() {
        run(minuteIndex.get(0), minuteIndex.get(minuteIndex.size() - 1), 1);
    }

    private void logSummary(BacktestSummary summary) {
        log.info("=================================================");
        log.info(" BACKTEST DIAGNOSTICS");
        log.info("=================================================");
        log.info("Construction time: {} ms", summary.constructionTime().toMillis());
        log.info("Run time:          {} ms", summary.runTime().toMillis());
        log.info("Time range:        {} to {}", summary.start(), summary.stop());
        log.info("Iterations:        {}", summary.iterations());
        log.info("Starting balance:  {} {}", String.format("%,.2f", summary.startingBalance()), summary.currency());
        log.info("Ending balance:    {} {}", String.format("%,.2f", summary.endingBalance()), summary.currency());
        log.info("Commissions:       {} {}", String.format("%,.2f", summary.totalCommissions()), summary.currency());
        log.info("=================================================");
    }

    // ========== Lifecycle ==========

    /**
     * Replace the strategy set. Takes effect on the next run.
     */
    public void changeStrategies(List<TradingStrategy> strategies) {
        requireNotDisposed();
        List<TradingStrategy> checked = checkStrategies(strategies);
        if (trader.state() == TraderState.RUNNING) {
            throw new IllegalStateException("Cannot change strategies during a run");
        }
        bindStrategies(checked);
        trader.changeStrategies(checked);
    }

    /**
     * Return to the post-construction state, keeping configuration and wiring.
     */
    public void reset() {
        requireNotDisposed();
        dataClient.reset();
        execClient.reset();
        trader.reset();
        clock.setTime(createdAt);
        log.info("Engine reset");
    }

    public void dispose() {
        requireNotDisposed();
        trader.dispose();
        disposed = true;
        log.info("Engine disposed after {} runs", runCount);
    }

    public Map<String, Double> getPerformanceStats() {
        requireNotDisposed();
        return portfolio.analyzer().getPerformanceStats();
    }

    private void requireNotDisposed() {
        if (disposed) {
            throw new IllegalStateException("Engine is disposed");
        }
    }

    // ========== Accessors ==========

    public BacktestConfig config() { return config; }
    public List<Instrument> instruments() { return instruments; }
    public List<Instant> minuteIndex() { return minuteIndex; }
    public Account account() { return account; }
    public Portfolio portfolio() { return portfolio; }
    public Trader trader() { return trader; }
    public BacktestDataClient dataClient() { return dataClient; }
    public BacktestExecClient execClient() { return execClient; }
    public int iteration() { return execClient.iteration(); }
    public double totalCommissions() { return execClient.totalCommissions(); }
    public int runCount() { return runCount; }
    public boolean isDisposed() { return disposed; }
    public Duration constructionTime() { return constructionTime; }
    public Instant createdAt() { return createdAt; }

    /**
     * Summary of the most recent run, or null before the first run.
     */
    public BacktestSummary lastSummary() { return lastSummary; }
}
