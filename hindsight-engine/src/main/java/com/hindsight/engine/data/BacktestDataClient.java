package com.hindsight.engine.data;

import com.hindsight.core.clock.TestClock;
import com.hindsight.core.exception.DataInconsistencyException;
import com.hindsight.core.exception.InvalidArgumentException;
import com.hindsight.core.model.Bar;
import com.hindsight.core.model.BarSeries;
import com.hindsight.core.model.BidAskBars;
import com.hindsight.core.model.Instrument;
import com.hindsight.core.model.PriceType;
import com.hindsight.core.model.QuoteTick;
import com.hindsight.core.model.Resolution;
import com.hindsight.core.model.Symbol;
import com.hindsight.engine.BacktestData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Replays historical ticks and bars against the shared simulated clock.
 */
public class BacktestDataClient implements MarketDataView {

    private static final Logger log = LoggerFactory.getLogger(BacktestDataClient.class);

    private final Map<Symbol, Instrument> instruments = new LinkedHashMap<>();
    private final Map<Symbol, Map<Resolution, Map<PriceType, BarSeries>>> bars = new LinkedHashMap<>();
    private final Map<Symbol, TickSeries> ticks = new LinkedHashMap<>();
    private final List<Instant> minuteIndex;
    private final TestClock clock;

    private Duration step = Duration.ofMinutes(1);
    private int iteration;

    public BacktestDataClient(List<Instrument> instruments, BacktestData data, TestClock clock) {
        this.clock = clock;
        for (Instrument instrument : instruments) {
            this.instruments.put(instrument.symbol(), instrument);
        }

        List<BarSeries> minuteSeries = new ArrayList<>();
        data.bars().forEach((symbol, byResolution) -> {
            Map<Resolution, Map<PriceType, BarSeries>> bySide = new EnumMap<>(Resolution.class);
            byResolution.forEach((resolution, bidAsk) -> {
                Map<PriceType, BarSeries> series = sides(symbol, resolution, bidAsk);
                bySide.put(resolution, series);
                if (resolution == Resolution.MINUTE) {
                    minuteSeries.add(series.get(PriceType.BID));
                    minuteSeries.add(series.get(PriceType.ASK));
                }
            });
            bars.put(symbol, bySide);
        });
        data.ticks().forEach((symbol, quoteTicks) -> ticks.put(symbol, new TickSeries(symbol, quoteTicks)));

        this.minuteIndex = BarSeries.commonTimestamps(minuteSeries);
        log.debug("Data client loaded {} symbols, {} minute index entries", bars.size(), minuteIndex.size());
    }

    private static Map<PriceType, BarSeries> sides(Symbol symbol, Resolution resolution, BidAskBars bidAsk) {
        String name = symbol + "-" + resolution.getValue();
        BarSeries bid = new BarSeries(name + " bid", bidAsk.bid());
        BarSeries ask = new BarSeries(name + " ask", bidAsk.ask());
        Map<PriceType, BarSeries> series = new EnumMap<>(PriceType.class);
        series.put(PriceType.BID, bid);
        series.put(PriceType.ASK, ask);
        series.put(PriceType.MID, new BarSeries(name + " mid", mids(bid, ask)));
        return series;
    }

    // Mid bars exist where bid and ask bars share a timestamp
    private static List<Bar> mids(BarSeries bid, BarSeries ask) {
        List<Bar> result = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < bid.size() && j < ask.size()) {
            long b = bid.get(i).timestamp();
            long a = ask.get(j).timestamp();
            if (b == a) {
                result.add(Bar.mid(bid.get(i++), ask.get(j++)));
            } else if (b < a) {
                i++;
            } else {
                j++;
            }
        }
        return result;
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
        log.debug("Data iteration set to {} every {}", start, step);
    }

    public void iterate() {
        iteration++;
    }

    public void reset() {
        iteration = 0;
        log.debug("Data client reset");
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

    public List<Instrument> instruments() {
        return List.copyOf(instruments.values());
    }

    // ========== MarketDataView ==========

    @Override
    public Optional<Bar> latestBar(Symbol symbol, Resolution resolution, PriceType priceType) {
        return Optional.ofNullable(series(symbol, resolution, priceType).latestAt(clock.timeNow()));
    }

    @Override
    public List<Bar> bars(Symbol symbol, Resolution resolution, PriceType priceType, int count) {
        if (count <= 0) {
            throw new InvalidArgumentException("count must be positive, was " + count);
        }
        return series(symbol, resolution, priceType).lastAt(clock.timeNow(), count);
    }

    @Override
    public Optional<QuoteTick> latestQuote(Symbol symbol) {
        Instant now = clock.timeNow();
        TickSeries tickSeries = ticks.get(symbol);
        if (tickSeries != null) {
            return Optional.ofNullable(tickSeries.latestAt(now));
        }
        Map<Resolution, Map<PriceType, BarSeries>> bySymbol = bars.get(symbol);
        if (bySymbol == null || !bySymbol.containsKey(Resolution.MINUTE)) {
            return Optional.empty();
        }
        Bar bid = bySymbol.get(Resolution.MINUTE).get(PriceType.BID).latestAt(now);
        Bar ask = bySymbol.get(Resolution.MINUTE).get(PriceType.ASK).latestAt(now);
        if (bid == null || ask == null) {
            return Optional.empty();
        }
        return Optional.of(new QuoteTick(symbol, bid.close(), ask.close(), Math.max(bid.timestamp(), ask.timestamp())));
    }

    @Override
    public OptionalDouble latestMid(Symbol symbol) {
        return latestQuote(symbol)
            .map(q -> OptionalDouble.of(q.mid()))
            .orElse(OptionalDouble.empty());
    }

    private BarSeries series(Symbol symbol, Resolution resolution, PriceType priceType) {
        Map<Resolution, Map<PriceType, BarSeries>> bySymbol = bars.get(symbol);
        if (bySymbol == null || !bySymbol.containsKey(resolution)) {
            throw new InvalidArgumentException("No " + resolution.getValue() + " bars for " + symbol);
        }
        return bySymbol.get(resolution).get(priceType);
    }

    /**
     * Quote ticks in strictly increasing time order.
     */
    private static final class TickSeries {
        private final List<QuoteTick> ticks;
        private final long[] times;

        TickSeries(Symbol symbol, List<QuoteTick> ticks) {
            this.ticks = List.copyOf(ticks);
            this.times = new long[this.ticks.size()];
            for (int i = 0; i < times.length; i++) {
                times[i] = this.ticks.get(i).timestamp();
                if (i > 0 && times[i] <= times[i - 1]) {
                    throw new DataInconsistencyException(symbol + ": ticks not strictly increasing at index " + i);
                }
            }
        }

        QuoteTick latestAt(Instant time) {
            int pos = Arrays.binarySearch(times, time.toEpochMilli());
            int index = pos >= 0 ? pos : -pos - 2;
            return index >= 0 ? ticks.get(index) : null;
        }
    }
}
