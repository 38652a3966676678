package com.hindsight.engine;

import com.hindsight.core.model.BidAskBars;
import com.hindsight.core.model.QuoteTick;
import com.hindsight.core.model.Resolution;
import com.hindsight.core.model.Symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Historical data for a backtest: quote ticks and bid/ask bars per symbol and resolution.
 * Loading the data is the caller's job; the engine only replays it.
 */
public record BacktestData(
    Map<Symbol, List<QuoteTick>> ticks,
    Map<Symbol, Map<Resolution, BidAskBars>> bars
) {
    public BacktestData {
        ticks = Collections.unmodifiableMap(new LinkedHashMap<>(ticks));
        Map<Symbol, Map<Resolution, BidAskBars>> copy = new LinkedHashMap<>();
        bars.forEach((symbol, byResolution) ->
            copy.put(symbol, Collections.unmodifiableMap(new LinkedHashMap<>(byResolution))));
        bars = Collections.unmodifiableMap(copy);
    }

    /**
     * Minute bid/ask bars of every symbol that has them.
     */
    public Map<Symbol, BidAskBars> minuteBars() {
        Map<Symbol, BidAskBars> result = new LinkedHashMap<>();
        bars.forEach((symbol, byResolution) -> {
            BidAskBars minute = byResolution.get(Resolution.MINUTE);
            if (minute != null) {
                result.put(symbol, minute);
            }
        });
        return result;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<Symbol, List<QuoteTick>> ticks = new LinkedHashMap<>();
        private final Map<Symbol, Map<Resolution, BidAskBars>> bars = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder ticks(Symbol symbol, List<QuoteTick> quoteTicks) {
            ticks.put(symbol, List.copyOf(quoteTicks));
            return this;
        }

        public Builder bars(Symbol symbol, Resolution resolution, BidAskBars bidAskBars) {
            bars.computeIfAbsent(symbol, s -> new LinkedHashMap<>()).put(resolution, bidAskBars);
            return this;
        }

        public BacktestData build() {
            return new BacktestData(ticks, bars);
        }
    }
}
