package com.hindsight.engine.data;

import com.hindsight.core.model.Bar;
import com.hindsight.core.model.PriceType;
import com.hindsight.core.model.QuoteTick;
import com.hindsight.core.model.Resolution;
import com.hindsight.core.model.Symbol;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Read-only market data bounded by the current simulated time. Nothing with a
 * timestamp after "now" is ever returned.
 */
public interface MarketDataView {

    Optional<Bar> latestBar(Symbol symbol, Resolution resolution, PriceType priceType);

    /**
     * Up to {@code count} most recent bars, oldest first.
     */
    List<Bar> bars(Symbol symbol, Resolution resolution, PriceType priceType, int count);

    /**
     * Latest quote tick, or one built from the latest minute bid/ask closes when the
     * symbol has no ticks.
     */
    Optional<QuoteTick> latestQuote(Symbol symbol);

    OptionalDouble latestMid(Symbol symbol);
}
