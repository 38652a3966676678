package com.hindsight.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Bid-side and ask-side bars for one instrument at one resolution.
 */
public record BidAskBars(List<Bar> bid, List<Bar> ask) {

    public BidAskBars {
        bid = List.copyOf(Objects.requireNonNull(bid, "bid"));
        ask = List.copyOf(Objects.requireNonNull(ask, "ask"));
    }

    public boolean isEmpty() {
        return bid.isEmpty() && ask.isEmpty();
    }
}
