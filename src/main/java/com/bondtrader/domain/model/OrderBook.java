package com.bondtrader.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Market depth for one instrument. Both stacks are ordered best to worst; level 0 is the
 * top of book.
 */
@Value
public class OrderBook {

    Instrument instrument;
    List<OrderBookLevel> bidStack;
    List<OrderBookLevel> offerStack;

    @Builder
    public OrderBook(Instrument instrument, List<OrderBookLevel> bidStack, List<OrderBookLevel> offerStack) {
        this.instrument = instrument;
        this.bidStack = bidStack == null ? List.of() : List.copyOf(bidStack);
        this.offerStack = offerStack == null ? List.of() : List.copyOf(offerStack);
    }

    public boolean isTwoSided() {
        return !bidStack.isEmpty() && !offerStack.isEmpty();
    }
}
