package com.bondtrader.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Builder;
import lombok.Value;

/**
 * Mid price and bid/offer spread for an instrument.
 */
@Value
@Builder
public class Price {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    Instrument instrument;
    BigDecimal mid;
    BigDecimal bidOfferSpread;

    /** Builds a price from a bid and an offer: mid = (bid + offer) / 2, spread = offer - bid. */
    public static Price fromBidOffer(Instrument instrument, BigDecimal bid, BigDecimal offer) {
        return Price.builder()
                .instrument(instrument)
                .mid(half(bid.add(offer)))
                .bidOfferSpread(offer.subtract(bid))
                .build();
    }

    public BigDecimal getBid() {
        return mid.subtract(half(bidOfferSpread));
    }

    public BigDecimal getOffer() {
        return mid.add(half(bidOfferSpread));
    }

    // Halving a finite decimal always terminates, so the extra digit is exact.
    private static BigDecimal half(BigDecimal value) {
        return value.divide(TWO, value.scale() + 1, RoundingMode.UNNECESSARY).stripTrailingZeros();
    }
}
