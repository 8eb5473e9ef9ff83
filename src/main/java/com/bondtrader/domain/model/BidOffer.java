package com.bondtrader.domain.model;

import lombok.Value;

/** Top of book: best bid and best offer levels. */
@Value
public class BidOffer {

    OrderBookLevel bid;
    OrderBookLevel offer;
}
