package com.bondtrader.domain.model;

import com.bondtrader.domain.enums.PricingSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A single price level of market depth. */
@Value
@Builder
public class OrderBookLevel {

    BigDecimal price;
    long quantity;
    PricingSide side;
}
