package com.bondtrader.domain.model;

import com.bondtrader.domain.enums.PricingSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** One leg of a streamed two-sided quote. */
@Value
@Builder
public class PriceStreamOrder {

    BigDecimal price;
    long visibleQuantity;
    long hiddenQuantity;
    PricingSide side;
}
