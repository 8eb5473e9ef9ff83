package com.bondtrader.domain.model;

import lombok.Builder;
import lombok.Value;

/** A two-sided quote: exactly one bid leg and one offer leg. */
@Value
@Builder
public class PriceStream {

    Instrument instrument;
    PriceStreamOrder bidOrder;
    PriceStreamOrder offerOrder;
}
