package com.bondtrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * PV01 risk of a position: per-unit sensitivity times signed quantity.
 * A fresh instance is created for every position change.
 */
@Value
@Builder
public class Pv01 {

    Instrument instrument;

    /** Price value of one basis point per unit held. */
    BigDecimal pv01;

    long quantity;

    public BigDecimal getTotalRisk() {
        return pv01.multiply(BigDecimal.valueOf(quantity));
    }
}
