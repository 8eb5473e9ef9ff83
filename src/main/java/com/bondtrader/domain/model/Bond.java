package com.bondtrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * A fixed-coupon bond identified by a ticker-like id (B02y ... B30y).
 *
 * <p>Created once from {@link com.bondtrader.domain.BondCatalog} and shared by reference;
 * all fields are final.
 */
@Value
@Builder
public class Bond implements Instrument {

    String ticker;

    /** Annual coupon as a fraction, e.g. 0.04 for 4%. */
    BigDecimal coupon;

    LocalDate maturity;

    @Override
    public String getInstrumentId() {
        return ticker;
    }

    @Override
    public Map<String, Object> getAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("coupon", coupon);
        attributes.put("maturity", maturity);
        return attributes;
    }
}
