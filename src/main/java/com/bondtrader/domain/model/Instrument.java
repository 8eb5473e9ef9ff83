package com.bondtrader.domain.model;

import java.util.Map;

/**
 * A tradeable product as seen by the pipeline stages.
 *
 * <p>Stages key their state on {@link #getInstrumentId()} and never inspect the concrete
 * type. Product-specific fields (coupon, maturity, ...) are exposed through
 * {@link #getAttributes()} for sinks and diagnostics.
 */
public interface Instrument {

    /** Catalog identifier, e.g. "B10y". */
    String getInstrumentId();

    /** Product-specific attributes keyed by name. Never null. */
    Map<String, Object> getAttributes();
}
