package com.bondtrader.domain.enums;

/** Buy or sell side of a trade or inquiry. */
public enum Side {
    BUY,
    SELL;

    /** +1 for BUY, -1 for SELL. Applied to quantities when updating positions. */
    public long signum() {
        return this == BUY ? 1L : -1L;
    }
}
