package com.bondtrader.domain.enums;

/** Side of a two-sided quote or of an aggressing execution. */
public enum PricingSide {
    BID,
    OFFER;

    /** Trade side that results from executing on this pricing side: BID buys, OFFER sells. */
    public Side toTradeSide() {
        return this == BID ? Side.BUY : Side.SELL;
    }
}
