package com.bondtrader.domain;

import java.util.List;

/**
 * The fixed set of trading books every position is broken down by.
 */
public final class TradingBooks {

    public static final String TRSY1 = "TRSY1";
    public static final String TRSY2 = "TRSY2";
    public static final String TRSY3 = "TRSY3";

    /** Books in reporting order. */
    public static final List<String> ALL = List.of(TRSY1, TRSY2, TRSY3);

    private TradingBooks() {}
}
