package com.bondtrader.domain.enums;

/** Execution order type. The algo execution stage only produces MARKET orders. */
public enum OrderType {
    FOK,
    IOC,
    MARKET,
    LIMIT,
    STOP
}
