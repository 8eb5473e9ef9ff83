package com.bondtrader.domain.enums;

/** Execution venues. */
public enum Market {
    BROKERTEC,
    ESPEED,
    CME
}
