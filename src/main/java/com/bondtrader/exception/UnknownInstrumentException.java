package com.bondtrader.exception;

import java.util.Map;

/** Raised when an event references an instrument outside the static catalog. */
public class UnknownInstrumentException extends BaseException {

    public UnknownInstrumentException(String instrumentId) {
        super(
                ErrorCode.UNKNOWN_INSTRUMENT,
                "Unknown instrument: " + instrumentId,
                Map.of("instrumentId", String.valueOf(instrumentId)));
    }
}
