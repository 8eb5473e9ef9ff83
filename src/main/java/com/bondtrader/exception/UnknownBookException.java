package com.bondtrader.exception;

import java.util.Map;

/** Raised when a trade names a book outside the fixed trading books. */
public class UnknownBookException extends BaseException {

    public UnknownBookException(String book, String instrumentId) {
        super(
                ErrorCode.UNKNOWN_BOOK,
                String.format("Unknown book %s for instrument %s", book, instrumentId),
                Map.of("book", String.valueOf(book), "instrumentId", String.valueOf(instrumentId)));
    }
}
