package com.bondtrader.exception;

import java.util.Map;

/** Raised for inbound text (prices, records) that does not match its expected grammar. */
public class MalformedInputException extends BaseException {

    public MalformedInputException(String message) {
        super(ErrorCode.MALFORMED_INPUT, message);
    }

    public MalformedInputException(String message, String input) {
        super(ErrorCode.MALFORMED_INPUT, message + ": '" + input + "'", Map.of("input", String.valueOf(input)));
    }
}
