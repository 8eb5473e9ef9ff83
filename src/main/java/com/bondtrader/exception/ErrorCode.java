package com.bondtrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure categories raised by the pipeline stages and the connectors that feed them.
 *
 * <p>{@link #isBoundary()} marks codes that describe a bad inbound record rather than a
 * broken cascade. Connectors report both kinds and move on to the next record.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    NOT_FOUND("NOT_FOUND", false),
    UNKNOWN_INSTRUMENT("UNKNOWN_INSTRUMENT", true),
    UNKNOWN_BOOK("UNKNOWN_BOOK", true),
    MALFORMED_INPUT("MALFORMED_INPUT", true),
    UNSUPPORTED_OPERATION("UNSUPPORTED_OPERATION", false),
    INVALID_STATE_TRANSITION("INVALID_STATE_TRANSITION", false),
    SINK_ERROR("SINK_ERROR", false);

    private final String code;
    private final boolean boundary;
}
