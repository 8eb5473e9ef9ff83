package com.bondtrader.exception;

public class RecordSinkException extends BaseException {

    public RecordSinkException(String message, Throwable cause) {
        super(ErrorCode.SINK_ERROR, message, cause);
    }
}
