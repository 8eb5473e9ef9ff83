package com.bondtrader.exception;

/**
 * Raised by operations that are part of a stage contract but have no defined behavior yet.
 */
public class UnsupportedCapabilityException extends BaseException {

    public UnsupportedCapabilityException(String capability) {
        super(ErrorCode.UNSUPPORTED_OPERATION, capability + " is not supported");
    }
}
