package com.bondtrader.exception;

import java.util.Map;

public class InvalidStateTransitionException extends BaseException {

    public InvalidStateTransitionException(String entityId, Enum<?> from, Enum<?> to) {
        super(
                ErrorCode.INVALID_STATE_TRANSITION,
                String.format("Illegal transition %s -> %s for %s", from, to, entityId),
                Map.of("id", String.valueOf(entityId), "from", String.valueOf(from), "to", String.valueOf(to)));
    }
}
