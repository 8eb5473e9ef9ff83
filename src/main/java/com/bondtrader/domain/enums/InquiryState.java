package com.bondtrader.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a client inquiry.
 *
 * <pre>
 *   RECEIVED --> QUOTED --> DONE
 *       |           |
 *       v           v
 *   REJECTED   CUSTOMER_REJECTED
 * </pre>
 */
public enum InquiryState {
    RECEIVED,
    QUOTED,
    DONE,
    REJECTED,
    CUSTOMER_REJECTED;

    public boolean isTerminal() {
        return this == DONE || this == REJECTED || this == CUSTOMER_REJECTED;
    }

    public Set<InquiryState> allowedNext() {
        switch (this) {
            case RECEIVED:
                return EnumSet.of(QUOTED, REJECTED);
            case QUOTED:
                return EnumSet.of(DONE, CUSTOMER_REJECTED);
            default:
                return EnumSet.noneOf(InquiryState.class);
        }
    }

    public boolean canTransitionTo(InquiryState next) {
        return allowedNext().contains(next);
    }
}
