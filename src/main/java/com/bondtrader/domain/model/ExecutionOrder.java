package com.bondtrader.domain.model;

import com.bondtrader.domain.enums.OrderType;
import com.bondtrader.domain.enums.PricingSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * An order sent to a market by the algo execution stage.
 */
@Value
@Builder
public class ExecutionOrder {

    Instrument instrument;
    PricingSide pricingSide;
    String orderId;
    OrderType orderType;
    BigDecimal price;
    long visibleQuantity;
    long hiddenQuantity;
    String parentOrderId;
    boolean childOrder;

    public long getTotalQuantity() {
        return visibleQuantity + hiddenQuantity;
    }
}
