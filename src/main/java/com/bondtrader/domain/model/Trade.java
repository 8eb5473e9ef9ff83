package com.bondtrader.domain.model;

import com.bondtrader.domain.enums.Side;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A booked trade against one of the trading books.
 *
 * <p>Trades arrive either from the trade file (price decoded from fractional notation)
 * or from the execution stage when an algo execution is booked back.
 */
@Value
@Builder
public class Trade {

    Instrument instrument;
    String tradeId;
    BigDecimal price;
    String book;

    /** Always positive; direction comes from {@link #side}. */
    long quantity;

    Side side;
}
