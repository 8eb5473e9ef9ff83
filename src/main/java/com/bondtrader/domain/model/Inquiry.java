package com.bondtrader.domain.model;

import com.bondtrader.domain.enums.InquiryState;
import com.bondtrader.domain.enums.Side;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * A client request for a quote on a bond.
 *
 * <p>Mutable: the inquiry stage moves it through {@link InquiryState} and sets the price
 * when quoting. A null price means not yet quoted. Stages hand out copies via
 * {@link #copy()} so listeners never share the stage's instance.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
public class Inquiry {

    private String inquiryId;
    private Instrument instrument;
    private Side side;
    private long quantity;
    private BigDecimal price;
    private InquiryState state;

    public Inquiry copy() {
        return toBuilder().build();
    }

    public boolean isPriced() {
        return price != null;
    }
}
