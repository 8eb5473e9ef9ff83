package com.bondtrader.connector;

import com.bondtrader.domain.TradingBooks;
import com.bondtrader.domain.model.ExecutionOrder;
import com.bondtrader.domain.model.Inquiry;
import com.bondtrader.domain.model.Position;
import com.bondtrader.domain.model.Price;
import com.bondtrader.domain.model.PriceStream;
import com.bondtrader.domain.model.Pv01;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Field layouts of the output records. The timestamp column is added by
 * {@link FileRecordConnector}; these return the remaining fields in order.
 */
public final class RecordFormats {

    static final String ORDER_ID_PREFIX = "TID_";
    static final String NOT_PRICED = "-1";

    private RecordFormats() {}

    /** instrument, TRSY1, TRSY2, TRSY3, aggregate */
    public static List<String> position(Position position) {
        List<String> fields = new ArrayList<>();
        fields.add(position.getInstrument().getInstrumentId());
        for (String book : TradingBooks.ALL) {
            fields.add(String.valueOf(position.getPosition(book)));
        }
        fields.add(String.valueOf(position.getAggregatePosition()));
        return fields;
    }

    /** instrument, total risk */
    public static List<String> risk(Pv01 risk) {
        return List.of(risk.getInstrument().getInstrumentId(), plain(risk.getTotalRisk()));
    }

    /** instrument, mid, spread */
    public static List<String> gui(Price price) {
        return List.of(price.getInstrument().getInstrumentId(), plain(price.getMid()), plain(price.getBidOfferSpread()));
    }

    /** instrument, bid price, offer price */
    public static List<String> stream(PriceStream stream) {
        return List.of(
                stream.getInstrument().getInstrumentId(),
                plain(stream.getBidOrder().getPrice()),
                plain(stream.getOfferOrder().getPrice()));
    }

    /** instrument, order id, order type, side, price, visible, hidden */
    public static List<String> execution(ExecutionOrder order) {
        return List.of(
                order.getInstrument().getInstrumentId(),
                ORDER_ID_PREFIX + order.getOrderId(),
                "MarketOrder",
                order.getPricingSide().toTradeSide().name(),
                plain(order.getPrice()),
                String.valueOf(order.getVisibleQuantity()),
                String.valueOf(order.getHiddenQuantity()));
    }

    /** inquiry id, instrument, side, price (-1 if not quoted), state */
    public static List<String> inquiry(Inquiry inquiry) {
        return List.of(
                ORDER_ID_PREFIX + inquiry.getInquiryId(),
                inquiry.getInstrument().getInstrumentId(),
                inquiry.getSide().name(),
                inquiry.isPriced() ? plain(inquiry.getPrice()) : NOT_PRICED,
                inquiry.getState().name());
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
