package com.bondtrader.connector;

import com.bondtrader.domain.InstrumentCatalog;
import com.bondtrader.domain.enums.InquiryState;
import com.bondtrader.domain.enums.PricingSide;
import com.bondtrader.domain.enums.Side;
import com.bondtrader.domain.model.Instrument;
import com.bondtrader.domain.model.Inquiry;
import com.bondtrader.domain.model.OrderBook;
import com.bondtrader.domain.model.OrderBookLevel;
import com.bondtrader.domain.model.Price;
import com.bondtrader.domain.model.Trade;
import com.bondtrader.exception.MalformedInputException;
import com.bondtrader.exception.UnknownInstrumentException;
import com.bondtrader.pricing.FractionalPriceCodec;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the comma-separated input records into domain objects.
 *
 * <p>Record layouts:
 * <ul>
 *   <li>trade: {@code instrument,tradeId,book,quantity,price,side}</li>
 *   <li>price: {@code instrument,bid,offer}</li>
 *   <li>market data: {@code instrument,bid1,offer1,...,bid5,offer5}</li>
 *   <li>inquiry: {@code inquiryId,instrument,side[,state]}; the state column is ignored</li>
 * </ul>
 * Prices are in fractional notation (see {@link FractionalPriceCodec}). Extra trailing
 * columns are ignored. Book names are not validated here; that is the position stage's
 * job.
 */
public class RecordParser {

    static final int ORDER_BOOK_LEVELS = 5;
    static final long LEVEL_SIZE_STEP = 1_000_000L;

    private final InstrumentCatalog catalog;
    private final long defaultInquiryQuantity;

    public RecordParser(InstrumentCatalog catalog, long defaultInquiryQuantity) {
        this.catalog = catalog;
        this.defaultInquiryQuantity = defaultInquiryQuantity;
    }

    /**
     * @throws MalformedInputException for a short record, bad number, price or side
     * @throws UnknownInstrumentException if the instrument id is not in the catalog
     */
    public Trade parseTrade(String line) {
        String[] tokens = split(line, 6, "trade");
        long quantity = parsePositiveLong(tokens[3], "trade quantity");
        return Trade.builder()
                .instrument(instrument(tokens[0]))
                .tradeId(requireText(tokens[1], "trade id"))
                .book(requireText(tokens[2], "book"))
                .quantity(quantity)
                .price(FractionalPriceCodec.decode(tokens[4]))
                .side(parseSide(tokens[5]))
                .build();
    }

    public Price parsePrice(String line) {
        String[] tokens = split(line, 3, "price");
        Instrument instrument = instrument(tokens[0]);
        BigDecimal bid = FractionalPriceCodec.decode(tokens[1]);
        BigDecimal offer = FractionalPriceCodec.decode(tokens[2]);
        return Price.fromBidOffer(instrument, bid, offer);
    }

    /** Level i (0-based) gets size 1,000,000 x (i + 1) on both sides. */
    public OrderBook parseOrderBook(String line) {
        String[] tokens = split(line, 1 + 2 * ORDER_BOOK_LEVELS, "order book");
        Instrument instrument = instrument(tokens[0]);

        List<OrderBookLevel> bids = new ArrayList<>(ORDER_BOOK_LEVELS);
        List<OrderBookLevel> offers = new ArrayList<>(ORDER_BOOK_LEVELS);
        for (int level = 0; level < ORDER_BOOK_LEVELS; level++) {
            long size = LEVEL_SIZE_STEP * (level + 1);
            bids.add(level(tokens[1 + 2 * level], size, PricingSide.BID));
            offers.add(level(tokens[2 + 2 * level], size, PricingSide.OFFER));
        }
        return new OrderBook(instrument, bids, offers);
    }

    public Inquiry parseInquiry(String line) {
        String[] tokens = split(line, 3, "inquiry");
        return Inquiry.builder()
                .inquiryId(requireText(tokens[0], "inquiry id"))
                .instrument(instrument(tokens[1]))
                .side(parseSide(tokens[2]))
                .quantity(defaultInquiryQuantity)
                .state(InquiryState.RECEIVED)
                .build();
    }

    private Instrument instrument(String instrumentId) {
        return catalog.require(instrumentId);
    }

    private static OrderBookLevel level(String priceText, long size, PricingSide side) {
        return OrderBookLevel.builder()
                .price(FractionalPriceCodec.decode(priceText))
                .quantity(size)
                .side(side)
                .build();
    }

    private static String[] split(String line, int minTokens, String recordType) {
        if (line == null) {
            throw new MalformedInputException("Empty " + recordType + " record");
        }
        String[] tokens = line.split(",", -1);
        if (tokens.length < minTokens) {
            throw new MalformedInputException(
                    String.format("Expected %d fields in %s record, got %d", minTokens, recordType, tokens.length), line);
        }
        for (int i = 0; i < tokens.length; i++) {
            tokens[i] = tokens[i].trim();
        }
        return tokens;
    }

    private static Side parseSide(String text) {
        try {
            return Side.valueOf(text);
        } catch (IllegalArgumentException e) {
            throw new MalformedInputException("Unknown side", text);
        }
    }

    private static long parsePositiveLong(String text, String field) {
        long value;
        try {
            value = Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new MalformedInputException("Invalid " + field, text);
        }
        if (value <= 0) {
            throw new MalformedInputException(field + " must be positive", text);
        }
        return value;
    }

    private static String requireText(String text, String field) {
        if (text.isEmpty()) {
            throw new MalformedInputException("Missing " + field);
        }
        return text;
    }
}
