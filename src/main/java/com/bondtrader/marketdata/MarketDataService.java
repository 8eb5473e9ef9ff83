package com.bondtrader.marketdata;

import com.bondtrader.domain.enums.PricingSide;
import com.bondtrader.domain.model.BidOffer;
import com.bondtrader.domain.model.OrderBook;
import com.bondtrader.domain.model.OrderBookLevel;
import com.bondtrader.event.KeyedService;
import com.bondtrader.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Latest order book per instrument.
 *
 * <p>Besides storing and forwarding books it answers two read-only questions about the
 * stored state: the top of book, and the depth with levels at the same price merged.
 */
public class MarketDataService extends KeyedService<String, OrderBook> {

    @Override
    public String getName() {
        return "MarketDataService";
    }

    public void onMessage(OrderBook orderBook) {
        put(orderBook.getInstrument().getInstrumentId(), orderBook);
        notifyListeners(orderBook);
    }

    /**
     * Best bid and best offer of the latest book.
     *
     * @throws ResourceNotFoundException if no book has been received for the instrument,
     *     or the latest book is missing one side
     */
    public BidOffer getBestBidOffer(String instrumentId) {
        OrderBook book = getData(instrumentId);
        if (!book.isTwoSided()) {
            throw new ResourceNotFoundException("Two-sided market", instrumentId);
        }
        return new BidOffer(book.getBidStack().get(0), book.getOfferStack().get(0));
    }

    /**
     * Latest book with quantities at identical prices summed. Bids are returned highest
     * price first, offers lowest price first.
     */
    public OrderBook aggregateDepth(String instrumentId) {
        OrderBook book = getData(instrumentId);
        return OrderBook.builder()
                .instrument(book.getInstrument())
                .bidStack(merge(book.getBidStack(), PricingSide.BID, Comparator.reverseOrder()))
                .offerStack(merge(book.getOfferStack(), PricingSide.OFFER, Comparator.naturalOrder()))
                .build();
    }

    private static List<OrderBookLevel> merge(
            List<OrderBookLevel> levels, PricingSide side, Comparator<BigDecimal> priceOrder) {
        // keyed on compareTo so 99.5 and 99.50 land on one level
        Map<BigDecimal, Long> quantityByPrice = new TreeMap<>(priceOrder);
        for (OrderBookLevel level : levels) {
            quantityByPrice.merge(level.getPrice(), level.getQuantity(), Long::sum);
        }
        List<OrderBookLevel> merged = new ArrayList<>(quantityByPrice.size());
        quantityByPrice.forEach((price, quantity) -> merged.add(OrderBookLevel.builder()
                .price(price)
                .quantity(quantity)
                .side(side)
                .build()));
        return merged;
    }
}
