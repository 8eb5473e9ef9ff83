package com.bondtrader.booking;

import com.bondtrader.domain.TradingBooks;
import com.bondtrader.domain.model.ExecutionOrder;
import com.bondtrader.domain.model.Trade;
import com.bondtrader.event.KeyedService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Books trades, keyed by trade id, and forwards them to the position stage.
 *
 * <p>Trades come from the trade file via {@link #bookTrade} or from the execution stage
 * via {@link #bookExecution}. Executions are booked round-robin across the trading
 * books: TRSY1, TRSY2, TRSY3, TRSY1, ...
 */
public class TradeBookingService extends KeyedService<String, Trade> {

    private static final Logger log = LoggerFactory.getLogger(TradeBookingService.class);

    static final String EXECUTION_TRADE_PREFIX = "EXEC-";

    private final String name;
    private final List<String> books;
    private int nextBookIndex;

    public TradeBookingService(String name) {
        this(name, TradingBooks.ALL);
    }

    public TradeBookingService(String name, List<String> books) {
        this.name = name;
        this.books = List.copyOf(books);
    }

    @Override
    public String getName() {
        return name;
    }

    public void bookTrade(Trade trade) {
        if (contains(trade.getTradeId())) {
            log.warn("{}: trade id {} booked again, replacing previous booking", name, trade.getTradeId());
        }
        put(trade.getTradeId(), trade);
        notifyListeners(trade);
    }

    /**
     * Books a filled execution: BID executions buy, OFFER executions sell, and the
     * booked quantity is visible plus hidden size.
     */
    public void bookExecution(ExecutionOrder order) {
        String book = books.get(nextBookIndex);
        nextBookIndex = (nextBookIndex + 1) % books.size();

        Trade trade = Trade.builder()
                .instrument(order.getInstrument())
                .tradeId(EXECUTION_TRADE_PREFIX + order.getOrderId())
                .price(order.getPrice())
                .book(book)
                .quantity(order.getTotalQuantity())
                .side(order.getPricingSide().toTradeSide())
                .build();
        bookTrade(trade);
    }
}
