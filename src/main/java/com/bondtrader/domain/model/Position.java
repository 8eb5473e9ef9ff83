package com.bondtrader.domain.model;

import com.bondtrader.domain.TradingBooks;
import com.bondtrader.domain.enums.Side;
import com.bondtrader.exception.UnknownBookException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Signed quantity per trading book for one instrument.
 *
 * <p>The book keys are fixed at construction: every book in {@link TradingBooks#ALL} starts
 * at zero and no update adds or removes a book. Quantity is signed: positive = long,
 * negative = short. The aggregate is summed on demand and never cached.
 */
public class Position {

    @Getter
    private final Instrument instrument;

    private final Map<String, Long> quantitiesByBook;

    public Position(Instrument instrument) {
        this(instrument, TradingBooks.ALL);
    }

    public Position(Instrument instrument, List<String> books) {
        this.instrument = instrument;
        this.quantitiesByBook = new LinkedHashMap<>();
        for (String book : books) {
            quantitiesByBook.put(book, 0L);
        }
    }

    private Position(Position source) {
        this.instrument = source.instrument;
        this.quantitiesByBook = new LinkedHashMap<>(source.quantitiesByBook);
    }

    public long getPosition(String book) {
        Long quantity = quantitiesByBook.get(book);
        if (quantity == null) {
            throw new UnknownBookException(book, instrument.getInstrumentId());
        }
        return quantity;
    }

    public long getAggregatePosition() {
        long aggregate = 0;
        for (long quantity : quantitiesByBook.values()) {
            aggregate += quantity;
        }
        return aggregate;
    }

    public boolean hasBook(String book) {
        return quantitiesByBook.containsKey(book);
    }

    /** Books in construction order, read-only. */
    public Map<String, Long> getQuantitiesByBook() {
        return Collections.unmodifiableMap(quantitiesByBook);
    }

    /**
     * Adds (BUY) or subtracts (SELL) {@code quantity} on {@code book}.
     *
     * @throws UnknownBookException if the book was not present at construction
     */
    public void update(String book, long quantity, Side side) {
        long current = getPosition(book);
        quantitiesByBook.put(book, current + side.signum() * quantity);
    }

    /** Independent copy, safe to hand to listeners. */
    public Position snapshot() {
        return new Position(this);
    }

    @Override
    public String toString() {
        return "Position{" + instrument.getInstrumentId() + ", " + quantitiesByBook + "}";
    }
}
