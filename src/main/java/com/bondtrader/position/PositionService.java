package com.bondtrader.position;

import com.bondtrader.config.PipelineProperties.UnknownBookPolicy;
import com.bondtrader.domain.InstrumentCatalog;
import com.bondtrader.domain.model.Instrument;
import com.bondtrader.domain.model.Position;
import com.bondtrader.domain.model.Trade;
import com.bondtrader.event.KeyedService;
import com.bondtrader.exception.UnknownBookException;
import com.bondtrader.exception.UnknownInstrumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one {@link Position} per catalog instrument and applies booked trades to it.
 *
 * <p>Positions are created up front for every instrument in the catalog, with every
 * trading book at zero, so a trade for an instrument outside the catalog is an error
 * rather than an implicit new position. Listeners receive a snapshot of the updated
 * position, never the instance this stage mutates.
 */
public class PositionService extends KeyedService<String, Position> {

    private static final Logger log = LoggerFactory.getLogger(PositionService.class);

    private final String name;
    private final UnknownBookPolicy unknownBookPolicy;

    public PositionService(String name, InstrumentCatalog catalog, UnknownBookPolicy unknownBookPolicy) {
        this.name = name;
        this.unknownBookPolicy = unknownBookPolicy;
        for (Instrument instrument : catalog.getInstruments()) {
            put(instrument.getInstrumentId(), new Position(instrument));
        }
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Adds the trade's quantity to its book (BUY) or subtracts it (SELL), then notifies
     * listeners with the updated position.
     *
     * @throws UnknownInstrumentException if the trade's instrument has no position
     * @throws UnknownBookException if the book is unknown and the policy is REJECT
     */
    public void addTrade(Trade trade) {
        String instrumentId = trade.getInstrument().getInstrumentId();
        Position position = findData(instrumentId).orElseThrow(() -> new UnknownInstrumentException(instrumentId));

        if (!position.hasBook(trade.getBook())) {
            if (unknownBookPolicy == UnknownBookPolicy.SKIP) {
                log.warn(
                        "{}: dropping trade {} for {}, unknown book {}",
                        name,
                        trade.getTradeId(),
                        instrumentId,
                        trade.getBook());
                return;
            }
            throw new UnknownBookException(trade.getBook(), instrumentId);
        }

        position.update(trade.getBook(), trade.getQuantity(), trade.getSide());
        log.debug(
                "{}: {} {} {} on {} -> aggregate {}",
                name,
                trade.getSide(),
                trade.getQuantity(),
                instrumentId,
                trade.getBook(),
                position.getAggregatePosition());

        notifyListeners(position.snapshot());
    }

    /** Sum over all books of the instrument's position. */
    public long getAggregatePosition(String instrumentId) {
        return getData(instrumentId).getAggregatePosition();
    }
}
