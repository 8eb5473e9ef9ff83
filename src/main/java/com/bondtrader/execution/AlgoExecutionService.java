package com.bondtrader.execution;

import com.bondtrader.config.PipelineProperties.SideAlternation;
import com.bondtrader.domain.enums.OrderType;
import com.bondtrader.domain.enums.PricingSide;
import com.bondtrader.domain.model.ExecutionOrder;
import com.bondtrader.domain.model.OrderBook;
import com.bondtrader.domain.model.OrderBookLevel;
import com.bondtrader.event.KeyedService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides, per order book update, whether to cross the spread.
 *
 * <p>Decision logic:
 * <ul>
 *   <li>spread = best offer - best bid; nothing happens unless spread &lt;= tolerance</li>
 *   <li>each qualifying book increments a counter: odd counts aggress on the OFFER, even
 *       counts on the BID</li>
 *   <li>on the BID the order takes the best bid price and the best offer's quantity; on
 *       the OFFER the best offer price and the best bid's quantity</li>
 *   <li>hidden quantity = floor(quantity x hidden ratio); always a MARKET order</li>
 * </ul>
 *
 * <p>The counter belongs to this instance. With {@link SideAlternation#PER_INSTRUMENT}
 * each instrument alternates on its own. Order ids come from a separate stage-wide
 * sequence either way, so they stay unique.
 */
public class AlgoExecutionService extends KeyedService<String, ExecutionOrder> {

    private static final Logger log = LoggerFactory.getLogger(AlgoExecutionService.class);

    private final BigDecimal spreadTolerance;
    private final BigDecimal hiddenRatio;
    private final SideAlternation sideAlternation;

    private final Map<String, Long> sideCounters = new HashMap<>();
    private long stageCounter;
    private long orderSequence;

    public AlgoExecutionService(BigDecimal spreadTolerance, BigDecimal hiddenRatio, SideAlternation sideAlternation) {
        this.spreadTolerance = spreadTolerance;
        this.hiddenRatio = hiddenRatio;
        this.sideAlternation = sideAlternation;
    }

    @Override
    public String getName() {
        return "AlgoExecutionService";
    }

    /**
     * Evaluates one book and, if the spread is tight enough, publishes a MARKET order.
     *
     * @return true if an execution was generated
     */
    public boolean execute(OrderBook orderBook) {
        String instrumentId = orderBook.getInstrument().getInstrumentId();
        if (!orderBook.isTwoSided()) {
            log.warn("Order book for {} has an empty side, skipping", instrumentId);
            return false;
        }

        OrderBookLevel bestBid = orderBook.getBidStack().get(0);
        OrderBookLevel bestOffer = orderBook.getOfferStack().get(0);
        BigDecimal spread = bestOffer.getPrice().subtract(bestBid.getPrice());
        if (spread.compareTo(spreadTolerance) > 0) {
            log.trace("{}: spread {} wider than {}, not crossing", instrumentId, spread, spreadTolerance);
            return false;
        }

        long count = nextSideCount(instrumentId);
        PricingSide side = count % 2 == 0 ? PricingSide.BID : PricingSide.OFFER;
        String orderId = String.valueOf(++orderSequence);

        BigDecimal price;
        long quantity;
        if (side == PricingSide.BID) {
            price = bestBid.getPrice();
            quantity = bestOffer.getQuantity();
        } else {
            price = bestOffer.getPrice();
            quantity = bestBid.getQuantity();
        }

        ExecutionOrder order = ExecutionOrder.builder()
                .instrument(orderBook.getInstrument())
                .pricingSide(side)
                .orderId(orderId)
                .orderType(OrderType.MARKET)
                .price(price)
                .visibleQuantity(quantity)
                .hiddenQuantity(hiddenQuantity(quantity))
                .parentOrderId(orderId)
                .childOrder(false)
                .build();

        put(instrumentId, order);
        log.debug("{}: crossing spread {} on {} at {} for {}", instrumentId, spread, side, price, quantity);
        notifyListeners(order);
        return true;
    }

    /** Executions generated so far by this stage. */
    public long getExecutionCount() {
        return orderSequence;
    }

    private long nextSideCount(String instrumentId) {
        if (sideAlternation == SideAlternation.PER_INSTRUMENT) {
            return sideCounters.merge(instrumentId, 1L, Long::sum);
        }
        return ++stageCounter;
    }

    private long hiddenQuantity(long quantity) {
        return BigDecimal.valueOf(quantity)
                .multiply(hiddenRatio)
                .setScale(0, RoundingMode.FLOOR)
                .longValueExact();
    }
}
