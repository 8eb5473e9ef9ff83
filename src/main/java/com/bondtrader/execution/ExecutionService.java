package com.bondtrader.execution;

import com.bondtrader.domain.enums.Market;
import com.bondtrader.domain.model.ExecutionOrder;
import com.bondtrader.event.KeyedService;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends execution orders to a market and tells listeners (history, trade booking) about
 * them. Orders are kept by order id together with the market they went to.
 */
public class ExecutionService extends KeyedService<String, ExecutionOrder> {

    private static final Logger log = LoggerFactory.getLogger(ExecutionService.class);

    private final Market defaultMarket;
    private final Map<String, Market> marketsByOrderId = new HashMap<>();

    public ExecutionService(Market defaultMarket) {
        this.defaultMarket = defaultMarket;
    }

    @Override
    public String getName() {
        return "ExecutionService";
    }

    public void executeOrder(ExecutionOrder order, Market market) {
        put(order.getOrderId(), order);
        marketsByOrderId.put(order.getOrderId(), market);
        log.debug("Executing order {} on {}: {} {} @ {}", order.getOrderId(), market, order.getPricingSide(),
                order.getVisibleQuantity(), order.getPrice());
        notifyListeners(order);
    }

    /** Routes to the default market. */
    public void executeOrder(ExecutionOrder order) {
        executeOrder(order, defaultMarket);
    }

    public Market getMarket(String orderId) {
        getData(orderId);
        return marketsByOrderId.get(orderId);
    }
}
