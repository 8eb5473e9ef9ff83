package com.bondtrader.unit.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bondtrader.domain.BondCatalog;
import com.bondtrader.domain.enums.Market;
import com.bondtrader.domain.enums.OrderType;
import com.bondtrader.domain.enums.PricingSide;
import com.bondtrader.domain.model.ExecutionOrder;
import com.bondtrader.exception.ResourceNotFoundException;
import com.bondtrader.execution.ExecutionService;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExecutionServiceTest {

    private final ExecutionService executionService = new ExecutionService(Market.CME);

    private static ExecutionOrder order(String orderId) {
        return ExecutionOrder.builder()
                .instrument(BondCatalog.standard().require("B03y"))
                .pricingSide(PricingSide.BID)
                .orderId(orderId)
                .orderType(OrderType.MARKET)
                .price(new BigDecimal("99.5"))
                .visibleQuantity(1_000_000)
                .hiddenQuantity(900_000)
                .parentOrderId(orderId)
                .build();
    }

    @Test
    @DisplayName("Orders go to the default market unless one is given")
    void routesToMarket() {
        executionService.executeOrder(order("1"));
        executionService.executeOrder(order("2"), Market.BROKERTEC);

        assertThat(executionService.getMarket("1")).isEqualTo(Market.CME);
        assertThat(executionService.getMarket("2")).isEqualTo(Market.BROKERTEC);
    }

    @Test
    @DisplayName("Every executed order is stored by id and published")
    void publishesOrders() {
        List<ExecutionOrder> published = new ArrayList<>();
        executionService.addListener(published::add);

        executionService.executeOrder(order("7"));

        assertThat(published).extracting(ExecutionOrder::getOrderId).containsExactly("7");
        assertThat(executionService.getData("7").getHiddenQuantity()).isEqualTo(900_000);
    }

    @Test
    @DisplayName("Market lookup for an unknown order raises ResourceNotFoundException")
    void unknownOrder() {
        assertThatThrownBy(() -> executionService.getMarket("404")).isInstanceOf(ResourceNotFoundException.class);
    }
}
