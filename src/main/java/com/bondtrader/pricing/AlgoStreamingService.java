package com.bondtrader.pricing;

import com.bondtrader.domain.enums.PricingSide;
import com.bondtrader.domain.model.Price;
import com.bondtrader.domain.model.PriceStream;
import com.bondtrader.domain.model.PriceStreamOrder;
import com.bondtrader.event.KeyedService;
import java.math.BigDecimal;

/**
 * Turns mid/spread prices into two-sided streams.
 *
 * <p>Bid = mid - spread/2, offer = mid + spread/2. Both legs carry the same configured
 * visible and hidden size. Every price produces a stream; there is no throttling here.
 */
public class AlgoStreamingService extends KeyedService<String, PriceStream> {

    private final long visibleQuantity;
    private final long hiddenQuantity;

    public AlgoStreamingService(long visibleQuantity, long hiddenQuantity) {
        this.visibleQuantity = visibleQuantity;
        this.hiddenQuantity = hiddenQuantity;
    }

    @Override
    public String getName() {
        return "AlgoStreamingService";
    }

    public void publishPrice(Price price) {
        PriceStream stream = PriceStream.builder()
                .instrument(price.getInstrument())
                .bidOrder(leg(price.getBid(), PricingSide.BID))
                .offerOrder(leg(price.getOffer(), PricingSide.OFFER))
                .build();
        put(price.getInstrument().getInstrumentId(), stream);
        notifyListeners(stream);
    }

    private PriceStreamOrder leg(BigDecimal legPrice, PricingSide side) {
        return PriceStreamOrder.builder()
                .price(legPrice)
                .visibleQuantity(visibleQuantity)
                .hiddenQuantity(hiddenQuantity)
                .side(side)
                .build();
    }
}
