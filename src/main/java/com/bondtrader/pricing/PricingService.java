package com.bondtrader.pricing;

import com.bondtrader.domain.model.Price;
import com.bondtrader.event.KeyedService;

/** Latest mid/spread per instrument, fanned out to the GUI and algo streaming stages. */
public class PricingService extends KeyedService<String, Price> {

    @Override
    public String getName() {
        return "PricingService";
    }

    public void onMessage(Price price) {
        put(price.getInstrument().getInstrumentId(), price);
        notifyListeners(price);
    }
}
