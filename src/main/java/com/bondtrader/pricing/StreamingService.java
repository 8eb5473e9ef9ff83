package com.bondtrader.pricing;

import com.bondtrader.domain.model.PriceStream;
import com.bondtrader.event.KeyedService;

/** Publishes algo-built price streams onward; keeps the latest stream per instrument. */
public class StreamingService extends KeyedService<String, PriceStream> {

    @Override
    public String getName() {
        return "StreamingService";
    }

    public void publishPrice(PriceStream stream) {
        put(stream.getInstrument().getInstrumentId(), stream);
        notifyListeners(stream);
    }
}
