package com.bondtrader.pricing;

import com.bondtrader.connector.RecordConnector;
import com.bondtrader.domain.model.Price;
import com.bondtrader.event.KeyedService;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Throttles quotes on their way to the GUI sink.
 *
 * <p>A quote is delivered only if more than {@code throttleMillis} have passed since the
 * last delivered quote; otherwise it is dropped. The timestamp is shared by all
 * instruments, so a burst on one bond also holds back the others. The first quote the
 * stage sees is always delivered.
 */
public class GuiService extends KeyedService<String, Price> {

    private static final Logger log = LoggerFactory.getLogger(GuiService.class);

    private final RecordConnector<Price> guiConnector;
    private final Clock clock;
    private final long throttleMillis;

    private long lastDeliveryMillis;
    private boolean delivered;
    private long deliveredCount;
    private long throttledCount;

    public GuiService(RecordConnector<Price> guiConnector, Clock clock, long throttleMillis) {
        this.guiConnector = guiConnector;
        this.clock = clock;
        this.throttleMillis = throttleMillis;
    }

    @Override
    public String getName() {
        return "GuiService";
    }

    /**
     * @return true if the quote was forwarded to the sink, false if it was throttled
     */
    public boolean provideData(Price price) {
        long now = clock.millis();
        if (delivered && now - lastDeliveryMillis <= throttleMillis) {
            throttledCount++;
            log.trace("Throttled quote for {} ({} ms since last)", price.getInstrument().getInstrumentId(),
                    now - lastDeliveryMillis);
            return false;
        }

        delivered = true;
        lastDeliveryMillis = now;
        deliveredCount++;
        put(price.getInstrument().getInstrumentId(), price);
        guiConnector.publish(price);
        notifyListeners(price);
        return true;
    }

    public long getDeliveredCount() {
        return deliveredCount;
    }

    public long getThrottledCount() {
        return throttledCount;
    }
}
