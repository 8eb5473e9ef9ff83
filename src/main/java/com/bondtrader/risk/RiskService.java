package com.bondtrader.risk;

import com.bondtrader.domain.model.BucketedSector;
import com.bondtrader.domain.model.Position;
import com.bondtrader.domain.model.Pv01;
import com.bondtrader.event.KeyedService;
import com.bondtrader.exception.UnsupportedCapabilityException;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives PV01 risk from aggregate positions.
 *
 * <p>The per-unit PV01 is a single policy value applied to every instrument; it is not
 * derived from coupon or maturity. A new {@link Pv01} is built and published for every
 * position change and replaces the previous one for that instrument.
 */
public class RiskService extends KeyedService<String, Pv01> {

    private static final Logger log = LoggerFactory.getLogger(RiskService.class);

    private final String name;
    private final BigDecimal pv01PerUnit;

    public RiskService(String name, BigDecimal pv01PerUnit) {
        this.name = name;
        this.pv01PerUnit = pv01PerUnit;
    }

    @Override
    public String getName() {
        return name;
    }

    public void addPosition(Position position) {
        Pv01 risk = Pv01.builder()
                .instrument(position.getInstrument())
                .pv01(pv01PerUnit)
                .quantity(position.getAggregatePosition())
                .build();
        put(risk.getInstrument().getInstrumentId(), risk);
        log.debug("{}: {} total risk {}", name, risk.getInstrument().getInstrumentId(), risk.getTotalRisk());
        notifyListeners(risk);
    }

    /**
     * Risk aggregated over a bucketed sector.
     *
     * <p>No aggregation rule has been agreed for sectors (plain sum versus weighted), so
     * this always fails rather than guess.
     *
     * @throws UnsupportedCapabilityException always
     */
    public Pv01 getBucketedRisk(BucketedSector sector) {
        throw new UnsupportedCapabilityException("Bucketed risk for sector " + sector.getName());
    }
}
