package com.bondtrader.domain;

import com.bondtrader.domain.model.Bond;
import com.bondtrader.domain.model.Instrument;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The seven on-the-run treasury bonds traded by the desk.
 *
 * <p>Instances are immutable; {@link #standard()} returns the shared catalog.
 */
public final class BondCatalog implements InstrumentCatalog {

    private static final BondCatalog STANDARD = new BondCatalog(List.of(
            bond("B02y", "0.02", LocalDate.of(2026, 12, 31)),
            bond("B03y", "0.025", LocalDate.of(2027, 12, 31)),
            bond("B05y", "0.03", LocalDate.of(2029, 12, 31)),
            bond("B07y", "0.035", LocalDate.of(2031, 12, 31)),
            bond("B10y", "0.04", LocalDate.of(2034, 12, 31)),
            bond("B20y", "0.045", LocalDate.of(2044, 12, 31)),
            bond("B30y", "0.05", LocalDate.of(2054, 12, 31))));

    private final Map<String, Instrument> byId;

    public BondCatalog(List<Bond> bonds) {
        Map<String, Instrument> index = new LinkedHashMap<>();
        for (Bond bond : bonds) {
            index.put(bond.getInstrumentId(), bond);
        }
        this.byId = Collections.unmodifiableMap(index);
    }

    public static BondCatalog standard() {
        return STANDARD;
    }

    @Override
    public List<Instrument> getInstruments() {
        return List.copyOf(byId.values());
    }

    @Override
    public Optional<Instrument> find(String instrumentId) {
        return Optional.ofNullable(instrumentId).map(byId::get);
    }

    private static Bond bond(String ticker, String coupon, LocalDate maturity) {
        return Bond.builder()
                .ticker(ticker)
                .coupon(new BigDecimal(coupon))
                .maturity(maturity)
                .build();
    }
}
