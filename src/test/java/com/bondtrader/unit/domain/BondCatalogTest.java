package com.bondtrader.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bondtrader.domain.BondCatalog;
import com.bondtrader.domain.model.Instrument;
import com.bondtrader.exception.UnknownInstrumentException;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BondCatalogTest {

    private final BondCatalog catalog = BondCatalog.standard();

    @Test
    @DisplayName("Standard catalog holds the seven bonds in tenor order")
    void sevenBonds() {
        assertThat(catalog.getInstruments()).extracting(Instrument::getInstrumentId)
                .containsExactly("B02y", "B03y", "B05y", "B07y", "B10y", "B20y", "B30y");
    }

    @Test
    @DisplayName("Bond attributes expose coupon and maturity")
    void attributes() {
        Instrument b30y = catalog.require("B30y");

        assertThat(b30y.getAttributes())
                .containsEntry("coupon", new BigDecimal("0.05"))
                .containsEntry("maturity", LocalDate.of(2054, 12, 31));
    }

    @Test
    @DisplayName("Lookups by unknown or null id find nothing")
    void unknownIds() {
        assertThat(catalog.contains("B02y")).isTrue();
        assertThat(catalog.contains("B04y")).isFalse();
        assertThat(catalog.find(null)).isEmpty();
        assertThatThrownBy(() -> catalog.require("B04y"))
                .isInstanceOf(UnknownInstrumentException.class)
                .hasMessageContaining("B04y");
    }
}
