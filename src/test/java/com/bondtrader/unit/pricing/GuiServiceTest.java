package com.bondtrader.unit.pricing;

import static org.assertj.core.api.Assertions.assertThat;

import com.bondtrader.domain.BondCatalog;
import com.bondtrader.domain.model.Instrument;
import com.bondtrader.domain.model.Price;
import com.bondtrader.pricing.GuiService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for GuiService throttling. Time is driven by a hand-advanced clock.
 */
class GuiServiceTest {

    private static final Instrument B02Y = BondCatalog.standard().require("B02y");
    private static final Instrument B30Y = BondCatalog.standard().require("B30y");

    private MutableClock clock;
    private List<Price> delivered;
    private GuiService guiService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        delivered = new ArrayList<>();
        guiService = new GuiService(delivered::add, clock, 300);
    }

    private static Price price(Instrument instrument, String mid) {
        return Price.builder()
                .instrument(instrument)
                .mid(new BigDecimal(mid))
                .bidOfferSpread(new BigDecimal("0.0078125"))
                .build();
    }

    @Nested
    @DisplayName("Throttle Window")
    class ThrottleWindow {

        @Test
        @DisplayName("First quote is always delivered")
        void firstQuoteDelivered() {
            assertThat(guiService.provideData(price(B02Y, "99.5"))).isTrue();
            assertThat(delivered).hasSize(1);
        }

        @Test
        @DisplayName("Second quote 100 ms later is dropped")
        void quoteInsideWindowDropped() {
            guiService.provideData(price(B02Y, "99.5"));
            clock.advance(100);

            assertThat(guiService.provideData(price(B02Y, "99.6"))).isFalse();

            assertThat(delivered).extracting(Price::getMid).containsExactly(new BigDecimal("99.5"));
            assertThat(guiService.getThrottledCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Second quote 400 ms later is delivered")
        void quoteAfterWindowDelivered() {
            guiService.provideData(price(B02Y, "99.5"));
            clock.advance(400);

            assertThat(guiService.provideData(price(B02Y, "99.6"))).isTrue();
            assertThat(guiService.getDeliveredCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Exactly 300 ms is still inside the window")
        void boundaryIsExclusive() {
            guiService.provideData(price(B02Y, "99.5"));
            clock.advance(300);

            assertThat(guiService.provideData(price(B02Y, "99.6"))).isFalse();

            clock.advance(1);
            assertThat(guiService.provideData(price(B02Y, "99.7"))).isTrue();
        }

        @Test
        @DisplayName("Dropped quotes do not move the window")
        void droppedQuotesDoNotResetWindow() {
            guiService.provideData(price(B02Y, "99.5"));
            clock.advance(200);
            guiService.provideData(price(B02Y, "99.6"));
            clock.advance(200);

            // 400 ms after the last delivery, 200 ms after the last drop
            assertThat(guiService.provideData(price(B02Y, "99.7"))).isTrue();
        }
    }

    @Test
    @DisplayName("Window is shared across instruments")
    void windowSharedAcrossInstruments() {
        guiService.provideData(price(B02Y, "99.5"));
        clock.advance(50);

        assertThat(guiService.provideData(price(B30Y, "101"))).isFalse();
        assertThat(guiService.contains("B30y")).isFalse();
    }

    @Test
    @DisplayName("Delivered quotes are stored and forwarded to listeners")
    void deliveredQuotesNotified() {
        List<Price> notified = new ArrayList<>();
        guiService.addListener(notified::add);

        guiService.provideData(price(B02Y, "99.5"));

        assertThat(notified).hasSize(1);
        assertThat(guiService.getData("B02y").getMid()).isEqualByComparingTo("99.5");
    }

    static final class MutableClock extends Clock {

        private long millis;

        MutableClock(long millis) {
            this.millis = millis;
        }

        void advance(long delta) {
            millis += delta;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public long millis() {
            return millis;
        }
    }
}
