package com.bondtrader.unit.connector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bondtrader.connector.RecordParser;
import com.bondtrader.domain.BondCatalog;
import com.bondtrader.domain.enums.InquiryState;
import com.bondtrader.domain.enums.Side;
import com.bondtrader.domain.model.Inquiry;
import com.bondtrader.domain.model.OrderBook;
import com.bondtrader.domain.model.OrderBookLevel;
import com.bondtrader.domain.model.Price;
import com.bondtrader.domain.model.Trade;
import com.bondtrader.exception.MalformedInputException;
import com.bondtrader.exception.UnknownInstrumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RecordParser covering the four input record layouts.
 */
class RecordParserTest {

    private final RecordParser recordParser = new RecordParser(BondCatalog.standard(), 1_000_000);

    @Nested
    @DisplayName("Trades")
    class Trades {

        @Test
        @DisplayName("Parses instrument, id, book, quantity, price and side")
        void parsesTrade() {
            Trade trade = recordParser.parseTrade("B10y,T123,TRSY2,3000000,99-16+,SELL");

            assertThat(trade.getInstrument().getInstrumentId()).isEqualTo("B10y");
            assertThat(trade.getTradeId()).isEqualTo("T123");
            assertThat(trade.getBook()).isEqualTo("TRSY2");
            assertThat(trade.getQuantity()).isEqualTo(3_000_000);
            assertThat(trade.getPrice()).isEqualByComparingTo("99.515625");
            assertThat(trade.getSide()).isEqualTo(Side.SELL);
        }

        @Test
        @DisplayName("Unknown book is passed through for the position stage to judge")
        void unknownBookPassedThrough() {
            assertThat(recordParser.parseTrade("B10y,T1,TRSY9,1000000,99-00,BUY").getBook()).isEqualTo("TRSY9");
        }

        @Test
        @DisplayName("Unknown instrument raises UnknownInstrumentException")
        void unknownInstrument() {
            assertThatThrownBy(() -> recordParser.parseTrade("B99y,T1,TRSY1,1000000,99-00,BUY"))
                    .isInstanceOf(UnknownInstrumentException.class);
        }

        @Test
        @DisplayName("Short records, bad quantities, prices and sides are malformed")
        void malformedTrades() {
            assertThatThrownBy(() -> recordParser.parseTrade("B10y,T1,TRSY1,1000000,99-00"))
                    .isInstanceOf(MalformedInputException.class);
            assertThatThrownBy(() -> recordParser.parseTrade("B10y,T1,TRSY1,lots,99-00,BUY"))
                    .isInstanceOf(MalformedInputException.class);
            assertThatThrownBy(() -> recordParser.parseTrade("B10y,T1,TRSY1,0,99-00,BUY"))
                    .isInstanceOf(MalformedInputException.class);
            assertThatThrownBy(() -> recordParser.parseTrade("B10y,T1,TRSY1,1000000,99-160,BUY"))
                    .isInstanceOf(MalformedInputException.class);
            assertThatThrownBy(() -> recordParser.parseTrade("B10y,T1,TRSY1,1000000,99-00,HOLD"))
                    .isInstanceOf(MalformedInputException.class);
        }
    }

    @Nested
    @DisplayName("Prices")
    class Prices {

        @Test
        @DisplayName("Bid and offer become mid and spread")
        void bidOfferToMidSpread() {
            Price price = recordParser.parsePrice("B02y,99-16,99-16+");

            assertThat(price.getMid()).isEqualByComparingTo("99.5078125");
            assertThat(price.getBidOfferSpread()).isEqualByComparingTo("0.015625");
        }
    }

    @Nested
    @DisplayName("Order Books")
    class OrderBooks {

        @Test
        @DisplayName("Five levels per side with sizes growing by a million")
        void fiveLevels() {
            OrderBook book = recordParser.parseOrderBook(
                    "B30y,99-16,99-16+,99-15+,99-17,99-15,99-17+,99-14+,99-18,99-14,99-18+");

            assertThat(book.getBidStack()).hasSize(5);
            assertThat(book.getOfferStack()).hasSize(5);
            assertThat(book.getBidStack()).extracting(OrderBookLevel::getQuantity)
                    .containsExactly(1_000_000L, 2_000_000L, 3_000_000L, 4_000_000L, 5_000_000L);
            assertThat(book.getBidStack().get(0).getPrice()).isEqualByComparingTo("99.5");
            assertThat(book.getOfferStack().get(0).getPrice()).isEqualByComparingTo("99.515625");
            assertThat(book.getOfferStack().get(4).getPrice()).isEqualByComparingTo("99.578125");
        }

        @Test
        @DisplayName("Fewer than five levels is malformed")
        void tooFewLevels() {
            assertThatThrownBy(() -> recordParser.parseOrderBook("B30y,99-16,99-16+"))
                    .isInstanceOf(MalformedInputException.class)
                    .hasMessageContaining("Expected 11 fields");
        }
    }

    @Nested
    @DisplayName("Inquiries")
    class Inquiries {

        @Test
        @DisplayName("Inquiries start RECEIVED, unpriced, with the default quantity")
        void parsesInquiry() {
            Inquiry inquiry = recordParser.parseInquiry("Q17,B05y,BUY,RECEIVED");

            assertThat(inquiry.getInquiryId()).isEqualTo("Q17");
            assertThat(inquiry.getInstrument().getInstrumentId()).isEqualTo("B05y");
            assertThat(inquiry.getSide()).isEqualTo(Side.BUY);
            assertThat(inquiry.getState()).isEqualTo(InquiryState.RECEIVED);
            assertThat(inquiry.getQuantity()).isEqualTo(1_000_000);
            assertThat(inquiry.isPriced()).isFalse();
        }

        @Test
        @DisplayName("State column is ignored")
        void stateColumnIgnored() {
            assertThat(recordParser.parseInquiry("Q18,B05y,SELL,DONE").getState()).isEqualTo(InquiryState.RECEIVED);
        }
    }
}
