package com.tradejournal.unit.reconstruction;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradejournal.domain.enums.LegDirection;
import com.tradejournal.domain.enums.MatchedEventType;
import com.tradejournal.domain.enums.OptionType;
import com.tradejournal.domain.enums.OrderSide;
import com.tradejournal.domain.enums.StrategyType;
import com.tradejournal.domain.model.Leg;
import com.tradejournal.domain.model.MatchedEvent;
import com.tradejournal.reconstruction.OrderGroupingService;
import com.tradejournal.reconstruction.OrderIdGrouper;
import com.tradejournal.reconstruction.PositionLedger;
import com.tradejournal.reconstruction.SameDayUnderlyingGrouper;
import com.tradejournal.reconstruction.StrategyClassifier;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link PositionLedger}: FIFO lot order, partial-fill splitting, quantity and
 * amount conservation, unmatched closes and expirations.
 */
class PositionLedgerTest {

    private static final String STRIKE = "440";

    private PositionLedger positionLedger;
    private OrderGroupingService orderGroupingService;

    @BeforeEach
    void setUp() {
        StrategyClassifier classifier = new StrategyClassifier();
        positionLedger = new PositionLedger(classifier);
        orderGroupingService = new OrderGroupingService(
                new OrderIdGrouper(classifier), new SameDayUnderlyingGrouper(classifier));
    }

    @Nested
    @DisplayName("FIFO matching")
    class FifoTests {

        @Test
        @DisplayName("a close smaller than the oldest lot consumes only from that lot")
        void consumesOldestLotFirst() {
            Leg first = open(OrderSide.BUY, 3, "-300", 1);
            Leg second = open(OrderSide.BUY, 2, "-240", 2);
            Leg close = close(OrderSide.SELL, 2, "260", 3);

            List<MatchedEvent> events = process(first, second, close);

            assertThat(events).hasSize(3);
            MatchedEvent matched = events.get(0);
            assertThat(matched.getType()).isEqualTo(MatchedEventType.MATCHED);
            assertThat(matched.getOpenLeg()).isSameAs(first);
            assertThat(matched.getQuantity()).isEqualTo(2);
            assertThat(matched.getOpenAmount()).isEqualByComparingTo("-200");
            assertThat(matched.getCloseAmount()).isEqualByComparingTo("260");

            assertThat(events.get(1).getType()).isEqualTo(MatchedEventType.OPEN);
            assertThat(events.get(1).getOpenLeg()).isSameAs(first);
            assertThat(events.get(1).getQuantity()).isEqualTo(1);
            assertThat(events.get(1).getOpenAmount()).isEqualByComparingTo("-100");

            assertThat(events.get(2).getOpenLeg()).isSameAs(second);
            assertThat(events.get(2).getQuantity()).isEqualTo(2);
            assertThat(events.get(2).getOpenAmount()).isEqualByComparingTo("-240");
        }

        @Test
        @DisplayName("closing 3 of 5 splits the open amount 3/5 and 2/5")
        void splitsPartialFill() {
            List<MatchedEvent> events = process(
                    open(OrderSide.BUY, 5, "-500", 1),
                    close(OrderSide.SELL, 3, "450", 4));

            assertThat(events).hasSize(2);
            assertThat(events.get(0).getType()).isEqualTo(MatchedEventType.MATCHED);
            assertThat(events.get(0).getQuantity()).isEqualTo(3);
            assertThat(events.get(0).getOpenAmount()).isEqualByComparingTo("-300");
            assertThat(events.get(0).getCloseAmount()).isEqualByComparingTo("450");
            assertThat(events.get(1).getType()).isEqualTo(MatchedEventType.OPEN);
            assertThat(events.get(1).getQuantity()).isEqualTo(2);
            assertThat(events.get(1).getOpenAmount()).isEqualByComparingTo("-200");
        }

        @Test
        @DisplayName("a close spanning two lots splits its amount across them")
        void closeSpansLots() {
            Leg first = open(OrderSide.SELL, 1, "100", 1);
            Leg second = open(OrderSide.SELL, 2, "300", 2);

            List<MatchedEvent> events = process(first, second, close(OrderSide.BUY, 3, "-60", 5));

            assertThat(events).extracting(MatchedEvent::getType)
                    .containsExactly(MatchedEventType.MATCHED, MatchedEventType.MATCHED);
            assertThat(events.get(0).getOpenLeg()).isSameAs(first);
            assertThat(events.get(0).getQuantity()).isEqualTo(1);
            assertThat(events.get(0).getCloseAmount()).isEqualByComparingTo("-20");
            assertThat(events.get(1).getOpenLeg()).isSameAs(second);
            assertThat(events.get(1).getQuantity()).isEqualTo(2);
            assertThat(events.get(1).getOpenAmount()).isEqualByComparingTo("300");
            assertThat(events.get(1).getCloseAmount()).isEqualByComparingTo("-40");
        }

        @Test
        @DisplayName("repeated partial closes never lose a cent to rounding")
        void conservesAmounts() {
            List<MatchedEvent> events = process(
                    open(OrderSide.BUY, 3, "-100.00", 1),
                    close(OrderSide.SELL, 1, "10", 2),
                    close(OrderSide.SELL, 1, "10", 3),
                    close(OrderSide.SELL, 1, "10", 4));

            assertThat(events).hasSize(3);
            assertThat(events).extracting(MatchedEvent::getOpenAmount)
                    .map(BigDecimal::toPlainString)
                    .containsExactly("-33.33", "-33.34", "-33.33");
            assertThat(events.stream().map(MatchedEvent::getOpenAmount).reduce(BigDecimal.ZERO, BigDecimal::add))
                    .isEqualByComparingTo("-100.00");
        }

        @Test
        @DisplayName("matched + leftover + unmatched quantity equals opened + unmatched quantity")
        void conservesQuantity() {
            List<MatchedEvent> events = process(
                    open(OrderSide.SELL, 4, "400", 1),
                    close(OrderSide.BUY, 1, "-50", 2),
                    open(OrderSide.SELL, 2, "180", 3),
                    close(OrderSide.BUY, 4, "-200", 4),
                    close(OrderSide.BUY, 3, "-90", 5));

            int opened = 4 + 2;
            int unmatched = events.stream()
                    .filter(event -> event.getType() == MatchedEventType.UNMATCHED_CLOSE)
                    .mapToInt(MatchedEvent::getQuantity)
                    .sum();
            int total = events.stream().mapToInt(MatchedEvent::getQuantity).sum();

            assertThat(unmatched).isEqualTo(2);
            assertThat(total).isEqualTo(opened + unmatched);
        }
    }

    @Nested
    @DisplayName("unmatched closes")
    class UnmatchedCloseTests {

        @Test
        @DisplayName("a close with no open lot becomes an unmatched close with the inverted strategy")
        void closeWithoutOpen() {
            Leg close = close(OrderSide.BUY, 1, "-20", 3);

            List<MatchedEvent> events = process(close);

            assertThat(events).hasSize(1);
            MatchedEvent event = events.get(0);
            assertThat(event.getType()).isEqualTo(MatchedEventType.UNMATCHED_CLOSE);
            assertThat(event.getCloseLeg()).isSameAs(close);
            assertThat(event.getOpenLeg()).isNull();
            assertThat(event.getQuantity()).isEqualTo(1);
            assertThat(event.getCloseAmount()).isEqualByComparingTo("-20");
            assertThat(event.getStrategy()).isEqualTo(StrategyType.SHORT_PUT);
            assertThat(event.getGroupKey()).isNull();
        }

        @Test
        @DisplayName("only the remainder beyond the open lots is unmatched")
        void remainderIsUnmatched() {
            List<MatchedEvent> events = process(
                    open(OrderSide.BUY, 1, "-100", 1),
                    close(OrderSide.SELL, 3, "300", 2));

            assertThat(events).extracting(MatchedEvent::getType)
                    .containsExactly(MatchedEventType.MATCHED, MatchedEventType.UNMATCHED_CLOSE);
            assertThat(events.get(0).getCloseAmount()).isEqualByComparingTo("100");
            assertThat(events.get(1).getQuantity()).isEqualTo(2);
            assertThat(events.get(1).getCloseAmount()).isEqualByComparingTo("200");
            assertThat(events.get(1).getStrategy()).isEqualTo(StrategyType.LONG_PUT);
        }
    }

    @Nested
    @DisplayName("expirations")
    class ExpirationTests {

        @Test
        @DisplayName("an expiration closes the lot at zero and takes the opposite side")
        void expirationClosesLot() {
            Leg open = open(OrderSide.SELL, 1, "95", 1);

            List<MatchedEvent> events = process(open, expiration(1, 10));

            assertThat(events).hasSize(1);
            MatchedEvent event = events.get(0);
            assertThat(event.getType()).isEqualTo(MatchedEventType.MATCHED);
            assertThat(event.getOpenAmount()).isEqualByComparingTo("95");
            assertThat(event.getCloseAmount()).isEqualByComparingTo(BigDecimal.ZERO);
            assertThat(event.getCloseLeg().isExpiration()).isTrue();
            assertThat(event.getCloseLeg().getSide()).isEqualTo(OrderSide.BUY);
            assertThat(event.getStrategy()).isEqualTo(StrategyType.SHORT_PUT);
        }

        @Test
        @DisplayName("an expiration with nothing open is discarded")
        void expirationWithoutLot() {
            assertThat(process(expiration(1, 10))).isEmpty();
        }

        @Test
        @DisplayName("expiration quantity beyond the open lots is discarded")
        void excessExpirationDiscarded() {
            List<MatchedEvent> events = process(open(OrderSide.SELL, 1, "95", 1), expiration(2, 10));

            assertThat(events).hasSize(1);
            assertThat(events.get(0).getQuantity()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("lots carry the strategy of the order group that opened them")
    void inheritsGroupStrategy() {
        Leg put = open(OrderSide.SELL, 1, "150", 1);
        Leg call = put.toBuilder().optionType(OptionType.CALL).strike(new BigDecimal("460")).amount(new BigDecimal("140")).build();
        Leg closePut = close(OrderSide.BUY, 1, "-30", 4);

        List<MatchedEvent> events = process(put, call, closePut);

        assertThat(events).extracting(MatchedEvent::getStrategy)
                .containsOnly(StrategyType.STRANGLE);
        assertThat(events).extracting(MatchedEvent::getGroupKey)
                .containsOnly("QQQ|2025-04-01");
    }

    @Test
    @DisplayName("no legs, no events")
    void emptyInput() {
        assertThat(positionLedger.process(List.of(), List.of())).isEmpty();
    }

    private List<MatchedEvent> process(Leg... legs) {
        List<Leg> sorted = List.of(legs);
        return positionLedger.process(sorted, orderGroupingService.group(sorted));
    }

    private Leg open(OrderSide side, int quantity, String amount, int day) {
        return leg(LegDirection.OPEN, side, quantity, amount, day);
    }

    private Leg close(OrderSide side, int quantity, String amount, int day) {
        return leg(LegDirection.CLOSE, side, quantity, amount, day);
    }

    private Leg expiration(int quantity, int day) {
        return leg(LegDirection.CLOSE, null, quantity, "0", day).toBuilder().expiration(true).build();
    }

    private Leg leg(LegDirection direction, OrderSide side, int quantity, String amount, int day) {
        return Leg.builder()
                .underlying("QQQ")
                .optionType(OptionType.PUT)
                .strike(new BigDecimal(STRIKE))
                .expiry(LocalDate.of(2025, 4, 17))
                .direction(direction)
                .side(side)
                .quantity(quantity)
                .amount(new BigDecimal(amount))
                .timestamp(LocalDate.of(2025, 4, day).atStartOfDay())
                .build();
    }
}
