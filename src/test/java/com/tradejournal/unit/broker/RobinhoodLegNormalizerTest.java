package com.tradejournal.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradejournal.broker.normalizer.RobinhoodLegNormalizer;
import com.tradejournal.config.ReconstructionConfig;
import com.tradejournal.domain.enums.LegDirection;
import com.tradejournal.domain.enums.OptionType;
import com.tradejournal.domain.enums.OrderSide;
import com.tradejournal.domain.model.Leg;
import com.tradejournal.exception.NormalizationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link RobinhoodLegNormalizer}: trade row filtering, description parsing,
 * trans code mapping and amount formats.
 */
class RobinhoodLegNormalizerTest {

    private RobinhoodLegNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new RobinhoodLegNormalizer(new ReconstructionConfig());
    }

    @Nested
    @DisplayName("isTradeRow")
    class TradeRowTests {

        @Test
        @DisplayName("accepts option trade codes")
        void acceptsOptionTrades() {
            assertThat(normalizer.isTradeRow(row("STO", "QQQ 4/11/2025 Call $460.00", "1", "$42.94"))).isTrue();
            assertThat(normalizer.isTradeRow(row("btc", "QQQ 4/11/2025 Call $460.00", "1", "($12.06)"))).isTrue();
            assertThat(normalizer.isTradeRow(row("OEXP", "Option Expiration for QQQ 4/11/2025 Call $460.00", "1S", "")))
                    .isTrue();
        }

        @Test
        @DisplayName("filters cash movements, interest and subscription fees")
        void filtersNonTradeRows() {
            Map<String, String> deposit = row("ACH", "ACH Deposit", "", "$500.00");
            deposit.put("Instrument", "");
            Map<String, String> interest = row("INT", "Interest Payment", "", "$0.12");
            Map<String, String> gold = row("GOLD", "Gold Subscription Fee", "", "($5.00)");

            assertThat(normalizer.isTradeRow(deposit)).isFalse();
            assertThat(normalizer.isTradeRow(interest)).isFalse();
            assertThat(normalizer.isTradeRow(gold)).isFalse();
        }

        @Test
        @DisplayName("filters trade codes on rows matching an excluded description")
        void filtersExcludedDescriptions() {
            ReconstructionConfig config = new ReconstructionConfig();
            config.getRobinhood().getExcludedDescriptions().add("Promotional");
            RobinhoodLegNormalizer configured = new RobinhoodLegNormalizer(config);

            assertThat(configured.isTradeRow(row("STO", "Promotional QQQ 4/11/2025 Call $460.00", "1", "$1.00")))
                    .isFalse();
        }

        @Test
        @DisplayName("filters rows without an instrument")
        void filtersRowsWithoutInstrument() {
            Map<String, String> row = row("STO", "QQQ 4/11/2025 Call $460.00", "1", "$42.94");
            row.remove("Instrument");

            assertThat(normalizer.isTradeRow(row)).isFalse();
        }
    }

    @Nested
    @DisplayName("normalize")
    class NormalizeTests {

        @Test
        @DisplayName("STO maps to an opening sell with a positive amount")
        void mapsSellToOpen() {
            Leg leg = normalizer.normalize(row("STO", "QQQ 4/11/2025 Call $460.00", "1", "$42.94"));

            assertThat(leg.getUnderlying()).isEqualTo("QQQ");
            assertThat(leg.getOptionType()).isEqualTo(OptionType.CALL);
            assertThat(leg.getStrike()).isEqualByComparingTo("460");
            assertThat(leg.getExpiry()).isEqualTo(LocalDate.of(2025, 4, 11));
            assertThat(leg.getDirection()).isEqualTo(LegDirection.OPEN);
            assertThat(leg.getSide()).isEqualTo(OrderSide.SELL);
            assertThat(leg.getQuantity()).isEqualTo(1);
            assertThat(leg.getAmount()).isEqualByComparingTo("42.94");
            assertThat(leg.getTimestamp()).isEqualTo(LocalDateTime.of(2025, 4, 7, 0, 0));
            assertThat(leg.getOrderKey()).isNull();
            assertThat(leg.isExpiration()).isFalse();
        }

        @Test
        @DisplayName("BTC maps to a closing buy; parentheses mean a negative amount")
        void mapsBuyToClose() {
            Leg leg = normalizer.normalize(row("BTC", "SPY 5/16/2025 Put $550.00", "2", "($70.04)"));

            assertThat(leg.getDirection()).isEqualTo(LegDirection.CLOSE);
            assertThat(leg.getSide()).isEqualTo(OrderSide.BUY);
            assertThat(leg.getOptionType()).isEqualTo(OptionType.PUT);
            assertThat(leg.getQuantity()).isEqualTo(2);
            assertThat(leg.getAmount()).isEqualByComparingTo("-70.04");
        }

        @Test
        @DisplayName("BTO and STC map to the buy-then-sell pair")
        void mapsLongSideCodes() {
            Leg open = normalizer.normalize(row("BTO", "AAPL 6/20/2025 Call $200.00", "3", "($1,234.50)"));
            Leg close = normalizer.normalize(row("STC", "AAPL 6/20/2025 Call $200.00", "3", "$1,500.00"));

            assertThat(open.getDirection()).isEqualTo(LegDirection.OPEN);
            assertThat(open.getSide()).isEqualTo(OrderSide.BUY);
            assertThat(open.getAmount()).isEqualByComparingTo("-1234.50");
            assertThat(close.getDirection()).isEqualTo(LegDirection.CLOSE);
            assertThat(close.getSide()).isEqualTo(OrderSide.SELL);
            assertThat(close.getAmount()).isEqualByComparingTo("1500.00");
            assertThat(close.getPositionKey()).isEqualTo(open.getPositionKey());
        }

        @Test
        @DisplayName("OEXP maps to a zero-amount expiration close with no side")
        void mapsExpiration() {
            Leg leg = normalizer.normalize(
                    row("OEXP", "Option Expiration for QQQ 4/11/2025 Call $460.00", "1S", ""));

            assertThat(leg.isExpiration()).isTrue();
            assertThat(leg.getDirection()).isEqualTo(LegDirection.CLOSE);
            assertThat(leg.getSide()).isNull();
            assertThat(leg.getAmount()).isEqualByComparingTo(BigDecimal.ZERO);
            assertThat(leg.getQuantity()).isEqualTo(1);
            assertThat(leg.getUnderlying()).isEqualTo("QQQ");
            assertThat(leg.getStrike()).isEqualByComparingTo("460");
        }

        @Test
        @DisplayName("an unparseable description is a NormalizationException")
        void rejectsMalformedDescription() {
            assertThatThrownBy(() -> normalizer.normalize(row("STO", "QQQ Weekly Call", "1", "$42.94")))
                    .isInstanceOf(NormalizationException.class)
                    .hasMessageContaining("option description");
        }

        @Test
        @DisplayName("an unparseable amount is a NormalizationException")
        void rejectsMalformedAmount() {
            assertThatThrownBy(() -> normalizer.normalize(row("STO", "QQQ 4/11/2025 Call $460.00", "1", "n/a")))
                    .isInstanceOf(NormalizationException.class)
                    .hasMessageContaining("Amount");
        }

        @Test
        @DisplayName("a zero quantity is a NormalizationException")
        void rejectsZeroQuantity() {
            assertThatThrownBy(() -> normalizer.normalize(row("STO", "QQQ 4/11/2025 Call $460.00", "0", "$1.00")))
                    .isInstanceOf(NormalizationException.class);
        }
    }

    private Map<String, String> row(String transCode, String description, String quantity, String amount) {
        Map<String, String> row = new HashMap<>();
        row.put("Activity Date", "4/7/2025");
        row.put("Process Date", "4/7/2025");
        row.put("Settle Date", "4/8/2025");
        row.put("Instrument", description.split(" ")[0]);
        row.put("Description", description);
        row.put("Trans Code", transCode);
        row.put("Quantity", quantity);
        row.put("Price", "");
        row.put("Amount", amount);
        return row;
    }
}
