package com.tradejournal.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradejournal.broker.normalizer.LegNormalizationService;
import com.tradejournal.broker.normalizer.LegNormalizationService.NormalizedBatch;
import com.tradejournal.broker.normalizer.RobinhoodLegNormalizer;
import com.tradejournal.broker.normalizer.TastytradeLegNormalizer;
import com.tradejournal.config.ReconstructionConfig;
import com.tradejournal.domain.enums.BrokerKind;
import com.tradejournal.domain.enums.LegDirection;
import com.tradejournal.domain.model.Leg;
import com.tradejournal.exception.NormalizationException;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link LegNormalizationService}: row ordering, filtering and the
 * skip-and-continue policy for malformed rows.
 */
class LegNormalizationServiceTest {

    private LegNormalizationService legNormalizationService;

    @BeforeEach
    void setUp() {
        legNormalizationService = new LegNormalizationService(
                List.of(new RobinhoodLegNormalizer(new ReconstructionConfig()), new TastytradeLegNormalizer()));
    }

    @Test
    @DisplayName("newest-first export rows come back in chronological order")
    void reversesIntoChronologicalOrder() {
        List<Map<String, String>> rows = List.of(
                robinhood("4/14/2025", "BTC", "QQQ 4/17/2025 Put $440.00", "1", "($20.00)"),
                robinhood("4/7/2025", "STO", "QQQ 4/17/2025 Put $440.00", "1", "$95.00"));

        NormalizedBatch batch = legNormalizationService.normalizeAll(rows, BrokerKind.ROBINHOOD);

        assertThat(batch.legs()).extracting(Leg::getDirection)
                .containsExactly(LegDirection.OPEN, LegDirection.CLOSE);
        assertThat(batch.legs().get(0).getTimestamp().toLocalDate()).isEqualTo(LocalDate.of(2025, 4, 7));
    }

    @Test
    @DisplayName("non-trade rows are filtered without counting as skipped")
    void filtersNonTradeRows() {
        Map<String, String> interest = robinhood("4/8/2025", "INT", "Interest Payment", "", "$0.41");
        interest.put("Instrument", "");

        NormalizedBatch batch = legNormalizationService.normalizeAll(
                List.of(interest, robinhood("4/7/2025", "STO", "QQQ 4/17/2025 Put $440.00", "1", "$95.00")),
                BrokerKind.ROBINHOOD);

        assertThat(batch.legs()).hasSize(1);
        assertThat(batch.filteredRows()).isEqualTo(1);
        assertThat(batch.skippedRows()).isZero();
    }

    @Test
    @DisplayName("a malformed trade row is skipped and counted; the batch continues")
    void skipsMalformedRows() {
        List<Map<String, String>> rows = List.of(
                robinhood("4/9/2025", "STO", "QQQ 4/17/2025 Put $440.00", "1", "$95.00"),
                robinhood("4/8/2025", "STO", "QQQ 4/17/2025 Put $abc", "1", "$95.00"),
                robinhood("4/7/2025", "STO", "SPY 4/17/2025 Call $560.00", "1", "$80.00"));

        NormalizedBatch batch = legNormalizationService.normalizeAll(rows, BrokerKind.ROBINHOOD);

        assertThat(batch.legs()).extracting(Leg::getUnderlying).containsExactly("SPY", "QQQ");
        assertThat(batch.skippedRows()).isEqualTo(1);
    }

    @Test
    @DisplayName("single-row normalize propagates the parse failure")
    void singleRowThrows() {
        Map<String, String> row = robinhood("4/8/2025", "STO", "QQQ 4/17/2025 Put $abc", "1", "$95.00");

        assertThatThrownBy(() -> legNormalizationService.normalize(row, BrokerKind.ROBINHOOD))
                .isInstanceOf(NormalizationException.class);
    }

    @Test
    @DisplayName("empty export yields an empty batch")
    void emptyExport() {
        NormalizedBatch batch = legNormalizationService.normalizeAll(List.of(), BrokerKind.TASTYTRADE);

        assertThat(batch.legs()).isEmpty();
        assertThat(batch.skippedRows()).isZero();
        assertThat(batch.filteredRows()).isZero();
    }

    private Map<String, String> robinhood(
            String date, String transCode, String description, String quantity, String amount) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("Activity Date", date);
        row.put("Instrument", description.split(" ")[0]);
        row.put("Description", description);
        row.put("Trans Code", transCode);
        row.put("Quantity", quantity);
        row.put("Amount", amount);
        return row;
    }
}
