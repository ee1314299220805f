package com.tradejournal.broker.normalizer;

import com.tradejournal.domain.enums.BrokerKind;
import com.tradejournal.domain.model.Leg;
import com.tradejournal.exception.NormalizationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs a batch of raw rows through the broker's {@link LegNormalizer}.
 *
 * <p>Non-trade rows are filtered silently. A trade row that fails to parse is dropped with a
 * warning and counted: one malformed row never aborts the batch.
 */
@Service
public class LegNormalizationService {

    private static final Logger log = LoggerFactory.getLogger(LegNormalizationService.class);

    private final Map<BrokerKind, LegNormalizer> normalizers = new EnumMap<>(BrokerKind.class);

    public LegNormalizationService(List<LegNormalizer> normalizers) {
        for (LegNormalizer normalizer : normalizers) {
            this.normalizers.put(normalizer.broker(), normalizer);
        }
    }

    /**
     * Normalizes a single trade row.
     *
     * @throws NormalizationException when the row cannot be parsed
     */
    public Leg normalize(Map<String, String> row, BrokerKind broker) {
        return normalizerFor(broker).normalize(row);
    }

    /**
     * Normalizes all trade rows of one export, in chronological row order.
     */
    public NormalizedBatch normalizeAll(List<Map<String, String>> rows, BrokerKind broker) {
        LegNormalizer normalizer = normalizerFor(broker);
        List<Map<String, String>> ordered = new ArrayList<>(rows);
        if (normalizer.newestFirst()) {
            Collections.reverse(ordered);
        }

        List<Leg> legs = new ArrayList<>();
        int filtered = 0;
        int skipped = 0;

        for (int i = 0; i < ordered.size(); i++) {
            Map<String, String> row = ordered.get(i);
            if (!normalizer.isTradeRow(row)) {
                filtered++;
                continue;
            }
            try {
                legs.add(normalizer.normalize(row));
            } catch (NormalizationException e) {
                skipped++;
                int sourceRow = normalizer.newestFirst() ? ordered.size() - i : i + 1;
                log.warn("Skipping {} row {}: {}", broker, sourceRow, e.getMessage());
            }
        }

        log.debug("Normalized {} rows for {}: legs={}, filtered={}, skipped={}",
                rows.size(), broker, legs.size(), filtered, skipped);
        return new NormalizedBatch(legs, filtered, skipped);
    }

    private LegNormalizer normalizerFor(BrokerKind broker) {
        LegNormalizer normalizer = normalizers.get(broker);
        if (normalizer == null) {
            throw new IllegalStateException("No leg normalizer registered for " + broker);
        }
        return normalizer;
    }

    /**
     * Legs of one export plus the row accounting.
     *
     * @param legs         normalized legs in chronological row order
     * @param filteredRows non-trade rows such as cash movements and interest
     * @param skippedRows  trade rows dropped because they could not be parsed
     */
    public record NormalizedBatch(List<Leg> legs, int filteredRows, int skippedRows) {}
}
