package com.tradejournal.broker.normalizer;

import com.tradejournal.domain.enums.BrokerKind;
import com.tradejournal.domain.model.Leg;
import java.util.Map;

/**
 * Adapter from one broker's raw export row to the canonical {@link Leg}.
 *
 * <p>Implementations are narrow and broker-specific: all per-broker parsing quirks live here so
 * grouping, classification, matching and aggregation stay broker-agnostic.
 */
public interface LegNormalizer {

    BrokerKind broker();

    /**
     * Whether the row is an option trade (or expiration) at all. Cash transfers, interest,
     * fees and other administrative rows return false and are filtered silently.
     */
    boolean isTradeRow(Map<String, String> row);

    /**
     * Converts a trade row into a leg.
     *
     * @throws com.tradejournal.exception.NormalizationException when the option identifier,
     *         date, quantity or amount cannot be parsed
     */
    Leg normalize(Map<String, String> row);

    /** True when the export lists rows newest first. */
    default boolean newestFirst() {
        return true;
    }
}
