package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.MatchedEventType;
import com.tradejournal.domain.enums.StrategyType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Result of pairing (fully or partially) an open lot with a close, or a leftover remainder.
 *
 * <p>{@code quantity} is the number of contracts this event covers, which may be a fraction
 * of either source leg when a partial fill was split. {@code openAmount} and
 * {@code closeAmount} are the matching proportional shares of the source legs' signed
 * amounts; the side that does not exist for the event type is ZERO and its leg is null.
 */
@Value
@Builder
public class MatchedEvent {

    MatchedEventType type;

    /** Null for UNMATCHED_CLOSE. */
    Leg openLeg;

    /** Null for OPEN. */
    Leg closeLeg;

    int quantity;
    BigDecimal openAmount;
    BigDecimal closeAmount;
    StrategyType strategy;

    /** Order group the open lot came from. Null for UNMATCHED_CLOSE. */
    String groupKey;

    public static MatchedEvent matched(
            Leg openLeg,
            Leg closeLeg,
            int quantity,
            BigDecimal openAmount,
            BigDecimal closeAmount,
            StrategyType strategy,
            String groupKey) {
        return MatchedEvent.builder()
                .type(MatchedEventType.MATCHED)
                .openLeg(openLeg)
                .closeLeg(closeLeg)
                .quantity(quantity)
                .openAmount(openAmount)
                .closeAmount(closeAmount)
                .strategy(strategy)
                .groupKey(groupKey)
                .build();
    }

    public static MatchedEvent leftoverOpen(
            Leg openLeg, int quantity, BigDecimal openAmount, StrategyType strategy, String groupKey) {
        return MatchedEvent.builder()
                .type(MatchedEventType.OPEN)
                .openLeg(openLeg)
                .quantity(quantity)
                .openAmount(openAmount)
                .closeAmount(BigDecimal.ZERO)
                .strategy(strategy)
                .groupKey(groupKey)
                .build();
    }

    public static MatchedEvent unmatchedClose(
            Leg closeLeg, int quantity, BigDecimal closeAmount, StrategyType strategy) {
        return MatchedEvent.builder()
                .type(MatchedEventType.UNMATCHED_CLOSE)
                .closeLeg(closeLeg)
                .quantity(quantity)
                .openAmount(BigDecimal.ZERO)
                .closeAmount(closeAmount)
                .strategy(strategy)
                .build();
    }
}
