package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.StrategyType;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * The opening legs of one logical multi-leg order plus the strategy classified for them.
 * Created once per distinct grouping key and never modified afterwards.
 */
@Value
@Builder
public class OrderGroup {

    /** Order number, or {@code underlying|date} when the broker has no order linkage. */
    String groupKey;

    List<Leg> legs;
    StrategyType strategy;

    /** Total contracts opened across all legs of the group. */
    public int getOpenedQuantity() {
        return legs.stream().mapToInt(Leg::getQuantity).sum();
    }
}
