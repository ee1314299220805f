package com.tradejournal.reconstruction;

import com.tradejournal.domain.model.Leg;
import com.tradejournal.domain.model.OrderGroup;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Clusters opening legs that belong to the same logical multi-leg order and classifies each
 * cluster once. Closing legs are ignored. Groups are returned in first-seen order.
 *
 * <p>Subclasses only decide the grouping key, so a more precise heuristic can replace one
 * without touching the classifier or the ledger.
 */
public abstract class OrderGrouper {

    private final StrategyClassifier strategyClassifier;

    protected OrderGrouper(StrategyClassifier strategyClassifier) {
        this.strategyClassifier = strategyClassifier;
    }

    /** Whether this grouper can key every one of the given opening legs. */
    public abstract boolean appliesTo(List<Leg> openingLegs);

    protected abstract String groupKey(Leg leg);

    public List<OrderGroup> group(List<Leg> legs) {
        Map<String, List<Leg>> byKey = new LinkedHashMap<>();
        for (Leg leg : legs) {
            if (leg.isOpening()) {
                byKey.computeIfAbsent(groupKey(leg), key -> new ArrayList<>()).add(leg);
            }
        }

        List<OrderGroup> groups = new ArrayList<>(byKey.size());
        for (Map.Entry<String, List<Leg>> entry : byKey.entrySet()) {
            groups.add(OrderGroup.builder()
                    .groupKey(entry.getKey())
                    .legs(List.copyOf(entry.getValue()))
                    .strategy(strategyClassifier.classify(entry.getValue()))
                    .build());
        }
        return groups;
    }
}
