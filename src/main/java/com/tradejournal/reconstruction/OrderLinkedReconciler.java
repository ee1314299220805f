package com.tradejournal.reconstruction;

import com.tradejournal.domain.model.Leg;
import com.tradejournal.domain.model.MatchedEvent;
import com.tradejournal.domain.model.OrderGroup;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Attaches closing legs to the order groups they close, for exports that report one trade per
 * opening order.
 *
 * <p>Matching is FIFO at group granularity: a close on a position key goes to the oldest group
 * still holding open contracts of that key, splitting quantity and amount when it spans
 * groups. The group's own open amounts are not split here; close events carry a zero open
 * amount and the aggregator sums the group's opening legs once.
 */
@Component
public class OrderLinkedReconciler {

    private static final Logger log = LoggerFactory.getLogger(OrderLinkedReconciler.class);

    private final StrategyClassifier strategyClassifier;

    public OrderLinkedReconciler(StrategyClassifier strategyClassifier) {
        this.strategyClassifier = strategyClassifier;
    }

    public Reconciliation reconcile(List<Leg> legsSortedByTime, List<OrderGroup> groups) {
        OrderGroupIndex groupIndex = OrderGroupIndex.of(groups);
        Map<OrderGroup, GroupState> states = new IdentityHashMap<>();
        for (OrderGroup group : groups) {
            states.put(group, new GroupState(group));
        }

        Map<String, Deque<OpenEntry>> openByKey = new HashMap<>();
        List<MatchedEvent> unmatchedCloses = new ArrayList<>();

        for (Leg leg : legsSortedByTime) {
            Deque<OpenEntry> entries = openByKey.computeIfAbsent(leg.getPositionKey(), key -> new ArrayDeque<>());
            if (leg.isOpening()) {
                entries.addLast(new OpenEntry(leg, states.get(groupIndex.groupOf(leg))));
                continue;
            }

            int remaining = leg.getQuantity();
            BigDecimal remainingAmount = leg.getAmount();
            while (remaining > 0 && !entries.isEmpty()) {
                OpenEntry entry = entries.peekFirst();
                int taken = Math.min(remaining, entry.remaining);
                BigDecimal closePortion = ProportionalSplit.share(remainingAmount, taken, remaining);
                Leg closeLeg = leg.isExpiration()
                        ? leg.toBuilder().side(entry.openLeg.getSide().opposite()).build()
                        : leg;

                entry.state.closes.add(MatchedEvent.matched(
                        entry.openLeg,
                        closeLeg,
                        taken,
                        BigDecimal.ZERO,
                        closePortion,
                        entry.state.group.getStrategy(),
                        entry.state.group.getGroupKey()));
                entry.remaining -= taken;
                entry.state.remaining -= taken;
                remaining -= taken;
                remainingAmount = remainingAmount.subtract(closePortion);
                if (entry.remaining == 0) {
                    entries.pollFirst();
                }
            }

            if (remaining == 0) {
                continue;
            }
            if (leg.isExpiration()) {
                log.debug("Discarding expiration of {}x {}: nothing open", remaining, leg.getPositionKey());
            } else {
                log.warn("Unmatched close of {}x {} on {}: no open order in the export",
                        remaining, leg.getPositionKey(), leg.getTimestamp().toLocalDate());
                unmatchedCloses.add(MatchedEvent.unmatchedClose(
                        leg,
                        remaining,
                        remainingAmount,
                        strategyClassifier.classifySingle(leg.getOptionType(), leg.getSide().opposite())));
            }
        }

        List<GroupActivity> activities = groups.stream()
                .map(states::get)
                .map(state -> new GroupActivity(state.group, List.copyOf(state.closes), state.remaining))
                .toList();
        return new Reconciliation(activities, unmatchedCloses);
    }

    /**
     * One order group with the closes attached to it.
     *
     * @param remainingQuantity contracts of the group still open after all closes
     */
    public record GroupActivity(OrderGroup group, List<MatchedEvent> closes, int remainingQuantity) {

        public boolean isFullyClosed() {
            return remainingQuantity == 0;
        }
    }

    public record Reconciliation(List<GroupActivity> groups, List<MatchedEvent> unmatchedCloses) {}

    private static final class GroupState {
        private final OrderGroup group;
        private final List<MatchedEvent> closes = new ArrayList<>();
        private int remaining;

        private GroupState(OrderGroup group) {
            this.group = group;
            this.remaining = group.getOpenedQuantity();
        }
    }

    private static final class OpenEntry {
        private final Leg openLeg;
        private final GroupState state;
        private int remaining;

        private OpenEntry(Leg openLeg, GroupState state) {
            this.openLeg = openLeg;
            this.state = state;
            this.remaining = openLeg.getQuantity();
        }
    }
}
