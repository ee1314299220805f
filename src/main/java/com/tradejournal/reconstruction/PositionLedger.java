package com.tradejournal.reconstruction;

import com.tradejournal.domain.model.Leg;
import com.tradejournal.domain.model.MatchedEvent;
import com.tradejournal.domain.model.OrderGroup;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * FIFO matcher for exports whose closes are not linked to the order that opened them.
 *
 * <p>Each call owns its own lot queues, one per position key. Opens are appended at the back;
 * a close consumes from the front (oldest lot first), producing one matched event per lot it
 * touches with both amounts split by the contracts taken. Close quantity that no lot covers
 * becomes an unmatched-close event. Lots still holding contracts at the end become leftover
 * open events.
 *
 * <p>Legs must be in ascending timestamp order.
 */
@Component
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final StrategyClassifier strategyClassifier;

    public PositionLedger(StrategyClassifier strategyClassifier) {
        this.strategyClassifier = strategyClassifier;
    }

    public List<MatchedEvent> process(List<Leg> legsSortedByTime, List<OrderGroup> groups) {
        OrderGroupIndex groupIndex = OrderGroupIndex.of(groups);
        Map<String, Deque<PositionLot>> queues = new LinkedHashMap<>();
        List<MatchedEvent> events = new ArrayList<>();

        for (Leg leg : legsSortedByTime) {
            Deque<PositionLot> queue = queues.computeIfAbsent(leg.getPositionKey(), key -> new ArrayDeque<>());
            if (leg.isOpening()) {
                queue.addLast(new PositionLot(leg, groupIndex.groupOf(leg)));
            } else if (leg.isExpiration()) {
                expire(leg, queue, events);
            } else {
                close(leg, queue, events);
            }
        }

        for (Deque<PositionLot> queue : queues.values()) {
            for (PositionLot lot : queue) {
                events.add(MatchedEvent.leftoverOpen(
                        lot.getOpenLeg(),
                        lot.getRemainingQuantity(),
                        lot.getRemainingAmount(),
                        lot.getStrategy(),
                        lot.getGroupKey()));
            }
        }
        return events;
    }

    private void close(Leg closeLeg, Deque<PositionLot> queue, List<MatchedEvent> events) {
        int remaining = closeLeg.getQuantity();
        BigDecimal remainingCloseAmount = closeLeg.getAmount();

        while (remaining > 0 && !queue.isEmpty()) {
            PositionLot lot = queue.peekFirst();
            int taken = Math.min(remaining, lot.getRemainingQuantity());
            BigDecimal openPortion = lot.consume(taken);
            BigDecimal closePortion = ProportionalSplit.share(remainingCloseAmount, taken, remaining);

            log.debug("Matched {}x {} (open {} @ {}/contract, close {})",
                    taken, lot.getPositionKey(), openPortion, lot.getOpenAmountPerContract(), closePortion);
            events.add(MatchedEvent.matched(
                    lot.getOpenLeg(), closeLeg, taken, openPortion, closePortion, lot.getStrategy(), lot.getGroupKey()));

            remaining -= taken;
            remainingCloseAmount = remainingCloseAmount.subtract(closePortion);
            if (lot.isExhausted()) {
                queue.pollFirst();
            }
        }

        if (remaining > 0) {
            log.warn("Unmatched close of {}x {} on {}: no open lot in the export",
                    remaining, closeLeg.getPositionKey(), closeLeg.getTimestamp().toLocalDate());
            events.add(MatchedEvent.unmatchedClose(
                    closeLeg,
                    remaining,
                    remainingCloseAmount,
                    strategyClassifier.classifySingle(closeLeg.getOptionType(), closeLeg.getSide().opposite())));
        }
    }

    /** Expirations close lots at zero cash flow; whatever they cannot close carries no information. */
    private void expire(Leg expirationLeg, Deque<PositionLot> queue, List<MatchedEvent> events) {
        int remaining = expirationLeg.getQuantity();

        while (remaining > 0 && !queue.isEmpty()) {
            PositionLot lot = queue.peekFirst();
            int taken = Math.min(remaining, lot.getRemainingQuantity());
            BigDecimal openPortion = lot.consume(taken);
            Leg resolved = expirationLeg.toBuilder().side(lot.getOpenSide().opposite()).build();

            events.add(MatchedEvent.matched(
                    lot.getOpenLeg(), resolved, taken, openPortion, BigDecimal.ZERO, lot.getStrategy(), lot.getGroupKey()));

            remaining -= taken;
            if (lot.isExhausted()) {
                queue.pollFirst();
            }
        }

        if (remaining > 0) {
            log.debug("Discarding expiration of {}x {}: nothing open", remaining, expirationLeg.getPositionKey());
        }
    }
}
