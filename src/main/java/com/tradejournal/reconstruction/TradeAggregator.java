package com.tradejournal.reconstruction;

import com.tradejournal.domain.enums.OptionType;
import com.tradejournal.domain.model.Leg;
import com.tradejournal.domain.model.MatchedEvent;
import com.tradejournal.domain.model.OrderGroup;
import com.tradejournal.domain.model.Trade;
import com.tradejournal.reconstruction.OrderLinkedReconciler.GroupActivity;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Turns matched events and reconciled order groups into {@link Trade}s.
 *
 * <p>Economics follow the sign of each amount: money received sums into credit, money paid
 * into debit. Both stay non-negative.
 */
@Component
public class TradeAggregator {

    /**
     * One trade per ledger event. Volume is the contracts the event covers, which may be less
     * than either source leg after a partial-fill split.
     */
    public Trade aggregate(MatchedEvent event, String account) {
        List<BigDecimal> amounts = List.of(event.getOpenAmount(), event.getCloseAmount());

        return switch (event.getType()) {
            case MATCHED -> fromLeg(event.getOpenLeg(), amounts)
                    .volume(event.getQuantity())
                    .strategy(event.getStrategy())
                    .entryDate(event.getOpenLeg().getTimestamp().toLocalDate())
                    .exitDate(event.getCloseLeg().getTimestamp().toLocalDate())
                    .account(account)
                    .groupKey(event.getGroupKey())
                    .build();
            case OPEN -> fromLeg(event.getOpenLeg(), amounts)
                    .volume(event.getQuantity())
                    .strategy(event.getStrategy())
                    .entryDate(event.getOpenLeg().getTimestamp().toLocalDate())
                    .account(account)
                    .groupKey(event.getGroupKey())
                    .build();
            // Entry is unknown, so it is reported as the close date.
            case UNMATCHED_CLOSE -> fromLeg(event.getCloseLeg(), amounts)
                    .volume(event.getQuantity())
                    .strategy(event.getStrategy())
                    .entryDate(event.getCloseLeg().getTimestamp().toLocalDate())
                    .exitDate(event.getCloseLeg().getTimestamp().toLocalDate())
                    .account(account)
                    .incomplete(true)
                    .build();
        };
    }

    /**
     * One strategy-level trade per order group. The trade exits on the latest close date, and
     * only once every contract the group opened has been closed.
     */
    public Trade aggregateGroup(GroupActivity activity, String account) {
        OrderGroup group = activity.group();
        List<Leg> legs = group.getLegs();
        Leg first = legs.get(0);

        List<BigDecimal> amounts = new ArrayList<>();
        legs.forEach(leg -> amounts.add(leg.getAmount()));
        activity.closes().forEach(close -> amounts.add(close.getCloseAmount()));

        List<BigDecimal> strikes = List.copyOf(
                legs.stream().map(Leg::getStrike).collect(Collectors.toCollection(TreeSet::new)));

        Set<OptionType> types = legs.stream().map(Leg::getOptionType).collect(Collectors.toSet());

        LocalDate exitDate = activity.isFullyClosed()
                ? activity.closes().stream()
                        .map(close -> close.getCloseLeg().getTimestamp().toLocalDate())
                        .max(Comparator.naturalOrder())
                        .orElse(null)
                : null;

        return Trade.builder()
                .symbol(first.getUnderlying())
                .optionType(types.size() == 1 ? first.getOptionType() : null)
                .strategy(group.getStrategy())
                .strike(strikes.get(strikes.size() / 2))
                .strikes(strikes)
                .expiry(first.getExpiry())
                .volume(first.getQuantity())
                .entryDate(legs.stream()
                        .map(leg -> leg.getTimestamp().toLocalDate())
                        .min(Comparator.naturalOrder())
                        .orElseThrow())
                .exitDate(exitDate)
                .credit(credit(amounts.stream()))
                .debit(debit(amounts.stream()))
                .account(account)
                .groupKey(group.getGroupKey())
                .legCount(legs.size())
                .build();
    }

    private Trade.TradeBuilder fromLeg(Leg leg, List<BigDecimal> amounts) {
        return Trade.builder()
                .symbol(leg.getUnderlying())
                .optionType(leg.getOptionType())
                .strike(leg.getStrike())
                .strikes(List.of(leg.getStrike()))
                .expiry(leg.getExpiry())
                .credit(credit(amounts.stream()))
                .debit(debit(amounts.stream()))
                .legCount(1);
    }

    private static BigDecimal credit(Stream<BigDecimal> amounts) {
        return amounts.filter(amount -> amount.signum() > 0).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal debit(Stream<BigDecimal> amounts) {
        return amounts.filter(amount -> amount.signum() < 0).map(BigDecimal::negate).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
