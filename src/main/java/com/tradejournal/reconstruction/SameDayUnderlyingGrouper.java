package com.tradejournal.reconstruction;

import com.tradejournal.domain.model.Leg;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Heuristic grouping for exports without order linkage: every opening leg on the same
 * underlying entered on the same calendar day is taken as one strategy.
 *
 * <p>Known imprecision: two unrelated single-leg opens on one underlying and day are merged and
 * classified as one multi-leg strategy. The export carries nothing that would tell them apart.
 */
@Component
public class SameDayUnderlyingGrouper extends OrderGrouper {

    public SameDayUnderlyingGrouper(StrategyClassifier strategyClassifier) {
        super(strategyClassifier);
    }

    @Override
    public boolean appliesTo(List<Leg> openingLegs) {
        return true;
    }

    @Override
    protected String groupKey(Leg leg) {
        return leg.getUnderlying() + "|" + leg.getTimestamp().toLocalDate();
    }
}
