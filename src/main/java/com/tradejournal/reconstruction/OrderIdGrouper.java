package com.tradejournal.reconstruction;

import com.tradejournal.domain.model.Leg;
import java.util.List;
import org.springframework.stereotype.Component;

/** Exact grouping by the broker's order identifier. */
@Component
public class OrderIdGrouper extends OrderGrouper {

    public OrderIdGrouper(StrategyClassifier strategyClassifier) {
        super(strategyClassifier);
    }

    @Override
    public boolean appliesTo(List<Leg> openingLegs) {
        return !openingLegs.isEmpty() && openingLegs.stream().allMatch(leg -> leg.getOrderKey() != null);
    }

    @Override
    protected String groupKey(Leg leg) {
        return leg.getOrderKey();
    }
}
