package com.tradejournal.reconstruction;

import com.tradejournal.domain.model.Leg;
import com.tradejournal.domain.model.OrderGroup;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Picks the grouping key for a batch: exact order ids when every opening leg carries one,
 * otherwise the same-day/underlying heuristic.
 */
@Service
public class OrderGroupingService {

    private static final Logger log = LoggerFactory.getLogger(OrderGroupingService.class);

    private final OrderIdGrouper orderIdGrouper;
    private final SameDayUnderlyingGrouper sameDayUnderlyingGrouper;

    public OrderGroupingService(OrderIdGrouper orderIdGrouper, SameDayUnderlyingGrouper sameDayUnderlyingGrouper) {
        this.orderIdGrouper = orderIdGrouper;
        this.sameDayUnderlyingGrouper = sameDayUnderlyingGrouper;
    }

    public List<OrderGroup> group(List<Leg> legs) {
        List<Leg> openingLegs = legs.stream().filter(Leg::isOpening).toList();
        OrderGrouper grouper = orderIdGrouper.appliesTo(openingLegs) ? orderIdGrouper : sameDayUnderlyingGrouper;

        List<OrderGroup> groups = grouper.group(openingLegs);
        log.debug("Grouped {} opening legs into {} orders using {}",
                openingLegs.size(), groups.size(), grouper.getClass().getSimpleName());
        return groups;
    }
}
