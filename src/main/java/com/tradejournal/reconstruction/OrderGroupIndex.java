package com.tradejournal.reconstruction;

import com.tradejournal.domain.model.Leg;
import com.tradejournal.domain.model.OrderGroup;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the order group an opening leg was classified in, so lots and closes inherit the
 * group's strategy without re-classifying. Keyed by leg identity: two identical fills in
 * different orders stay apart.
 */
final class OrderGroupIndex {

    private final Map<Leg, OrderGroup> groupsByLeg = new IdentityHashMap<>();

    private OrderGroupIndex() {}

    static OrderGroupIndex of(List<OrderGroup> groups) {
        OrderGroupIndex index = new OrderGroupIndex();
        for (OrderGroup group : groups) {
            for (Leg leg : group.getLegs()) {
                index.groupsByLeg.put(leg, group);
            }
        }
        return index;
    }

    OrderGroup groupOf(Leg openingLeg) {
        OrderGroup group = groupsByLeg.get(openingLeg);
        if (group == null) {
            throw new IllegalStateException("Opening leg was not grouped: " + openingLeg.getPositionKey());
        }
        return group;
    }
}
