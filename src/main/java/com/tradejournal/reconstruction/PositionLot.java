package com.tradejournal.reconstruction;

import com.tradejournal.domain.enums.OrderSide;
import com.tradejournal.domain.enums.StrategyType;
import com.tradejournal.domain.model.Leg;
import com.tradejournal.domain.model.OrderGroup;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Remaining open quantity of one opening leg, queued per position key inside the ledger.
 * Mutable, and only ever touched by the ledger call that created it.
 */
final class PositionLot {

    private final Leg openLeg;
    private final OrderGroup group;
    private int remainingQuantity;
    private BigDecimal remainingAmount;

    PositionLot(Leg openLeg, OrderGroup group) {
        this.openLeg = openLeg;
        this.group = group;
        this.remainingQuantity = openLeg.getQuantity();
        this.remainingAmount = openLeg.getAmount();
    }

    /**
     * Takes {@code quantity} contracts off the lot and returns their share of the open amount.
     * Taking the last contracts returns whatever amount is left, so shares sum to the original.
     */
    BigDecimal consume(int quantity) {
        if (quantity <= 0 || quantity > remainingQuantity) {
            throw new IllegalArgumentException(
                    "Cannot consume " + quantity + " of " + remainingQuantity + " on " + getPositionKey());
        }
        BigDecimal portion = ProportionalSplit.share(remainingAmount, quantity, remainingQuantity);
        remainingQuantity -= quantity;
        remainingAmount = remainingAmount.subtract(portion);
        return portion;
    }

    boolean isExhausted() {
        return remainingQuantity == 0;
    }

    Leg getOpenLeg() {
        return openLeg;
    }

    String getPositionKey() {
        return openLeg.getPositionKey();
    }

    OrderSide getOpenSide() {
        return openLeg.getSide();
    }

    BigDecimal getOpenAmountPerContract() {
        return openLeg.getAmount().divide(BigDecimal.valueOf(openLeg.getQuantity()), 4, RoundingMode.HALF_UP);
    }

    int getRemainingQuantity() {
        return remainingQuantity;
    }

    BigDecimal getRemainingAmount() {
        return remainingAmount;
    }

    StrategyType getStrategy() {
        return group.getStrategy();
    }

    String getGroupKey() {
        return group.getGroupKey();
    }
}
