package com.tradejournal.reconstruction;

import com.tradejournal.domain.enums.OptionType;
import com.tradejournal.domain.enums.OrderSide;
import com.tradejournal.domain.model.Leg;
import java.math.BigDecimal;
import java.util.List;

/**
 * Structural descriptor of an order's opening legs: leg count, call/put mix, buy/sell mix and
 * strike relation, reduced to the handful of shapes the classifier distinguishes.
 *
 * <p>Every leg counts, including repeated fills of the same contract.
 */
interface LegShape {

    /** One contract bought or sold. */
    record SingleLeg(OptionType optionType, OrderSide side) implements LegShape {}

    /** Two contracts of the same type, one bought and one sold. */
    record Vertical(OptionType optionType, BigDecimal longStrike, BigDecimal shortStrike) implements LegShape {}

    /** One call and one put, any sides. */
    record CallPutPair(BigDecimal callStrike, BigDecimal putStrike) implements LegShape {}

    /** Two calls and two puts with their buy/sell counts. */
    record FourLeg(int callBuys, int callSells, int putBuys, int putSells) implements LegShape {

        boolean isBalanced() {
            return callBuys == 1 && callSells == 1 && putBuys == 1 && putSells == 1;
        }
    }

    record Unrecognized(int legCount) implements LegShape {}

    static LegShape of(List<Leg> legs) {
        int calls = count(legs, OptionType.CALL, null);
        int puts = count(legs, OptionType.PUT, null);

        switch (legs.size()) {
            case 1 -> {
                Leg leg = legs.get(0);
                return new SingleLeg(leg.getOptionType(), leg.getSide());
            }
            case 2 -> {
                if (calls == 1 && puts == 1) {
                    return new CallPutPair(strikeOf(legs, OptionType.CALL, null), strikeOf(legs, OptionType.PUT, null));
                }
                OptionType type = calls == 2 ? OptionType.CALL : OptionType.PUT;
                BigDecimal longStrike = strikeOf(legs, type, OrderSide.BUY);
                BigDecimal shortStrike = strikeOf(legs, type, OrderSide.SELL);
                if (longStrike == null || shortStrike == null) {
                    return new Unrecognized(2);
                }
                return new Vertical(type, longStrike, shortStrike);
            }
            case 4 -> {
                if (calls != 2 || puts != 2) {
                    return new Unrecognized(4);
                }
                return new FourLeg(
                        count(legs, OptionType.CALL, OrderSide.BUY),
                        count(legs, OptionType.CALL, OrderSide.SELL),
                        count(legs, OptionType.PUT, OrderSide.BUY),
                        count(legs, OptionType.PUT, OrderSide.SELL));
            }
            default -> {
                return new Unrecognized(legs.size());
            }
        }
    }

    private static int count(List<Leg> legs, OptionType type, OrderSide side) {
        return (int) legs.stream()
                .filter(leg -> leg.getOptionType() == type)
                .filter(leg -> side == null || leg.getSide() == side)
                .count();
    }

    private static BigDecimal strikeOf(List<Leg> legs, OptionType type, OrderSide side) {
        return legs.stream()
                .filter(leg -> leg.getOptionType() == type)
                .filter(leg -> side == null || leg.getSide() == side)
                .map(Leg::getStrike)
                .findFirst()
                .orElse(null);
    }
}
