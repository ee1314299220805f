package com.tradejournal.reconstruction;

import com.tradejournal.domain.enums.OptionType;
import com.tradejournal.domain.enums.OrderSide;
import com.tradejournal.domain.enums.StrategyType;
import com.tradejournal.domain.model.Leg;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Classifies the opening legs of one order into a {@link StrategyType}.
 *
 * <p>Total over all inputs: any shape it does not recognise is {@link StrategyType#CUSTOM}.
 * Rules, in order:
 * <ol>
 *   <li>1 leg: long/short call/put from type and side.</li>
 *   <li>2 legs, same type, one long one short: vertical spread. A spread is bullish when it
 *       profits from the underlying rising: long the lower call strike, or short the higher
 *       put strike.</li>
 *   <li>2 legs, one call one put: straddle at equal strikes, otherwise strangle. Sides are
 *       not compared.</li>
 *   <li>4 legs, two calls and two puts, exactly one long and one short of each: iron condor.</li>
 * </ol>
 *
 * <p>Legs are counted as given: two fills of one contract in the same order are a two-leg shape.
 */
@Component
public class StrategyClassifier {

    public StrategyType classify(List<Leg> openingLegs) {
        if (openingLegs == null || openingLegs.isEmpty()) {
            return StrategyType.CUSTOM;
        }
        return classify(LegShape.of(openingLegs));
    }

    /** Single-contract strategy for a given type and opening side. */
    public StrategyType classifySingle(OptionType optionType, OrderSide side) {
        if (optionType == OptionType.CALL) {
            return side == OrderSide.BUY ? StrategyType.LONG_CALL : StrategyType.SHORT_CALL;
        }
        return side == OrderSide.BUY ? StrategyType.LONG_PUT : StrategyType.SHORT_PUT;
    }

    StrategyType classify(LegShape shape) {
        if (shape instanceof LegShape.SingleLeg single) {
            if (single.optionType() == null || single.side() == null) {
                return StrategyType.CUSTOM;
            }
            return classifySingle(single.optionType(), single.side());
        }
        if (shape instanceof LegShape.Vertical vertical) {
            int longVsShort = vertical.longStrike().compareTo(vertical.shortStrike());
            if (vertical.optionType() == OptionType.CALL) {
                return longVsShort < 0 ? StrategyType.BULL_CALL_SPREAD : StrategyType.BEAR_CALL_SPREAD;
            }
            return longVsShort > 0 ? StrategyType.BEAR_PUT_SPREAD : StrategyType.BULL_PUT_SPREAD;
        }
        if (shape instanceof LegShape.CallPutPair pair) {
            return pair.callStrike().compareTo(pair.putStrike()) == 0 ? StrategyType.STRADDLE : StrategyType.STRANGLE;
        }
        if (shape instanceof LegShape.FourLeg fourLeg && fourLeg.isBalanced()) {
            return StrategyType.IRON_CONDOR;
        }
        return StrategyType.CUSTOM;
    }
}
