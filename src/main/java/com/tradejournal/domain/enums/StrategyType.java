package com.tradejournal.domain.enums;

/**
 * Strategy shapes the classifier can recognise from the opening legs of one order.
 * Single-leg shapes are named from the trader's side (LONG_CALL = bought call).
 * CUSTOM is the explicit "could not classify" outcome and is never an error.
 */
public enum StrategyType {
    LONG_CALL("Long Call"),
    SHORT_CALL("Short Call"),
    LONG_PUT("Long Put"),
    SHORT_PUT("Short Put"),
    BULL_CALL_SPREAD("Bull Call Spread"),
    BEAR_CALL_SPREAD("Bear Call Spread"),
    BULL_PUT_SPREAD("Bull Put Spread"),
    BEAR_PUT_SPREAD("Bear Put Spread"),
    STRADDLE("Straddle"),
    STRANGLE("Strangle"),
    IRON_CONDOR("Iron Condor"),
    CUSTOM("Custom");

    private final String displayName;

    StrategyType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
