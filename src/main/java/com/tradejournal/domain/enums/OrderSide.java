package com.tradejournal.domain.enums;

/** Buy or sell side of a leg: who initiated the contract transaction. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used to infer the missing half of a pair. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
