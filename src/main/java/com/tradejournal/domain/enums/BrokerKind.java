package com.tradejournal.domain.enums;

/**
 * Supported brokerage export formats.
 *
 * <p>The two formats differ in how closes relate to opens. TASTYTRADE links every
 * multi-leg order through an explicit order number, so opening legs are grouped exactly
 * and each order becomes one strategy-level trade. ROBINHOOD has no order linkage at all:
 * opening legs are grouped heuristically by underlying and day, and closes are matched
 * against open lots through the FIFO position ledger.
 */
public enum BrokerKind {
    ROBINHOOD(false),
    TASTYTRADE(true);

    private final boolean orderLinked;

    BrokerKind(boolean orderLinked) {
        this.orderLinked = orderLinked;
    }

    /** True when the export links legs of one multi-leg order through an order identifier. */
    public boolean isOrderLinked() {
        return orderLinked;
    }
}
