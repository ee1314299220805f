package com.tradejournal.domain.enums;

/**
 * Outcome of running a leg through the position ledger.
 * MATCHED = open lot (portion) paired with a close (portion).
 * OPEN = lot quantity still open after the whole batch.
 * UNMATCHED_CLOSE = close quantity with no open lot to pair against (opening leg not in the data).
 */
public enum MatchedEventType {
    MATCHED,
    OPEN,
    UNMATCHED_CLOSE
}
