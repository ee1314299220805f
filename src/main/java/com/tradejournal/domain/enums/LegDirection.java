package com.tradejournal.domain.enums;

/** Whether a leg opens a new position or closes (part of) an existing one. */
public enum LegDirection {
    OPEN,
    CLOSE
}
