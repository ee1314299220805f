package com.tradejournal.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tradejournal.domain.enums.LegDirection;
import com.tradejournal.domain.enums.OptionType;
import com.tradejournal.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One normalized option transaction, independent of the broker export it came from.
 *
 * <p>Quantity is always positive; {@link #direction} and {@link #side} carry the sign semantics.
 * Sell-to-open pairs economically with buy-to-close, buy-to-open with sell-to-close.
 *
 * <p>Amount is the signed cash flow of this transaction: positive = money received,
 * negative = money paid.
 *
 * <p>Expiration legs are CLOSE legs with a zero amount and a null side. Which side closed
 * the contract is only known once the ledger sees the lot being expired.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Leg {

    String underlying;
    OptionType optionType;
    BigDecimal strike;
    LocalDate expiry;
    LegDirection direction;

    /** Null only for expiration legs. */
    OrderSide side;

    int quantity;
    BigDecimal amount;
    LocalDateTime timestamp;

    /** Broker order identifier linking legs of one multi-leg order. Null when the broker has none. */
    String orderKey;

    boolean expiration;

    /**
     * Identifies a fungible contract line regardless of which order opened it:
     * {@code underlying|strike|optionType|expiry}. Strike is rendered without trailing zeros
     * so "500.00" and "500" resolve to the same key.
     */
    @JsonIgnore
    public String getPositionKey() {
        return underlying + "|" + strike.stripTrailingZeros().toPlainString() + "|" + optionType + "|" + expiry;
    }

    @JsonIgnore
    public boolean isOpening() {
        return direction == LegDirection.OPEN;
    }
}
