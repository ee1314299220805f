package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.OptionType;
import com.tradejournal.domain.enums.StrategyType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * A reconstructed logical option trade: the engine's output, consumed by the analytics layer.
 *
 * <p>Credit and debit are both non-negative. Money received across the trade's legs sums into
 * credit, money paid into debit, so a trade may carry both (e.g. opened for a debit and closed
 * for a smaller credit). Net premium = credit - debit.
 *
 * <p>{@code exitDate == null} means the position is still open. {@code incomplete} flags a
 * close whose opening leg is not in the input: its cost basis is unknown and its P&L partial.
 */
@Value
@Builder
public class Trade {

    String symbol;

    /** Null when the trade spans both calls and puts (straddles, strangles, condors). */
    OptionType optionType;

    StrategyType strategy;

    /** Display strike. For multi-strike trades, the middle of {@link #strikes}. */
    BigDecimal strike;

    /** Sorted distinct strikes of all legs. */
    List<BigDecimal> strikes;

    LocalDate expiry;
    int volume;
    LocalDate entryDate;
    LocalDate exitDate;
    BigDecimal debit;
    BigDecimal credit;
    String account;
    boolean incomplete;

    /** Order group this trade was reconstructed from. Null for unmatched closes. */
    String groupKey;

    int legCount;

    public boolean isOpen() {
        return exitDate == null;
    }

    public BigDecimal getNetPremium() {
        return credit.subtract(debit);
    }
}
