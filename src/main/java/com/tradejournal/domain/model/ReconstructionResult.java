package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.BrokerKind;
import com.tradejournal.domain.enums.StrategyType;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Output of one reconstruction batch: the trades plus the signals a caller needs to warn
 * that P&L figures may be partial (skipped rows, incomplete trades).
 */
@Value
@Builder
public class ReconstructionResult {

    BrokerKind broker;
    String account;
    List<Trade> trades;

    /** Option rows that could not be normalized and were dropped. */
    int skippedRows;

    /** Order groups per classified strategy. */
    Map<StrategyType, Long> strategyCounts;

    public long getIncompleteTrades() {
        return trades.stream().filter(Trade::isIncomplete).count();
    }

    public long getOpenTrades() {
        return trades.stream().filter(Trade::isOpen).count();
    }

    public long getClosedTrades() {
        return trades.size() - getOpenTrades();
    }
}
