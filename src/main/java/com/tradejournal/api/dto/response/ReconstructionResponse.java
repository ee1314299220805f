package com.tradejournal.api.dto.response;

import com.tradejournal.domain.enums.BrokerKind;
import com.tradejournal.domain.enums.StrategyType;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Trades of one export plus the counts the journal uses to warn that P&L may be partial
 * (skipped rows, incomplete trades).
 */
@Data
public class ReconstructionResponse {

    private BrokerKind broker;
    private String account;
    private int totalTrades;
    private long openTrades;
    private long closedTrades;
    private long incompleteTrades;
    private int skippedRows;
    private Map<StrategyType, Long> strategyCounts;
    private List<TradeResponse> trades;
}
