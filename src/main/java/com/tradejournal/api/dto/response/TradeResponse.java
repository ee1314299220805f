package com.tradejournal.api.dto.response;

import com.tradejournal.domain.enums.StrategyType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Data;

/**
 * A reconstructed trade as shown in the trade journal.
 * {@code optionType} is "Mixed" for trades spanning calls and puts.
 */
@Data
public class TradeResponse {

    private String symbol;
    private String optionType;
    private String strategy;
    private StrategyType strategyType;
    private BigDecimal strike;
    private List<BigDecimal> strikes;
    private LocalDate expiry;
    private int volume;
    private LocalDate entryDate;
    private LocalDate exitDate;
    private BigDecimal debit;
    private BigDecimal credit;
    private BigDecimal netPremium;
    private String account;
    private boolean incomplete;
    private boolean open;
    private String groupKey;
    private int legCount;
}
