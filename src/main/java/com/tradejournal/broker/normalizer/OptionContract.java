package com.tradejournal.broker.normalizer;

import com.tradejournal.domain.enums.OptionType;
import java.math.BigDecimal;
import java.time.LocalDate;

/** Contract identity parsed out of a broker option identifier. */
record OptionContract(String underlying, OptionType optionType, BigDecimal strike, LocalDate expiry) {}
