package com.tradejournal.broker.normalizer;

import com.tradejournal.domain.enums.OptionType;
import com.tradejournal.exception.NormalizationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the two option identifier styles the supported brokers use.
 *
 * <p><b>OCC code</b> (Tastytrade): root symbol padded to six characters, expiry as
 * {@code yyMMdd}, {@code C}/{@code P}, then strike x 1000 as eight digits.
 * Example: {@code SPY   250606P00500000} = SPY 2025-06-06 500 put.
 *
 * <p><b>Description</b> (Robinhood): {@code SYMBOL M/D/YYYY Call|Put $Strike}.
 * Example: {@code QQQ 4/11/2025 Call $460.00}.
 */
final class OptionSymbolParser {

    private static final Pattern OCC_PATTERN = Pattern.compile("^([A-Z0-9./]+)\\s*(\\d{6})([CP])(\\d{8})$");
    private static final DateTimeFormatter OCC_EXPIRY = DateTimeFormatter.ofPattern("yyMMdd");
    private static final DateTimeFormatter DESCRIPTION_EXPIRY = DateTimeFormatter.ofPattern("M/d/yyyy");
    private static final BigDecimal OCC_STRIKE_DIVISOR = BigDecimal.valueOf(1000);

    private OptionSymbolParser() {}

    static OptionContract parseOcc(String symbol) {
        if (symbol == null) {
            throw new NormalizationException("option symbol", null);
        }
        Matcher matcher = OCC_PATTERN.matcher(symbol.trim());
        if (!matcher.matches()) {
            throw new NormalizationException("option symbol", symbol);
        }
        try {
            LocalDate expiry = LocalDate.parse(matcher.group(2), OCC_EXPIRY);
            OptionType optionType = OptionType.fromLabel(matcher.group(3));
            BigDecimal strike = new BigDecimal(matcher.group(4)).divide(OCC_STRIKE_DIVISOR).stripTrailingZeros();
            return new OptionContract(matcher.group(1), optionType, normalizeScale(strike), expiry);
        } catch (DateTimeParseException e) {
            throw new NormalizationException("option symbol", symbol, e);
        }
    }

    static OptionContract parseDescription(String description) {
        if (description == null) {
            throw new NormalizationException("option description", null);
        }
        String[] parts = description.trim().split("\\s+");
        if (parts.length < 4) {
            throw new NormalizationException("option description", description);
        }

        OptionType optionType = OptionType.fromLabel(parts[2]);
        if (optionType == null) {
            throw new NormalizationException("option description", description);
        }

        try {
            LocalDate expiry = LocalDate.parse(parts[1], DESCRIPTION_EXPIRY);
            BigDecimal strike = new BigDecimal(parts[3].replace("$", "").replace(",", ""));
            return new OptionContract(parts[0], optionType, normalizeScale(strike), expiry);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new NormalizationException("option description", description, e);
        }
    }

    /** Keeps strikes at two decimals so the same contract compares equal across formats. */
    private static BigDecimal normalizeScale(BigDecimal strike) {
        return strike.setScale(Math.max(2, strike.stripTrailingZeros().scale()));
    }
}
