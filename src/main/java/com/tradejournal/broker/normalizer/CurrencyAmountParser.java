package com.tradejournal.broker.normalizer;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Parses broker currency strings into a signed decimal.
 *
 * <p>Handles the formats seen across exports:
 * <ul>
 *   <li>{@code $42.94} -> 42.94, {@code $1,234.50} -> 1234.50</li>
 *   <li>{@code ($70.04)} -> -70.04 (parentheses mean negative)</li>
 *   <li>{@code -70.04} -> -70.04</li>
 *   <li>{@code 1.22 cr} -> 1.22, {@code 0.37 db} -> -0.37</li>
 *   <li>blank -> 0</li>
 * </ul>
 */
final class CurrencyAmountParser {

    private CurrencyAmountParser() {}

    /**
     * @throws NumberFormatException when the value is not blank and not a recognisable amount
     */
    static BigDecimal parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return BigDecimal.ZERO;
        }

        String cleaned = raw.trim().toLowerCase(Locale.ROOT).replace("$", "").replace(",", "");
        boolean negative = false;

        if (cleaned.endsWith("db")) {
            negative = true;
            cleaned = cleaned.substring(0, cleaned.length() - 2).trim();
        } else if (cleaned.endsWith("cr")) {
            cleaned = cleaned.substring(0, cleaned.length() - 2).trim();
        }

        if (cleaned.startsWith("(") && cleaned.endsWith(")")) {
            negative = !negative;
            cleaned = cleaned.substring(1, cleaned.length() - 1).trim();
        }

        BigDecimal value = new BigDecimal(cleaned);
        return negative ? value.negate() : value;
    }
}
