package com.tradejournal.broker.normalizer;

import com.tradejournal.exception.NormalizationException;
import java.math.BigDecimal;
import java.util.Map;

/** Field access over raw export rows, tolerant of header whitespace. */
final class RowFields {

    private RowFields() {}

    /** Returns the trimmed value, or null when the column is missing or blank. */
    static String get(Map<String, String> row, String header) {
        String value = row.get(header);
        if (value == null) {
            for (Map.Entry<String, String> entry : row.entrySet()) {
                if (entry.getKey() != null && entry.getKey().trim().equalsIgnoreCase(header)) {
                    value = entry.getValue();
                    break;
                }
            }
        }
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    /** Contract count as a positive integer. Tolerates a sign and a trailing unit letter ("1S"). */
    static int quantity(Map<String, String> row, String header) {
        String raw = get(row, header);
        if (raw == null) {
            throw new NormalizationException(header, null);
        }
        String digits = raw.replaceAll("[^0-9.]", "");
        try {
            int quantity = new BigDecimal(digits).intValueExact();
            if (quantity <= 0) {
                throw new NormalizationException(header, raw);
            }
            return quantity;
        } catch (NumberFormatException | ArithmeticException e) {
            throw new NormalizationException(header, raw, e);
        }
    }

    static BigDecimal amount(Map<String, String> row, String header) {
        String raw = get(row, header);
        try {
            return CurrencyAmountParser.parse(raw);
        } catch (NumberFormatException e) {
            throw new NormalizationException(header, raw, e);
        }
    }
}
