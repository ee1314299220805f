package com.tradejournal.exception;

import java.util.Map;

/**
 * A broker row looked like an option trade but one of its fields could not be parsed.
 * Caught per row by the normalization service: the row is skipped, the batch continues.
 */
public class NormalizationException extends BaseException {

    public NormalizationException(String field, String value) {
        super(
                ErrorCode.MALFORMED_ROW,
                String.format("Cannot parse %s: '%s'", field, value),
                Map.of("field", field, "value", String.valueOf(value)));
    }

    public NormalizationException(String field, String value, Throwable cause) {
        super(
                ErrorCode.MALFORMED_ROW,
                String.format("Cannot parse %s: '%s'", field, value),
                Map.of("field", field, "value", String.valueOf(value)),
                cause);
    }
}
