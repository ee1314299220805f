package com.tradejournal.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    MALFORMED_ROW("MALFORMED_ROW", 422),
    UNSUPPORTED_FORMAT("UNSUPPORTED_FORMAT", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
