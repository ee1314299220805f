package com.tradejournal.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the reconstruction errors. The {@link ErrorCode} decides the HTTP status at the API
 * boundary; {@code details} is rendered verbatim into the error envelope.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message, Map<String, ?> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, ?> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }
}
