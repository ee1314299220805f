package com.tradejournal.exception;

import com.tradejournal.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures at the API boundary onto {@link ApiErrorResponse}.
 *
 * <p>Row-level parse failures never reach here: they are counted as skipped rows inside the
 * batch. What does arrive is a request the engine cannot start on (bad body, unknown export
 * format) or a genuine bug.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> details.put(error.getField(), error.getDefaultMessage()));
        return respond(ErrorCode.VALIDATION_ERROR, ApiErrorResponse.of(
                ErrorCode.VALIDATION_ERROR, "Validation failed", details, request.getRequestURI()));
    }

    /** Unparseable JSON, or a broker name that is not a {@code BrokerKind}. */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.debug("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(ErrorCode.BAD_REQUEST, ApiErrorResponse.of(
                ErrorCode.BAD_REQUEST, "Malformed request body", null, request.getRequestURI()));
    }

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleBase(BaseException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.getHttpStatus() >= 500) {
            log.error("{} on {}: {}", errorCode.getCode(), request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.warn("{} on {}: {}", errorCode.getCode(), request.getRequestURI(), ex.getMessage());
        }
        return respond(errorCode, ApiErrorResponse.of(ex, request.getRequestURI()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, ApiErrorResponse.of(
                ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request.getRequestURI()));
    }

    private ResponseEntity<ApiErrorResponse> respond(ErrorCode errorCode, ApiErrorResponse body) {
        return ResponseEntity.status(errorCode.getHttpStatus()).body(body);
    }
}
