package com.tradejournal.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradejournal.exception.BaseException;
import com.tradejournal.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Error envelope: {@code {"success": false, "error": {...}}}. */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    public static ApiErrorResponse of(BaseException exception, String path) {
        return of(exception.getErrorCode(), exception.getMessage(), exception.getDetails(), path);
    }

    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final int status;
        private final String message;

        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        private final Map<String, Object> details;

        private final Instant timestamp;
        private final String path;
    }
}
