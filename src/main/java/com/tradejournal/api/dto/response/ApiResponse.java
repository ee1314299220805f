package com.tradejournal.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import lombok.Getter;

/**
 * Success envelope for every {@code /api} response.
 *
 * <p>{@code warnings} tells the client the data is usable but partial, e.g. rows that were
 * skipped or trades whose cost basis is unknown. Omitted when empty.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final List<String> warnings;

    private final Instant timestamp = Instant.now();

    private ApiResponse(T data, List<String> warnings) {
        this.data = data;
        this.warnings = List.copyOf(warnings);
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data, List.of());
    }

    public static <T> ApiResponse<T> of(T data, List<String> warnings) {
        return new ApiResponse<>(data, warnings);
    }
}
