package com.tradejournal.api.dto.request;

import com.tradejournal.domain.enums.BrokerKind;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One broker export, already split into header-keyed rows by the upload layer.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReconstructionRequest {

    /** Rows in the order the broker exported them. */
    @NotNull
    private List<Map<String, String>> rows;

    /** Export format. Detected from the row headers when null. */
    private BrokerKind broker;

    /** Account label for the trades. The configured per-broker label when null. */
    private String account;
}
