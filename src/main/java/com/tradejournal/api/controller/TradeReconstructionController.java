package com.tradejournal.api.controller;

import com.tradejournal.api.dto.request.ReconstructionRequest;
import com.tradejournal.api.dto.response.ReconstructionResponse;
import com.tradejournal.domain.model.ReconstructionResult;
import com.tradejournal.mapper.ReconstructionMapper;
import com.tradejournal.reconstruction.TradeReconstructionService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for reconstructing trades from a broker transaction export.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/trades/reconstruct} -- rows of one export in, trades and counts out</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/trades")
public class TradeReconstructionController {

    private final TradeReconstructionService tradeReconstructionService;
    private final ReconstructionMapper reconstructionMapper;

    public TradeReconstructionController(
            TradeReconstructionService tradeReconstructionService, ReconstructionMapper reconstructionMapper) {
        this.tradeReconstructionService = tradeReconstructionService;
        this.reconstructionMapper = reconstructionMapper;
    }

    @PostMapping("/reconstruct")
    public ReconstructionResponse reconstruct(@Valid @RequestBody ReconstructionRequest request) {
        ReconstructionResult result =
                tradeReconstructionService.reconstruct(request.getRows(), request.getBroker(), request.getAccount());
        return reconstructionMapper.toResponse(result);
    }
}
