package com.tradejournal.mapper;

import com.tradejournal.api.dto.response.ReconstructionResponse;
import com.tradejournal.api.dto.response.TradeResponse;
import com.tradejournal.domain.enums.OptionType;
import com.tradejournal.domain.enums.StrategyType;
import com.tradejournal.domain.model.ReconstructionResult;
import com.tradejournal.domain.model.Trade;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper from reconstruction results to API responses.
 *
 * <p>Enums are rendered with their journal labels ("Put", "Iron Condor"); the raw strategy
 * enum is kept alongside as {@code strategyType} for filtering on the client.
 */
@Mapper
public interface ReconstructionMapper {

    String MIXED_OPTION_TYPE = "Mixed";

    @Mapping(target = "optionType", source = "optionType", qualifiedByName = "optionTypeLabel")
    @Mapping(target = "strategy", source = "strategy", qualifiedByName = "strategyLabel")
    @Mapping(target = "strategyType", source = "strategy")
    TradeResponse toResponse(Trade trade);

    List<TradeResponse> toResponseList(List<Trade> trades);

    @Mapping(target = "totalTrades", expression = "java(result.getTrades().size())")
    ReconstructionResponse toResponse(ReconstructionResult result);

    @Named("optionTypeLabel")
    default String optionTypeLabel(OptionType optionType) {
        return optionType != null ? optionType.getLabel() : MIXED_OPTION_TYPE;
    }

    @Named("strategyLabel")
    default String strategyLabel(StrategyType strategy) {
        return strategy != null ? strategy.getDisplayName() : null;
    }
}
