package com.optionlab.mapper;

import com.optionlab.api.dto.response.ComparisonResponse;
import com.optionlab.api.dto.response.MethodComparisonResponse;
import com.optionlab.api.dto.response.PricingResponse;
import com.optionlab.domain.model.ConvergenceWarning;
import com.optionlab.domain.model.PricingResult;
import com.optionlab.service.ComparisonReport;
import com.optionlab.service.MethodComparison;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper from pricing outcomes to response DTOs.
 *
 * <p>Warnings are flattened to their messages. A comparison report exposes the option as its
 * exercise style, payoff kind and strike instead of the payoff variant itself.
 */
@Mapper
public interface PricingResultMapper {

    @Mapping(source = "warnings", target = "warnings", qualifiedByName = "warningMessages")
    PricingResponse toResponse(PricingResult result);

    List<PricingResponse> toResponseList(List<PricingResult> results);

    @Mapping(source = "option.exerciseStyle", target = "exerciseStyle")
    @Mapping(source = "option.payoffKind", target = "payoffKind")
    @Mapping(source = "option.strike", target = "strike")
    ComparisonResponse toComparisonResponse(ComparisonReport report);

    @Mapping(target = "skipped", expression = "java(comparison.isSkipped())")
    MethodComparisonResponse toMethodComparisonResponse(MethodComparison comparison);

    @Named("warningMessages")
    default List<String> warningMessages(List<ConvergenceWarning> warnings) {
        if (warnings == null) {
            return List.of();
        }
        return warnings.stream().map(ConvergenceWarning::message).toList();
    }
}
