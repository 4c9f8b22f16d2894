package com.optionlab.api.dto.response;

import com.optionlab.domain.enums.ExerciseStyle;
import com.optionlab.domain.enums.PayoffKind;
import com.optionlab.domain.enums.PricingMethod;
import com.optionlab.domain.model.MarketParameters;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * DTO for the cross-check endpoint: one option valued by every applicable method.
 *
 * <p>{@code referenceMethod} and {@code referenceValue} are null for path-dependent payoffs,
 * which have neither a closed form nor a PDE solution.
 */
@Data
@Builder
public class ComparisonResponse {

    private MarketParameters market;
    private ExerciseStyle exerciseStyle;
    private PayoffKind payoffKind;

    /** Strike of the payoff; the lower bound for cash-or-nothing windows. */
    private Double strike;

    private PricingMethod referenceMethod;
    private Double referenceValue;
    private List<MethodComparisonResponse> comparisons;
}
