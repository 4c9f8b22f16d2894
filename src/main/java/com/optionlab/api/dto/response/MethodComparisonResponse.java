package com.optionlab.api.dto.response;

import com.optionlab.domain.enums.PricingMethod;
import lombok.Builder;
import lombok.Data;

/**
 * One row of a {@link ComparisonResponse}. Skipped methods carry a reason instead of a result.
 */
@Data
@Builder
public class MethodComparisonResponse {

    private PricingMethod method;
    private boolean skipped;
    private PricingResponse result;
    private Double differenceFromReference;
    private String skippedReason;
}
