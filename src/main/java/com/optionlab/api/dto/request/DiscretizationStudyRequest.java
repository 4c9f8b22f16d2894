package com.optionlab.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.Data;

/**
 * Request payload for a Monte Carlo discretization study: one option priced at several step
 * counts from shared paths. Every step count must divide the largest one.
 */
@Data
public class DiscretizationStudyRequest {

    @Valid
    @NotNull(message = "option is required")
    private PricingRequest option;

    @NotEmpty(message = "stepCounts must not be empty")
    @Size(max = 20, message = "stepCounts must not exceed 20 entries")
    private List<Integer> stepCounts;
}
