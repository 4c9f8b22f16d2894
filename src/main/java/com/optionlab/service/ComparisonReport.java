package com.optionlab.service;

import com.optionlab.domain.enums.PricingMethod;
import com.optionlab.domain.model.MarketParameters;
import com.optionlab.domain.model.OptionSpec;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * Side-by-side valuation of one option by every applicable method. The reference is the closed
 * form when one exists, otherwise the PDE solution, otherwise (path-dependent payoffs) there is
 * none.
 */
@Value
@Builder
public class ComparisonReport {

    MarketParameters market;
    OptionSpec option;
    PricingMethod referenceMethod;
    Double referenceValue;
    List<MethodComparison> comparisons;

    public Optional<MethodComparison> find(PricingMethod method) {
        return comparisons.stream().filter(c -> c.method() == method).findFirst();
    }
}
