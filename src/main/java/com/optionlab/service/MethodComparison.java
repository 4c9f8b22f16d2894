package com.optionlab.service;

import com.optionlab.domain.enums.PricingMethod;
import com.optionlab.domain.model.PricingResult;

/**
 * One method's outcome in a cross-check. Exactly one of {@code result} and {@code skippedReason}
 * is set; {@code differenceFromReference} is null for the reference itself and for skipped
 * methods.
 */
public record MethodComparison(
        PricingMethod method, PricingResult result, Double differenceFromReference, String skippedReason) {

    static MethodComparison skipped(PricingMethod method, String reason) {
        return new MethodComparison(method, null, null, reason);
    }

    public boolean isSkipped() {
        return result == null;
    }
}
