package com.optionlab.payoff;

import com.optionlab.domain.enums.PayoffKind;
import com.optionlab.domain.model.PricePath;

/**
 * Fixed-strike lookback call: max(max(path) - K, 0). Sampling the path more finely can only raise
 * the observed maximum, so discrete monitoring underprices the continuous contract.
 */
public record LookbackCall(double strike) implements Payoff {

    public LookbackCall {
        PayoffFactory.requireNonNegative(strike, "strike");
    }

    @Override
    public PayoffKind kind() {
        return PayoffKind.LOOKBACK_CALL;
    }

    @Override
    public boolean pathDependent() {
        return true;
    }

    @Override
    public double evaluate(PricePath path) {
        return Math.max(path.maximum() - strike, 0.0);
    }
}
