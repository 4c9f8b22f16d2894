package com.optionlab.payoff;

import com.optionlab.domain.enums.PayoffKind;
import com.optionlab.domain.model.PricePath;

/** Arithmetic-average-price call: max(mean(path) - K, 0), the initial price included in the mean. */
public record AsianCall(double strike) implements Payoff {

    public AsianCall {
        PayoffFactory.requireNonNegative(strike, "strike");
    }

    @Override
    public PayoffKind kind() {
        return PayoffKind.ASIAN_CALL;
    }

    @Override
    public boolean pathDependent() {
        return true;
    }

    @Override
    public double evaluate(PricePath path) {
        return Math.max(path.average() - strike, 0.0);
    }
}
