package com.optionlab.payoff;

import com.optionlab.domain.enums.PayoffKind;

public record VanillaCall(double strike) implements TerminalPayoff {

    public VanillaCall {
        PayoffFactory.requireNonNegative(strike, "strike");
    }

    @Override
    public PayoffKind kind() {
        return PayoffKind.VANILLA_CALL;
    }

    @Override
    public double evaluate(double terminalPrice) {
        return Math.max(terminalPrice - strike, 0.0);
    }

    @Override
    public double averageOver(double from, double to) {
        if (to <= from) {
            return evaluate(from);
        }
        if (to <= strike) {
            return 0.0;
        }
        double inTheMoneyFrom = Math.max(from, strike);
        double area = 0.5 * ((to - strike) * (to - strike) - (inTheMoneyFrom - strike) * (inTheMoneyFrom - strike));
        return area / (to - from);
    }

    /** Deep in the money a call behaves like a forward: S e^(-q tau) - K e^(-r tau). */
    @Override
    public double upperBoundary(double maxPrice, double tau, double riskFreeRate, double dividendYield) {
        return Math.max(maxPrice * Math.exp(-dividendYield * tau) - strike * Math.exp(-riskFreeRate * tau), 0.0);
    }
}
