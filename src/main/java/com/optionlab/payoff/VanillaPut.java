package com.optionlab.payoff;

import com.optionlab.domain.enums.PayoffKind;

public record VanillaPut(double strike) implements TerminalPayoff {

    public VanillaPut {
        PayoffFactory.requireNonNegative(strike, "strike");
    }

    @Override
    public PayoffKind kind() {
        return PayoffKind.VANILLA_PUT;
    }

    @Override
    public double evaluate(double terminalPrice) {
        return Math.max(strike - terminalPrice, 0.0);
    }

    @Override
    public double averageOver(double from, double to) {
        if (to <= from) {
            return evaluate(from);
        }
        if (from >= strike) {
            return 0.0;
        }
        double inTheMoneyTo = Math.min(to, strike);
        double area = 0.5 * ((strike - from) * (strike - from) - (strike - inTheMoneyTo) * (strike - inTheMoneyTo));
        return area / (to - from);
    }
}
