package com.optionlab.payoff;

import com.optionlab.domain.enums.PayoffKind;
import com.optionlab.exception.InvalidParameterException;

/**
 * Pays {@code amount} when the terminal price lies in (lowerBound, upperBound], nothing otherwise.
 * An infinite upper bound gives a plain cash-or-nothing call; a lower bound of zero with a finite
 * upper bound gives a cash-or-nothing put.
 *
 * <p>The strike reported for this payoff is the lower bound.
 */
public record CashOrNothing(double lowerBound, double upperBound, double amount) implements TerminalPayoff {

    public CashOrNothing {
        PayoffFactory.requireNonNegative(lowerBound, "lowerBound");
        PayoffFactory.requireNonNegative(amount, "amount");
        if (Double.isNaN(upperBound) || upperBound <= lowerBound) {
            throw new InvalidParameterException(
                    "Cash-or-nothing upper bound must exceed lower bound: [" + lowerBound + ", " + upperBound + "]");
        }
    }

    @Override
    public PayoffKind kind() {
        return PayoffKind.CASH_OR_NOTHING;
    }

    @Override
    public double strike() {
        return lowerBound;
    }

    @Override
    public double evaluate(double terminalPrice) {
        return terminalPrice > lowerBound && terminalPrice <= upperBound ? amount : 0.0;
    }

    /** The paid fraction of [from, to] is its overlap with the window. */
    @Override
    public double averageOver(double from, double to) {
        if (to <= from) {
            return evaluate(from);
        }
        double overlap = Math.min(to, upperBound) - Math.max(from, lowerBound);
        return overlap > 0.0 ? amount * overlap / (to - from) : 0.0;
    }

    @Override
    public double referencePrice() {
        return Double.isInfinite(upperBound) ? lowerBound : upperBound;
    }

    /** GBM never reaches zero, so a window opening at zero pays almost surely as S approaches it. */
    @Override
    public double lowerBoundary(double tau, double riskFreeRate, double dividendYield) {
        return lowerBound == 0.0 ? amount * Math.exp(-riskFreeRate * tau) : 0.0;
    }

    @Override
    public double upperBoundary(double maxPrice, double tau, double riskFreeRate, double dividendYield) {
        return maxPrice <= upperBound ? amount * Math.exp(-riskFreeRate * tau) : 0.0;
    }
}
