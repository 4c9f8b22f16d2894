package com.optionlab.payoff;

import com.optionlab.domain.model.PricePath;

/**
 * A payoff that depends only on the price at expiry, and can therefore be priced on a lattice or
 * a PDE grid as well as by simulation.
 *
 * <p>The boundary methods describe how the option value behaves at the edges of a truncated
 * price grid [0, S_max], tau years before expiry. At S = 0 the Black-Scholes PDE reduces to
 * dV/dtau = -rV, so the discounted payoff at zero is exact for every terminal payoff. The
 * default upper boundary treats the payoff as flat beyond S_max, which holds for bounded
 * payoffs; payoffs that grow with S override it.
 */
public sealed interface TerminalPayoff extends Payoff permits VanillaCall, VanillaPut, CashOrNothing {

    /**
     * @return payout if the underlying expires at {@code terminalPrice}, always >= 0
     */
    double evaluate(double terminalPrice);

    @Override
    default double evaluate(PricePath path) {
        return evaluate(path.terminal());
    }

    @Override
    default boolean pathDependent() {
        return false;
    }

    /**
     * Mean payout over terminal prices uniformly spread on [from, to]. A PDE grid starts from
     * these cell averages so that kinks and jumps between two nodes are weighted by how much of
     * the cell they cover.
     */
    double averageOver(double from, double to);

    default double lowerBoundary(double tau, double riskFreeRate, double dividendYield) {
        return evaluate(0.0) * Math.exp(-riskFreeRate * tau);
    }

    default double upperBoundary(double maxPrice, double tau, double riskFreeRate, double dividendYield) {
        return evaluate(maxPrice) * Math.exp(-riskFreeRate * tau);
    }

    /** Price level around which the payoff changes shape; the PDE grid must extend well past it. */
    default double referencePrice() {
        return strike();
    }
}
