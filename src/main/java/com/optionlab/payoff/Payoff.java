package com.optionlab.payoff;

import com.optionlab.domain.enums.PayoffKind;
import com.optionlab.domain.model.PricePath;

/**
 * Maps a simulated price path (or, for {@link TerminalPayoff}s, a terminal price) to a
 * non-negative cash payout at expiry.
 *
 * <p>The hierarchy is closed: pricers program against this interface and
 * {@link TerminalPayoff}, never against a concrete kind, so a new payoff only needs a new record
 * here and a branch in {@link PayoffFactory}. Implementations are immutable, pure and
 * thread-safe.
 */
public sealed interface Payoff permits TerminalPayoff, AsianCall, LookbackCall {

    PayoffKind kind();

    double strike();

    /**
     * Whether the payout depends on prices before expiry. Path-dependent payoffs can only be
     * priced by simulation.
     */
    boolean pathDependent();

    /**
     * @return payout for the given path, always >= 0
     */
    double evaluate(PricePath path);
}
