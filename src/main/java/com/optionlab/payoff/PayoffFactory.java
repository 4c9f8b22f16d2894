package com.optionlab.payoff;

import com.optionlab.domain.enums.PayoffKind;
import com.optionlab.exception.InvalidParameterException;

/**
 * Builds typed {@link Payoff} variants from a {@link PayoffKind} and a parameter bag, the only
 * place in the code base that switches on payoff kind to construct one.
 *
 * <p>Required parameters:
 * <ul>
 *   <li>VANILLA_CALL, VANILLA_PUT, ASIAN_CALL, LOOKBACK_CALL: strike</li>
 *   <li>CASH_OR_NOTHING: amount, and lowerBound (falls back to strike, then 0); upperBound
 *       defaults to +infinity</li>
 * </ul>
 */
public final class PayoffFactory {

    private PayoffFactory() {}

    public static Payoff create(PayoffKind kind, PayoffParameters parameters) {
        InvalidParameterException.require(kind != null, "Payoff kind is required");
        InvalidParameterException.require(parameters != null, "Payoff parameters are required for " + kind);

        return switch (kind) {
            case VANILLA_CALL -> new VanillaCall(requireStrike(kind, parameters));
            case VANILLA_PUT -> new VanillaPut(requireStrike(kind, parameters));
            case ASIAN_CALL -> new AsianCall(requireStrike(kind, parameters));
            case LOOKBACK_CALL -> new LookbackCall(requireStrike(kind, parameters));
            case CASH_OR_NOTHING -> cashOrNothing(parameters);
        };
    }

    private static CashOrNothing cashOrNothing(PayoffParameters parameters) {
        InvalidParameterException.require(parameters.getAmount() != null, "CASH_OR_NOTHING requires an amount");
        double lower = parameters.getLowerBound() != null
                ? parameters.getLowerBound()
                : parameters.getStrike() != null ? parameters.getStrike() : 0.0;
        double upper = parameters.getUpperBound() != null ? parameters.getUpperBound() : Double.POSITIVE_INFINITY;
        return new CashOrNothing(lower, upper, parameters.getAmount());
    }

    private static double requireStrike(PayoffKind kind, PayoffParameters parameters) {
        InvalidParameterException.require(parameters.getStrike() != null, kind + " requires a strike");
        return parameters.getStrike();
    }

    static void requireNonNegative(double value, String name) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new InvalidParameterException(name + " must be a finite non-negative number, got " + value);
        }
    }
}
