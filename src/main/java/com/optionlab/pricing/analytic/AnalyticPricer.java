package com.optionlab.pricing.analytic;

import com.optionlab.domain.enums.PayoffKind;
import com.optionlab.domain.enums.PricingMethod;
import com.optionlab.domain.model.MarketParameters;
import com.optionlab.domain.model.OptionSpec;
import com.optionlab.domain.model.PricingResult;
import com.optionlab.exception.InvalidParameterException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Closed-form Black-Scholes valuation of European vanilla calls and puts with a continuous
 * dividend yield. This is the reference the lattice and Monte Carlo pricers are validated
 * against.
 *
 * <p>Key formulas:
 * <ul>
 *   <li>d1 = [ln(S/K) + (r - q + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>Call: S * e^(-qT) * N(d1) - K * e^(-rT) * N(d2)
 *   <li>Put: K * e^(-rT) * N(-d2) - S * e^(-qT) * N(-d1)
 * </ul>
 *
 * <p>Other payoffs have no closed form here: use {@link FiniteDifferencePricer} for terminal
 * payoffs and the Monte Carlo pricer for path-dependent ones.
 *
 * <p>This class is stateless and thread-safe.
 */
@Slf4j
@Component
public class AnalyticPricer {

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    /**
     * Whether {@link #price} can value the option: a European vanilla call or put.
     */
    public boolean hasClosedForm(OptionSpec spec) {
        PayoffKind kind = spec.getPayoffKind();
        return !spec.isAmerican() && (kind == PayoffKind.VANILLA_CALL || kind == PayoffKind.VANILLA_PUT);
    }

    /**
     * Values a European vanilla option in closed form.
     *
     * @throws InvalidParameterException for American exercise or a payoff other than vanilla
     *     call/put
     */
    public PricingResult price(MarketParameters market, OptionSpec spec) {
        if (!hasClosedForm(spec)) {
            throw new InvalidParameterException(
                    "No closed form for " + spec.getExerciseStyle() + " " + spec.getPayoffKind()
                            + "; closed form covers European vanilla calls and puts only");
        }
        long started = System.nanoTime();

        boolean isCall = spec.getPayoffKind() == PayoffKind.VANILLA_CALL;
        double value = blackScholesPrice(
                market.getSpot(),
                spec.getStrike(),
                market.getTimeToExpiry(),
                market.getRiskFreeRate(),
                market.getDividendYield(),
                market.getVolatility(),
                isCall);

        log.debug("Closed-form {} value {} for {}", spec.getPayoffKind(), value, market);
        return PricingResult.builder()
                .method(PricingMethod.CLOSED_FORM)
                .value(value)
                .elapsedMillis((System.nanoTime() - started) / 1_000_000)
                .build();
    }

    /**
     * Theoretical Black-Scholes price of a European option. A zero strike is the limiting case of
     * a call worth the dividend-discounted spot (and a worthless put).
     */
    public double blackScholesPrice(double S, double K, double T, double r, double q, double sigma, boolean isCall) {
        if (K == 0.0) {
            return isCall ? S * Math.exp(-q * T) : 0.0;
        }
        double sqrtT = Math.sqrt(T);
        double d1 = d1(S, K, T, r, q, sigma);
        double d2 = d1 - sigma * sqrtT;

        if (isCall) {
            return S * Math.exp(-q * T) * NORM.cumulativeProbability(d1)
                    - K * Math.exp(-r * T) * NORM.cumulativeProbability(d2);
        } else {
            return K * Math.exp(-r * T) * NORM.cumulativeProbability(-d2)
                    - S * Math.exp(-q * T) * NORM.cumulativeProbability(-d1);
        }
    }

    /**
     * Closed-form value of a European cash-or-nothing payoff paying {@code amount} when
     * lower < S_T <= upper: amount * e^(-rT) * [N(d2(lower)) - N(d2(upper))].
     * Used to check the PDE solver on a discontinuous payoff.
     */
    public double cashOrNothingPrice(
            double S, double lower, double upper, double T, double r, double q, double sigma, double amount) {
        double aboveLower = lower == 0.0 ? 1.0 : NORM.cumulativeProbability(d2(S, lower, T, r, q, sigma));
        double aboveUpper =
                Double.isInfinite(upper) ? 0.0 : NORM.cumulativeProbability(d2(S, upper, T, r, q, sigma));
        return amount * Math.exp(-r * T) * (aboveLower - aboveUpper);
    }

    static double d1(double S, double K, double T, double r, double q, double sigma) {
        return (Math.log(S / K) + (r - q + sigma * sigma / 2.0) * T) / (sigma * Math.sqrt(T));
    }

    static double d2(double S, double K, double T, double r, double q, double sigma) {
        return d1(S, K, T, r, q, sigma) - sigma * Math.sqrt(T);
    }
}
