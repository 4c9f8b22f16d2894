package com.optionlab.domain.model;

import com.optionlab.exception.InvalidParameterException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable market inputs shared by every pricer: spot, volatility, risk-free rate, continuous
 * dividend (carry) yield and time to expiry in years.
 *
 * <p>Validated on construction, so a pricer never sees a non-positive spot, volatility or expiry.
 * Rates and yields are continuously compounded decimals (0.05 = 5%).
 */
@Value
public class MarketParameters {

    double spot;
    double volatility;
    double riskFreeRate;
    double dividendYield;
    double timeToExpiry;

    @Builder(toBuilder = true)
    private MarketParameters(
            double spot, double volatility, double riskFreeRate, double dividendYield, double timeToExpiry) {
        if (!(spot > 0) || !(volatility > 0) || !(timeToExpiry > 0)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("spot", spot);
            details.put("volatility", volatility);
            details.put("timeToExpiry", timeToExpiry);
            throw new InvalidParameterException(
                    "Spot, volatility and time to expiry must be strictly positive", details);
        }
        if (!Double.isFinite(riskFreeRate) || !Double.isFinite(dividendYield)) {
            throw new InvalidParameterException("Risk-free rate and dividend yield must be finite");
        }
        this.spot = spot;
        this.volatility = volatility;
        this.riskFreeRate = riskFreeRate;
        this.dividendYield = dividendYield;
        this.timeToExpiry = timeToExpiry;
    }

    /** e^(-r * t). */
    public double discountFactor(double t) {
        return Math.exp(-riskFreeRate * t);
    }

    /** e^(-q * t). */
    public double dividendDiscountFactor(double t) {
        return Math.exp(-dividendYield * t);
    }

    /** Risk-neutral drift of the log price net of the Ito correction: r - q - sigma^2 / 2. */
    public double logDrift() {
        return riskFreeRate - dividendYield - 0.5 * volatility * volatility;
    }
}
