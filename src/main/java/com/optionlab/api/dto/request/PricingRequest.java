package com.optionlab.api.dto.request;

import com.optionlab.domain.enums.ExerciseStyle;
import com.optionlab.domain.enums.FiniteDifferenceScheme;
import com.optionlab.domain.enums.PayoffKind;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * Request payload shared by all pricing endpoints.
 *
 * <p>Market and option fields are always read. Method settings are optional and fall back to the
 * {@code pricing.*} defaults: {@code latticeSteps} for the lattice, {@code simulationSteps},
 * {@code paths}, {@code seed}, {@code tolerance} and {@code antithetic} for Monte Carlo,
 * {@code priceSteps}, {@code timeSteps} and {@code scheme} for the PDE solver.
 */
@Data
public class PricingRequest {

    @NotNull(message = "spot is required")
    @Positive(message = "spot must be positive")
    private Double spot;

    @NotNull(message = "volatility is required")
    @Positive(message = "volatility must be positive")
    private Double volatility;

    @NotNull(message = "riskFreeRate is required")
    private Double riskFreeRate;

    /** Continuous dividend yield. Default: 0. */
    private double dividendYield = 0.0;

    @NotNull(message = "timeToExpiry is required")
    @Positive(message = "timeToExpiry must be positive")
    private Double timeToExpiry;

    private ExerciseStyle exerciseStyle = ExerciseStyle.EUROPEAN;

    @NotNull(message = "payoffKind is required")
    private PayoffKind payoffKind;

    private Double strike;

    /** CASH_OR_NOTHING window, exclusive lower bound. */
    private Double lowerBound;

    /** CASH_OR_NOTHING window, inclusive upper bound. Null means unbounded. */
    private Double upperBound;

    /** CASH_OR_NOTHING payout. */
    private Double cashAmount;

    @Min(value = 1, message = "latticeSteps must be >= 1")
    private Integer latticeSteps;

    @Min(value = 1, message = "simulationSteps must be >= 1")
    private Integer simulationSteps;

    @Min(value = 1, message = "paths must be >= 1")
    private Integer paths;

    private Long seed;

    @Positive(message = "tolerance must be positive")
    private Double tolerance;

    private boolean antithetic;

    @Min(value = 3, message = "priceSteps must be >= 3")
    private Integer priceSteps;

    @Min(value = 1, message = "timeSteps must be >= 1")
    private Integer timeSteps;

    private FiniteDifferenceScheme scheme;
}
