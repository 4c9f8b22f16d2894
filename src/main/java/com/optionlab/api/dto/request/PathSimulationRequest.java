package com.optionlab.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * Request payload for exporting simulated GBM paths, typically for charting. Path and step counts
 * are capped by {@code pricing.simulation.*}.
 */
@Data
public class PathSimulationRequest {

    @NotNull(message = "spot is required")
    @Positive(message = "spot must be positive")
    private Double spot;

    @NotNull(message = "volatility is required")
    @Positive(message = "volatility must be positive")
    private Double volatility;

    @NotNull(message = "riskFreeRate is required")
    private Double riskFreeRate;

    private double dividendYield = 0.0;

    @NotNull(message = "timeToExpiry is required")
    @Positive(message = "timeToExpiry must be positive")
    private Double timeToExpiry;

    @Min(value = 1, message = "steps must be >= 1")
    private int steps = 100;

    @Min(value = 1, message = "paths must be >= 1")
    private int paths = 10;

    private Long seed;
}
