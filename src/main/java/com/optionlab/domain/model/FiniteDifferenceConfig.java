package com.optionlab.domain.model;

import com.optionlab.domain.enums.FiniteDifferenceScheme;
import com.optionlab.exception.InvalidParameterException;
import lombok.Builder;
import lombok.Value;

/**
 * Grid settings for the Black-Scholes PDE solver.
 *
 * <p>The price grid spans [0, S_max] with {@code priceSteps} intervals, where
 * S_max = max(S0, reference price) * max(2, min(exp(widthInStdDevs * sigma * sqrt(T)), priceSteps / 10)),
 * so at least ten price steps always lie below max(S0, reference price).
 * {@code snapshotCount} time slices are kept in the diagnostic grid (0 keeps only the first and
 * last slice).
 */
@Value
public class FiniteDifferenceConfig {

    int priceSteps;
    int timeSteps;
    FiniteDifferenceScheme scheme;
    double widthInStdDevs;
    int snapshotCount;

    @Builder(toBuilder = true)
    private FiniteDifferenceConfig(
            int priceSteps,
            int timeSteps,
            FiniteDifferenceScheme scheme,
            double widthInStdDevs,
            int snapshotCount) {
        InvalidParameterException.require(priceSteps >= 3, "PDE price steps must be >= 3, got " + priceSteps);
        InvalidParameterException.require(timeSteps >= 1, "PDE time steps must be >= 1, got " + timeSteps);
        InvalidParameterException.require(widthInStdDevs > 0, "PDE grid width must be positive");
        InvalidParameterException.require(snapshotCount >= 0, "Snapshot count must be >= 0");
        this.priceSteps = priceSteps;
        this.timeSteps = timeSteps;
        this.scheme = scheme != null ? scheme : FiniteDifferenceScheme.IMPLICIT;
        this.widthInStdDevs = widthInStdDevs;
        this.snapshotCount = snapshotCount;
    }
}
