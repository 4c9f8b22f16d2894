package com.optionlab.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of a finite-difference solution for inspection or plotting.
 *
 * <p>{@code prices} is the spatial grid. {@code timesToExpiry.get(k)} is the time to expiry of
 * {@code values.get(k)}, one value per grid price. The first snapshot is the terminal payoff
 * (time to expiry 0), cell averaged at interior nodes; the last is today.
 */
@Value
@Builder
public class DiagnosticGrid {

    double[] prices;
    List<Double> timesToExpiry;
    List<double[]> values;
    double maxPrice;
    double priceStep;
    double timeStep;
}
