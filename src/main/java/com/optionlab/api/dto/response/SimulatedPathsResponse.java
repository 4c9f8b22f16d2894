package com.optionlab.api.dto.response;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Simulated paths for external plotting. {@code times} holds the observation times shared by all
 * paths; each entry of {@code paths} has one price per time.
 */
@Getter
@Builder
public class SimulatedPathsResponse {

    private final long seed;
    private final double timeStep;
    private final List<Double> times;
    private final List<double[]> paths;
}
