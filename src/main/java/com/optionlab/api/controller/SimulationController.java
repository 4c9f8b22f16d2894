package com.optionlab.api.controller;

import com.optionlab.api.dto.request.PathSimulationRequest;
import com.optionlab.api.dto.response.SimulatedPathsResponse;
import com.optionlab.config.PricingProperties;
import com.optionlab.domain.model.MarketParameters;
import com.optionlab.domain.model.PricePath;
import com.optionlab.exception.InvalidParameterException;
import com.optionlab.mapper.PricingRequestMapper;
import com.optionlab.simulation.PathSequence;
import com.optionlab.simulation.PathSimulator;
import com.optionlab.simulation.RandomStreams;
import jakarta.validation.Valid;
import java.util.List;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exposes raw simulated GBM paths so external tools can plot them.
 *
 * <p>{@code POST /api/simulation/paths} -- returns the paths and the seed that reproduces them.
 * Requests above {@code pricing.simulation.max-export-paths} paths or
 * {@code pricing.simulation.max-export-steps} steps are rejected.
 */
@Slf4j
@RestController
@RequestMapping("/api/simulation")
public class SimulationController {

    private final PathSimulator pathSimulator;
    private final PricingRequestMapper pricingRequestMapper;
    private final PricingProperties pricingProperties;

    public SimulationController(
            PathSimulator pathSimulator,
            PricingRequestMapper pricingRequestMapper,
            PricingProperties pricingProperties) {
        this.pathSimulator = pathSimulator;
        this.pricingRequestMapper = pricingRequestMapper;
        this.pricingProperties = pricingProperties;
    }

    @PostMapping("/paths")
    public SimulatedPathsResponse simulatePaths(@Valid @RequestBody PathSimulationRequest request) {
        PricingProperties.Simulation limits = pricingProperties.getSimulation();
        InvalidParameterException.require(
                request.getPaths() <= limits.getMaxExportPaths(),
                "paths must not exceed " + limits.getMaxExportPaths() + " for export");
        InvalidParameterException.require(
                request.getSteps() <= limits.getMaxExportSteps(),
                "steps must not exceed " + limits.getMaxExportSteps() + " for export");

        MarketParameters market = pricingRequestMapper.toMarket(request);
        RandomStreams streams = RandomStreams.of(request.getSeed());
        PathSequence sequence = pathSimulator.simulate(market, request.getSteps(), request.getPaths(), streams);

        double timeStep = market.getTimeToExpiry() / request.getSteps();
        List<Double> times = IntStream.rangeClosed(0, request.getSteps())
                .mapToObj(i -> i * timeStep)
                .toList();
        List<double[]> paths = sequence.stream().map(PricePath::toArray).toList();

        log.debug("Exported {} paths x {} steps, seed={}", paths.size(), request.getSteps(), streams.getSeed());
        return SimulatedPathsResponse.builder()
                .seed(streams.getSeed())
                .timeStep(timeStep)
                .times(times)
                .paths(paths)
                .build();
    }
}
