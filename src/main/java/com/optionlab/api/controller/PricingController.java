package com.optionlab.api.controller;

import com.optionlab.api.dto.request.DiscretizationStudyRequest;
import com.optionlab.api.dto.request.PricingRequest;
import com.optionlab.api.dto.response.ComparisonResponse;
import com.optionlab.api.dto.response.PricingResponse;
import com.optionlab.config.PricingProperties;
import com.optionlab.domain.model.MarketParameters;
import com.optionlab.domain.model.OptionSpec;
import com.optionlab.domain.model.PricingResult;
import com.optionlab.mapper.PricingRequestMapper;
import com.optionlab.mapper.PricingResultMapper;
import com.optionlab.service.ComparisonReport;
import com.optionlab.service.PricingService;
import jakarta.validation.Valid;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for option valuation.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/pricing/analytic} -- closed-form Black-Scholes (European vanilla)</li>
 *   <li>{@code POST /api/pricing/pde} -- finite-difference solution of the Black-Scholes PDE</li>
 *   <li>{@code POST /api/pricing/lattice} -- CRR binomial tree, with exercise boundary for American</li>
 *   <li>{@code POST /api/pricing/monte-carlo} -- simulation estimate with standard error</li>
 *   <li>{@code POST /api/pricing/compare} -- every applicable method side by side</li>
 *   <li>{@code POST /api/pricing/discretization-study} -- Monte Carlo at several step counts</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/pricing")
public class PricingController {

    private final PricingService pricingService;
    private final PricingRequestMapper pricingRequestMapper;
    private final PricingProperties pricingProperties;
    private final PricingResultMapper pricingResultMapper = Mappers.getMapper(PricingResultMapper.class);

    public PricingController(
            PricingService pricingService,
            PricingRequestMapper pricingRequestMapper,
            PricingProperties pricingProperties) {
        this.pricingService = pricingService;
        this.pricingRequestMapper = pricingRequestMapper;
        this.pricingProperties = pricingProperties;
    }

    @PostMapping("/analytic")
    public PricingResponse analytic(@Valid @RequestBody PricingRequest request) {
        PricingResult result = pricingService.closedForm(
                pricingRequestMapper.toMarket(request), pricingRequestMapper.toOptionSpec(request));
        return pricingResultMapper.toResponse(result);
    }

    @PostMapping("/pde")
    public PricingResponse finiteDifference(@Valid @RequestBody PricingRequest request) {
        PricingResult result = pricingService.finiteDifference(
                pricingRequestMapper.toMarket(request),
                pricingRequestMapper.toOptionSpec(request),
                pricingRequestMapper.toFiniteDifferenceConfig(request, pricingProperties));
        return pricingResultMapper.toResponse(result);
    }

    @PostMapping("/lattice")
    public PricingResponse lattice(@Valid @RequestBody PricingRequest request) {
        PricingResult result = pricingService.lattice(
                pricingRequestMapper.toMarket(request),
                pricingRequestMapper.toOptionSpec(request),
                pricingRequestMapper.toLatticeConfig(request, pricingProperties));
        return pricingResultMapper.toResponse(result);
    }

    @PostMapping("/monte-carlo")
    public PricingResponse monteCarlo(@Valid @RequestBody PricingRequest request) {
        PricingResult result = pricingService.monteCarlo(
                pricingRequestMapper.toMarket(request),
                pricingRequestMapper.toOptionSpec(request),
                pricingRequestMapper.toMonteCarloConfig(request, pricingProperties));
        return pricingResultMapper.toResponse(result);
    }

    @PostMapping("/compare")
    public ComparisonResponse compare(@Valid @RequestBody PricingRequest request) {
        MarketParameters market = pricingRequestMapper.toMarket(request);
        OptionSpec spec = pricingRequestMapper.toOptionSpec(request);
        ComparisonReport report = pricingService.compare(
                market,
                spec,
                pricingRequestMapper.toLatticeConfig(request, pricingProperties),
                pricingRequestMapper.toMonteCarloConfig(request, pricingProperties),
                pricingRequestMapper.toFiniteDifferenceConfig(request, pricingProperties));
        return pricingResultMapper.toComparisonResponse(report);
    }

    @PostMapping("/discretization-study")
    public List<PricingResponse> discretizationStudy(@Valid @RequestBody DiscretizationStudyRequest request) {
        PricingRequest option = request.getOption();
        int[] stepCounts = request.getStepCounts().stream().mapToInt(Integer::intValue).toArray();
        List<PricingResult> results = pricingService.discretizationStudy(
                pricingRequestMapper.toMarket(option),
                pricingRequestMapper.toOptionSpec(option),
                pricingRequestMapper.toMonteCarloConfig(option, pricingProperties),
                stepCounts);
        return pricingResultMapper.toResponseList(results);
    }
}
