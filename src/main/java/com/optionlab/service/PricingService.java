package com.optionlab.service;

import com.optionlab.config.PricingProperties;
import com.optionlab.domain.enums.PricingMethod;
import com.optionlab.domain.model.FiniteDifferenceConfig;
import com.optionlab.domain.model.LatticeConfig;
import com.optionlab.domain.model.MarketParameters;
import com.optionlab.domain.model.MonteCarloConfig;
import com.optionlab.domain.model.OptionSpec;
import com.optionlab.domain.model.PricingResult;
import com.optionlab.exception.BaseException;
import com.optionlab.observability.PricingMetrics;
import com.optionlab.pricing.analytic.AnalyticPricer;
import com.optionlab.pricing.analytic.FiniteDifferencePricer;
import com.optionlab.pricing.lattice.LatticePricer;
import com.optionlab.pricing.montecarlo.MonteCarloPricer;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for pricing requests: routes to the individual pricers, records metrics, and
 * cross-checks the methods against each other.
 *
 * <p>Method applicability:
 * <ul>
 *   <li>closed form: European vanilla call/put</li>
 *   <li>PDE and lattice: any terminal payoff, European or American</li>
 *   <li>Monte Carlo: any payoff, European only</li>
 * </ul>
 */
@Service
public class PricingService {

    private static final Logger log = LoggerFactory.getLogger(PricingService.class);

    private final AnalyticPricer analyticPricer;
    private final FiniteDifferencePricer finiteDifferencePricer;
    private final LatticePricer latticePricer;
    private final MonteCarloPricer monteCarloPricer;
    private final PricingMetrics pricingMetrics;
    private final PricingProperties pricingProperties;

    public PricingService(
            AnalyticPricer analyticPricer,
            FiniteDifferencePricer finiteDifferencePricer,
            LatticePricer latticePricer,
            MonteCarloPricer monteCarloPricer,
            PricingMetrics pricingMetrics,
            PricingProperties pricingProperties) {
        this.analyticPricer = analyticPricer;
        this.finiteDifferencePricer = finiteDifferencePricer;
        this.latticePricer = latticePricer;
        this.monteCarloPricer = monteCarloPricer;
        this.pricingMetrics = pricingMetrics;
        this.pricingProperties = pricingProperties;
    }

    public PricingResult closedForm(MarketParameters market, OptionSpec spec) {
        return measured(PricingMethod.CLOSED_FORM, () -> analyticPricer.price(market, spec));
    }

    public PricingResult finiteDifference(MarketParameters market, OptionSpec spec, FiniteDifferenceConfig config) {
        FiniteDifferenceConfig effective = config != null ? config : defaultFiniteDifferenceConfig();
        return measured(PricingMethod.FINITE_DIFFERENCE, () -> finiteDifferencePricer.price(market, spec, effective));
    }

    public PricingResult lattice(MarketParameters market, OptionSpec spec, LatticeConfig config) {
        LatticeConfig effective = config != null ? config : defaultLatticeConfig();
        return measured(PricingMethod.LATTICE, () -> latticePricer.price(market, spec, effective));
    }

    public PricingResult monteCarlo(MarketParameters market, OptionSpec spec, MonteCarloConfig config) {
        MonteCarloConfig effective = config != null ? config : defaultMonteCarloConfig();
        return measured(PricingMethod.MONTE_CARLO, () -> monteCarloPricer.price(market, spec, effective));
    }

    public List<PricingResult> discretizationStudy(
            MarketParameters market, OptionSpec spec, MonteCarloConfig config, int... stepCounts) {
        MonteCarloConfig effective = config != null ? config : defaultMonteCarloConfig();
        try {
            List<PricingResult> results = monteCarloPricer.discretizationStudy(market, spec, effective, stepCounts);
            results.forEach(pricingMetrics::recordSuccess);
            return results;
        } catch (BaseException e) {
            pricingMetrics.recordFailure(PricingMethod.MONTE_CARLO);
            throw e;
        }
    }

    /**
     * Values the option with every applicable method. A method that fails (for example a lattice
     * too coarse for the parameters) is reported as skipped with the failure message instead of
     * failing the whole comparison.
     */
    public ComparisonReport compare(
            MarketParameters market,
            OptionSpec spec,
            LatticeConfig latticeConfig,
            MonteCarloConfig monteCarloConfig,
            FiniteDifferenceConfig finiteDifferenceConfig) {
        boolean pathDependent = spec.getPayoff().pathDependent();

        PricingResult closedForm = null;
        List<MethodComparison> outcomes = new ArrayList<>();
        if (analyticPricer.hasClosedForm(spec)) {
            closedForm = attempt(PricingMethod.CLOSED_FORM, () -> closedForm(market, spec), outcomes);
        } else {
            String reason = "No closed form for " + spec.getExerciseStyle() + " " + spec.getPayoffKind();
            outcomes.add(MethodComparison.skipped(PricingMethod.CLOSED_FORM, reason));
        }

        PricingResult pde = null;
        PricingResult lattice = null;
        if (pathDependent) {
            outcomes.add(MethodComparison.skipped(PricingMethod.FINITE_DIFFERENCE, "Payoff is path dependent"));
            outcomes.add(MethodComparison.skipped(PricingMethod.LATTICE, "Payoff is path dependent"));
        } else {
            pde = attempt(
                    PricingMethod.FINITE_DIFFERENCE,
                    () -> finiteDifference(market, spec, finiteDifferenceConfig),
                    outcomes);
            lattice = attempt(PricingMethod.LATTICE, () -> lattice(market, spec, latticeConfig), outcomes);
        }

        PricingResult monteCarlo = null;
        if (spec.isAmerican()) {
            outcomes.add(MethodComparison.skipped(PricingMethod.MONTE_CARLO, "American exercise"));
        } else {
            monteCarlo = attempt(PricingMethod.MONTE_CARLO, () -> monteCarlo(market, spec, monteCarloConfig), outcomes);
        }

        PricingResult reference = closedForm != null ? closedForm : pde;
        List<MethodComparison> comparisons = new ArrayList<>();
        for (PricingMethod method : PricingMethod.values()) {
            PricingResult result = switch (method) {
                case CLOSED_FORM -> closedForm;
                case FINITE_DIFFERENCE -> pde;
                case LATTICE -> lattice;
                case MONTE_CARLO -> monteCarlo;
            };
            if (result == null) {
                outcomes.stream().filter(o -> o.method() == method).findFirst().ifPresent(comparisons::add);
                continue;
            }
            Double difference =
                    reference != null && result != reference ? result.getValue() - reference.getValue() : null;
            comparisons.add(new MethodComparison(method, result, difference, null));
        }

        log.info(
                "Compared {} {}: reference={} ({}), methods={}",
                spec.getExerciseStyle(),
                spec.getPayoffKind(),
                reference != null ? reference.getValue() : null,
                reference != null ? reference.getMethod() : null,
                comparisons.stream().filter(c -> !c.isSkipped()).count());

        return ComparisonReport.builder()
                .market(market)
                .option(spec)
                .referenceMethod(reference != null ? reference.getMethod() : null)
                .referenceValue(reference != null ? reference.getValue() : null)
                .comparisons(comparisons)
                .build();
    }

    public LatticeConfig defaultLatticeConfig() {
        return LatticeConfig.ofSteps(pricingProperties.getLattice().getDefaultSteps());
    }

    public MonteCarloConfig defaultMonteCarloConfig() {
        PricingProperties.MonteCarlo monteCarlo = pricingProperties.getMonteCarlo();
        return MonteCarloConfig.builder()
                .steps(monteCarlo.getDefaultSteps())
                .paths(monteCarlo.getDefaultPaths())
                .build();
    }

    public FiniteDifferenceConfig defaultFiniteDifferenceConfig() {
        PricingProperties.FiniteDifference finiteDifference = pricingProperties.getFiniteDifference();
        return FiniteDifferenceConfig.builder()
                .priceSteps(finiteDifference.getPriceSteps())
                .timeSteps(finiteDifference.getTimeSteps())
                .scheme(finiteDifference.getScheme())
                .widthInStdDevs(finiteDifference.getWidthInStdDevs())
                .snapshotCount(finiteDifference.getSnapshotCount())
                .build();
    }

    private PricingResult attempt(
            PricingMethod method, Supplier<PricingResult> pricing, List<MethodComparison> outcomes) {
        try {
            return pricing.get();
        } catch (BaseException e) {
            log.warn("{} skipped in comparison: {}", method, e.getMessage());
            outcomes.add(MethodComparison.skipped(method, e.getMessage()));
            return null;
        }
    }

    private PricingResult measured(PricingMethod method, Supplier<PricingResult> pricing) {
        try {
            PricingResult result = pricing.get();
            pricingMetrics.recordSuccess(result);
            return result;
        } catch (BaseException e) {
            pricingMetrics.recordFailure(method);
            throw e;
        }
    }
}
