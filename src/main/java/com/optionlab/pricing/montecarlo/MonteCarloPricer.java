package com.optionlab.pricing.montecarlo;

import com.optionlab.config.PricingProperties;
import com.optionlab.domain.enums.PricingMethod;
import com.optionlab.domain.model.ConvergenceWarning;
import com.optionlab.domain.model.MarketParameters;
import com.optionlab.domain.model.MonteCarloConfig;
import com.optionlab.domain.model.OptionSpec;
import com.optionlab.domain.model.PricePath;
import com.optionlab.domain.model.PricingResult;
import com.optionlab.exception.BaseException;
import com.optionlab.exception.InvalidParameterException;
import com.optionlab.payoff.Payoff;
import com.optionlab.pricing.analytic.AnalyticPricer;
import com.optionlab.simulation.PathSequence;
import com.optionlab.simulation.PathSimulator;
import com.optionlab.simulation.RandomStreams;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.AggregateSummaryStatistics;
import org.apache.commons.math3.stat.descriptive.StatisticalSummary;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Monte Carlo valuation of European payoffs, path-dependent ones included, over simulated
 * risk-neutral GBM paths.
 *
 * <p>value = mean(e^(-rT) * payoff(path)), standard error = sample standard deviation / sqrt(n).
 *
 * <p>Work is split into chunks of {@code pricing.monte-carlo.chunk-size} paths. Chunk {@code i}
 * draws from {@link RandomStreams#stream(int) stream i} of the run's seed and runs on the pricing
 * executor. Per-chunk statistics are merged in chunk order with
 * {@link AggregateSummaryStatistics}, so a seeded run gives the same answer whatever the pool
 * size.
 *
 * <p>Reported alongside the estimate:
 * <ul>
 *   <li>the seed actually used (drawn when the config has none)</li>
 *   <li>for specs with a closed form, the analytic value and the deviation from it in standard
 *       errors</li>
 *   <li>a {@link ConvergenceWarning} when the standard error exceeds the configured tolerance;
 *       the estimate is still returned</li>
 * </ul>
 *
 * <p>Step count matters only for path-dependent payoffs. A finer grid observes the path more
 * often, which moves lookback and Asian estimates toward their continuous-monitoring limit; that
 * bias does not shrink with more paths. {@link #discretizationStudy} measures it.
 */
@Slf4j
@Component
public class MonteCarloPricer {

    private final PathSimulator pathSimulator;
    private final AnalyticPricer analyticPricer;
    private final PricingProperties pricingProperties;
    private final Executor pricingExecutor;

    public MonteCarloPricer(
            PathSimulator pathSimulator,
            AnalyticPricer analyticPricer,
            PricingProperties pricingProperties,
            @Qualifier("pricingExecutor") Executor pricingExecutor) {
        this.pathSimulator = pathSimulator;
        this.analyticPricer = analyticPricer;
        this.pricingProperties = pricingProperties;
        this.pricingExecutor = pricingExecutor;
    }

    /**
     * @throws InvalidParameterException for American exercise, which needs an exercise policy this
     *     estimator does not model
     */
    public PricingResult price(MarketParameters market, OptionSpec spec, MonteCarloConfig config) {
        requireEuropean(spec);
        long started = System.nanoTime();
        RandomStreams streams = RandomStreams.of(config.getSeed());

        StatisticalSummary summary = simulate(market, spec.getPayoff(), config, streams, new int[] {1})[0];
        PricingResult result = toResult(market, spec, config, config.getSteps(), streams, summary, started);

        log.info(
                "Monte Carlo {}: value={} stdErr={} paths={} steps={} seed={} deviation={}SE in {}ms",
                spec.getPayoffKind(),
                result.getValue(),
                result.getStandardError(),
                config.getPaths(),
                config.getSteps(),
                streams.getSeed(),
                result.getDeviationInStandardErrors(),
                result.getElapsedMillis());
        return result;
    }

    /**
     * Prices the same option at several step counts from a single set of paths: every path is
     * simulated at the finest count and subsampled for the coarser ones. Each coarse path is a
     * sampling of the same trajectory, so the sampling noise is shared across step counts and the
     * differences between results isolate the discretization bias. For a lookback call the
     * observed maximum can only grow with resolution, which makes the estimates non-decreasing in
     * step count.
     *
     * @param stepCounts step counts to report, each dividing the largest; {@code config.steps} is
     *     ignored
     * @return one result per step count, in the order given
     */
    public List<PricingResult> discretizationStudy(
            MarketParameters market, OptionSpec spec, MonteCarloConfig config, int... stepCounts) {
        requireEuropean(spec);
        InvalidParameterException.require(
                stepCounts != null && stepCounts.length > 0, "At least one step count is required");
        int finest = Arrays.stream(stepCounts).max().getAsInt();
        int[] strides = new int[stepCounts.length];
        for (int k = 0; k < stepCounts.length; k++) {
            InvalidParameterException.require(stepCounts[k] >= 1, "Step counts must be >= 1, got " + stepCounts[k]);
            InvalidParameterException.require(
                    finest % stepCounts[k] == 0,
                    "Step count " + stepCounts[k] + " does not divide the finest step count " + finest);
            strides[k] = finest / stepCounts[k];
        }

        long started = System.nanoTime();
        RandomStreams streams = RandomStreams.of(config.getSeed());
        MonteCarloConfig finestConfig = config.toBuilder().steps(finest).build();
        StatisticalSummary[] summaries = simulate(market, spec.getPayoff(), finestConfig, streams, strides);

        List<PricingResult> results = new ArrayList<>(stepCounts.length);
        for (int k = 0; k < stepCounts.length; k++) {
            results.add(toResult(market, spec, config, stepCounts[k], streams, summaries[k], started));
            log.debug(
                    "Discretization study {} steps={}: value={}",
                    spec.getPayoffKind(),
                    stepCounts[k],
                    summaries[k].getMean());
        }
        log.info(
                "Discretization study {} over steps {} with {} paths, seed={}",
                spec.getPayoffKind(),
                Arrays.toString(stepCounts),
                config.getPaths(),
                streams.getSeed());
        return results;
    }

    /** Runs all chunks and returns one merged summary per stride. */
    private StatisticalSummary[] simulate(
            MarketParameters market, Payoff payoff, MonteCarloConfig config, RandomStreams streams, int[] strides) {
        int chunkSize = chunkSize(config);
        int chunks = (config.getPaths() + chunkSize - 1) / chunkSize;
        double discount = market.discountFactor(market.getTimeToExpiry());

        List<CompletableFuture<SummaryStatistics[]>> futures = new ArrayList<>(chunks);
        for (int chunk = 0; chunk < chunks; chunk++) {
            int index = chunk;
            int paths = Math.min(chunkSize, config.getPaths() - chunk * chunkSize);
            PathSequence sequence = pathSimulator.simulate(
                    market, config.getSteps(), paths, config.isAntithetic(), () -> streams.stream(index));
            futures.add(CompletableFuture.supplyAsync(
                    () -> evaluateChunk(sequence, payoff, discount, strides), pricingExecutor));
        }

        List<List<SummaryStatistics>> perStride = new ArrayList<>(strides.length);
        for (int k = 0; k < strides.length; k++) {
            perStride.add(new ArrayList<>(chunks));
        }
        for (CompletableFuture<SummaryStatistics[]> future : futures) {
            SummaryStatistics[] chunkStatistics = join(future);
            for (int k = 0; k < strides.length; k++) {
                perStride.get(k).add(chunkStatistics[k]);
            }
        }

        StatisticalSummary[] merged = new StatisticalSummary[strides.length];
        for (int k = 0; k < strides.length; k++) {
            merged[k] = AggregateSummaryStatistics.aggregate(perStride.get(k));
        }
        return merged;
    }

    /**
     * Discounted payoff statistics of one chunk. In antithetic mode consecutive paths form a
     * pair and their average is a single sample.
     */
    static SummaryStatistics[] evaluateChunk(PathSequence sequence, Payoff payoff, double discount, int[] strides) {
        SummaryStatistics[] statistics = new SummaryStatistics[strides.length];
        for (int k = 0; k < strides.length; k++) {
            statistics[k] = new SummaryStatistics();
        }

        Iterator<PricePath> paths = sequence.iterator();
        while (paths.hasNext()) {
            PricePath path = paths.next();
            PricePath mirror = sequence.isAntithetic() ? paths.next() : null;
            for (int k = 0; k < strides.length; k++) {
                double sample = payoff.evaluate(path.subsample(strides[k]));
                if (mirror != null) {
                    sample = 0.5 * (sample + payoff.evaluate(mirror.subsample(strides[k])));
                }
                statistics[k].addValue(discount * sample);
            }
        }
        return statistics;
    }

    private PricingResult toResult(
            MarketParameters market,
            OptionSpec spec,
            MonteCarloConfig config,
            int steps,
            RandomStreams streams,
            StatisticalSummary summary,
            long started) {
        double value = summary.getMean();
        double standardError = Math.sqrt(summary.getVariance() / summary.getN());

        PricingResult.PricingResultBuilder builder = PricingResult.builder()
                .method(PricingMethod.MONTE_CARLO)
                .value(value)
                .standardError(standardError)
                .seed(streams.getSeed())
                .steps(steps)
                .paths(config.getPaths());

        if (analyticPricer.hasClosedForm(spec)) {
            double reference = analyticPricer.price(market, spec).getValue();
            builder.referenceValue(reference);
            if (standardError > 0.0) {
                builder.deviationInStandardErrors((value - reference) / standardError);
            }
        }

        if (config.getTolerance() != null && standardError > config.getTolerance()) {
            ConvergenceWarning warning =
                    new ConvergenceWarning(standardError, config.getTolerance(), config.getPaths());
            log.warn("Monte Carlo {} did not converge: {}", spec.getPayoffKind(), warning.message());
            builder.warning(warning);
        }

        return builder.elapsedMillis((System.nanoTime() - started) / 1_000_000).build();
    }

    /** Antithetic pairs must not straddle two chunks. */
    private int chunkSize(MonteCarloConfig config) {
        int chunkSize = Math.max(1, pricingProperties.getMonteCarlo().getChunkSize());
        if (config.isAntithetic() && chunkSize % 2 != 0) {
            chunkSize++;
        }
        return chunkSize;
    }

    private static void requireEuropean(OptionSpec spec) {
        if (spec.isAmerican()) {
            throw new InvalidParameterException(
                    "Monte Carlo prices European exercise only; use the lattice or PDE pricer for "
                            + spec.getExerciseStyle() + " " + spec.getPayoffKind());
        }
    }

    private static SummaryStatistics[] join(CompletableFuture<SummaryStatistics[]> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof BaseException baseException) {
                throw baseException;
            }
            throw new IllegalStateException("Monte Carlo chunk failed: " + e.getCause().getMessage(), e.getCause());
        }
    }
}
