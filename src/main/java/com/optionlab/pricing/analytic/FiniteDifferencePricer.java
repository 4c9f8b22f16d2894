package com.optionlab.pricing.analytic;

import com.optionlab.domain.enums.FiniteDifferenceScheme;
import com.optionlab.domain.enums.PricingMethod;
import com.optionlab.domain.model.DiagnosticGrid;
import com.optionlab.domain.model.FiniteDifferenceConfig;
import com.optionlab.domain.model.MarketParameters;
import com.optionlab.domain.model.OptionSpec;
import com.optionlab.domain.model.PricingResult;
import com.optionlab.exception.InvalidParameterException;
import com.optionlab.exception.NumericalInstabilityException;
import com.optionlab.payoff.TerminalPayoff;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.springframework.stereotype.Component;

/**
 * Finite-difference solver of the Black-Scholes PDE for terminal payoffs without a closed form.
 *
 * <p>Works in time to expiry tau, where the PDE reads
 * <pre>
 * dV/dtau = 1/2 sigma^2 S^2 V_SS + (r - q) S V_S - r V,   V(S, 0) = payoff(S)
 * </pre>
 * on a uniform grid S_j = j * dS, j = 0..M over [0, S_max] (see {@link #gridMultiple}), stepped
 * from tau = 0 to tau = T with the theta scheme (theta = 1 implicit, 1/2 Crank-Nicolson,
 * 0 explicit). Central differences give the interior operator
 * <pre>
 * L V_j = a_j V_{j-1} + b_j V_j + c_j V_{j+1}
 * a_j = (sigma^2 j^2 - (r - q) j) / 2,  b_j = -(sigma^2 j^2 + r),  c_j = (sigma^2 j^2 + (r - q) j) / 2
 * </pre>
 * Edge values come from the payoff's {@link TerminalPayoff#lowerBoundary} and
 * {@link TerminalPayoff#upperBoundary}. Two buffers are alternated between steps; the previous
 * slice is never overwritten while the next one is being built.
 *
 * <p>The terminal slice holds the payoff averaged over each cell [S_j - dS/2, S_j + dS/2], which
 * keeps digital jumps from being over or under weighted depending on where the nodes fall.
 *
 * <p>American exercise is handled by projecting each new slice onto the payoff, which is first
 * order in dtau.
 *
 * <p>Failure modes:
 * <ul>
 *   <li>EXPLICIT with sigma^2 * S^2 * dtau / dS^2 > 1 at any interior node: rejected before
 *       stepping</li>
 *   <li>any NaN or infinite grid value: the run is aborted</li>
 *   <li>fewer than {@link #MIN_NODES_BELOW_SPOT} price steps below S0: rejected before stepping</li>
 * </ul>
 * All raise {@link NumericalInstabilityException} carrying the grid configuration.
 */
@Slf4j
@Component
public class FiniteDifferencePricer {

    /** Upper limit of sigma^2 S^2 dtau / dS^2 for the explicit scheme. */
    static final double EXPLICIT_STABILITY_LIMIT = 1.0;

    /** S_max is at least this multiple of max(S0, reference price). */
    private static final double MIN_GRID_MULTIPLE = 2.0;

    /** Nodes kept between zero and max(S0, reference price) however wide the distribution. */
    static final int MIN_NODES_BELOW_ANCHOR = 10;

    /** Fewest grid steps between zero and S0 the interpolated price is trusted on. */
    static final int MIN_NODES_BELOW_SPOT = 4;

    public PricingResult price(MarketParameters market, OptionSpec spec, FiniteDifferenceConfig config) {
        if (!(spec.getPayoff() instanceof TerminalPayoff payoff)) {
            throw new InvalidParameterException(
                    "PDE solver needs a terminal payoff; " + spec.getPayoffKind() + " is path dependent");
        }
        long started = System.nanoTime();

        double sigma = market.getVolatility();
        double r = market.getRiskFreeRate();
        double q = market.getDividendYield();
        double expiry = market.getTimeToExpiry();
        int m = config.getPriceSteps();
        int n = config.getTimeSteps();

        double anchor = Math.max(market.getSpot(), payoff.referencePrice());
        double maxPrice = anchor * gridMultiple(config, sigma * Math.sqrt(expiry));
        double dS = maxPrice / m;
        double dTau = expiry / n;
        double stabilityRatio = sigma * sigma * (m - 1.0) * (m - 1.0) * dTau;

        Map<String, Object> gridDetails = gridDetails(config, maxPrice, dS, dTau, stabilityRatio);
        if (market.getSpot() / dS < MIN_NODES_BELOW_SPOT) {
            throw new NumericalInstabilityException(
                    String.format(
                            "PDE grid too coarse: spot %.4f lies within %d price steps of zero (step %.4f); "
                                    + "use more price steps",
                            market.getSpot(), MIN_NODES_BELOW_SPOT, dS),
                    gridDetails);
        }
        if (config.getScheme() == FiniteDifferenceScheme.EXPLICIT && stabilityRatio > EXPLICIT_STABILITY_LIMIT) {
            throw new NumericalInstabilityException(
                    String.format(
                            "Explicit scheme unstable: sigma^2 S^2 dt / dS^2 = %.4f exceeds %.1f; "
                                    + "use more time steps, fewer price steps or an implicit scheme",
                            stabilityRatio, EXPLICIT_STABILITY_LIMIT),
                    gridDetails);
        }

        double[] prices = new double[m + 1];
        double[] intrinsic = new double[m + 1];
        for (int j = 0; j <= m; j++) {
            prices[j] = j * dS;
            intrinsic[j] = payoff.evaluate(prices[j]);
        }

        double theta = theta(config.getScheme());
        double[] a = new double[m + 1];
        double[] b = new double[m + 1];
        double[] c = new double[m + 1];
        for (int j = 1; j < m; j++) {
            double diffusion = sigma * sigma * j * j;
            double convection = (r - q) * j;
            a[j] = 0.5 * (diffusion - convection);
            b[j] = -(diffusion + r);
            c[j] = 0.5 * (diffusion + convection);
        }
        TridiagonalSystem system = theta > 0.0 ? implicitSystem(a, b, c, m, theta * dTau) : null;

        // interior nodes start from cell averages, edges from the payoff itself
        double[] current = intrinsic.clone();
        for (int j = 1; j < m; j++) {
            current[j] = payoff.averageOver(prices[j] - 0.5 * dS, prices[j] + 0.5 * dS);
        }
        double[] next = new double[m + 1];
        double[] rhs = new double[m - 1];
        double[] interior = new double[m - 1];

        TreeSet<Integer> snapshotSteps = snapshotSteps(n, config.getSnapshotCount());
        List<Double> snapshotTimes = new ArrayList<>();
        List<double[]> snapshots = new ArrayList<>();
        snapshotTimes.add(0.0);
        snapshots.add(current.clone());

        for (int step = 1; step <= n; step++) {
            double tau = step * dTau;
            double lowerEdge = payoff.lowerBoundary(tau, r, q);
            double upperEdge = payoff.upperBoundary(maxPrice, tau, r, q);

            for (int j = 1; j < m; j++) {
                double explicitPart = a[j] * current[j - 1] + b[j] * current[j] + c[j] * current[j + 1];
                rhs[j - 1] = current[j] + (1.0 - theta) * dTau * explicitPart;
            }

            if (system != null) {
                rhs[0] += theta * dTau * a[1] * lowerEdge;
                rhs[m - 2] += theta * dTau * c[m - 1] * upperEdge;
                system.solve(rhs, interior);
                System.arraycopy(interior, 0, next, 1, m - 1);
            } else {
                System.arraycopy(rhs, 0, next, 1, m - 1);
            }
            next[0] = lowerEdge;
            next[m] = upperEdge;

            if (spec.isAmerican()) {
                for (int j = 0; j <= m; j++) {
                    next[j] = Math.max(next[j], intrinsic[j]);
                }
            }
            requireFinite(next, step, gridDetails);

            double[] swap = current;
            current = next;
            next = swap;

            if (snapshotSteps.contains(step)) {
                snapshotTimes.add(tau);
                snapshots.add(current.clone());
            }
        }

        double value = new SplineInterpolator().interpolate(prices, current).value(market.getSpot());
        long elapsed = (System.nanoTime() - started) / 1_000_000;
        log.info(
                "PDE {} {} {}: value={} grid={}x{} S_max={} in {}ms",
                config.getScheme(),
                spec.getExerciseStyle(),
                spec.getPayoffKind(),
                value,
                m,
                n,
                maxPrice,
                elapsed);

        DiagnosticGrid grid = DiagnosticGrid.builder()
                .prices(prices)
                .timesToExpiry(snapshotTimes)
                .values(snapshots)
                .maxPrice(maxPrice)
                .priceStep(dS)
                .timeStep(dTau)
                .build();

        return PricingResult.builder()
                .method(PricingMethod.FINITE_DIFFERENCE)
                .value(value)
                .steps(n)
                .diagnosticGrid(grid)
                .elapsedMillis(elapsed)
                .build();
    }

    /**
     * S_max / anchor: {@code width} standard deviations of log price above the anchor, floored at
     * {@link #MIN_GRID_MULTIPLE} and capped so that at least {@link #MIN_NODES_BELOW_ANCHOR} nodes
     * stay below the anchor. The cap rises with the price step count, so refining the grid also
     * pushes the truncation outwards.
     */
    static double gridMultiple(FiniteDifferenceConfig config, double stdDev) {
        double spread = Math.exp(config.getWidthInStdDevs() * stdDev);
        double resolutionCap = (double) config.getPriceSteps() / MIN_NODES_BELOW_ANCHOR;
        return Math.max(MIN_GRID_MULTIPLE, Math.min(spread, resolutionCap));
    }

    private static double theta(FiniteDifferenceScheme scheme) {
        return switch (scheme) {
            case IMPLICIT -> 1.0;
            case CRANK_NICOLSON -> 0.5;
            case EXPLICIT -> 0.0;
        };
    }

    /** Interior rows j = 1..M-1 of (I - theta dtau L). */
    private static TridiagonalSystem implicitSystem(double[] a, double[] b, double[] c, int m, double weight) {
        double[] lower = new double[m - 1];
        double[] diagonal = new double[m - 1];
        double[] upper = new double[m - 1];
        for (int j = 1; j < m; j++) {
            lower[j - 1] = -weight * a[j];
            diagonal[j - 1] = 1.0 - weight * b[j];
            upper[j - 1] = -weight * c[j];
        }
        return new TridiagonalSystem(lower, diagonal, upper);
    }

    /** Step indices whose slices are kept: evenly spaced interior steps plus the final step. */
    private static TreeSet<Integer> snapshotSteps(int timeSteps, int snapshotCount) {
        TreeSet<Integer> steps = new TreeSet<>();
        for (int i = 1; i <= snapshotCount; i++) {
            int step = (int) Math.round((double) i * timeSteps / (snapshotCount + 1));
            if (step > 0 && step < timeSteps) {
                steps.add(step);
            }
        }
        steps.add(timeSteps);
        return steps;
    }

    private static void requireFinite(double[] values, int step, Map<String, Object> gridDetails) {
        for (int j = 0; j < values.length; j++) {
            if (!Double.isFinite(values[j])) {
                Map<String, Object> details = new LinkedHashMap<>(gridDetails);
                details.put("failedAtStep", step);
                details.put("failedAtNode", j);
                throw new NumericalInstabilityException(
                        "PDE grid diverged at time step " + step + ", node " + j + ": " + values[j], details);
            }
        }
    }

    private static Map<String, Object> gridDetails(
            FiniteDifferenceConfig config, double maxPrice, double dS, double dTau, double stabilityRatio) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("scheme", config.getScheme().name());
        details.put("priceSteps", config.getPriceSteps());
        details.put("timeSteps", config.getTimeSteps());
        details.put("maxPrice", maxPrice);
        details.put("priceStep", dS);
        details.put("timeStep", dTau);
        details.put("stabilityRatio", stabilityRatio);
        return details;
    }
}
