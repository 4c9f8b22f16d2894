package com.optionlab.pricing.lattice;

import com.optionlab.config.PricingProperties;
import com.optionlab.domain.enums.PricingMethod;
import com.optionlab.domain.model.ExerciseBoundaryPoint;
import com.optionlab.domain.model.LatticeConfig;
import com.optionlab.domain.model.MarketParameters;
import com.optionlab.domain.model.OptionSpec;
import com.optionlab.domain.model.PricingResult;
import com.optionlab.exception.InvalidParameterException;
import com.optionlab.payoff.TerminalPayoff;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Prices European and American terminal payoffs on a recombining CRR binomial tree.
 *
 * <p>Backward induction from the terminal layer: the continuation value of node (m, i) is
 * e^(-r dt) * (p * V(m+1, i+1) + (1 - p) * V(m+1, i)). European nodes take the continuation
 * value; American nodes take max(continuation, immediate payoff) and are flagged as exercised when
 * the immediate payoff is strictly larger. The root value is the price.
 *
 * <p>Only two layers are resident: a buffer for layer m+1 and one for layer m, swapped after each
 * layer, each of length steps + 1. Nodes within a layer are independent, so layers with at least
 * {@code pricing.lattice.parallel-threshold} nodes are filled by a parallel stream. Results do not
 * depend on the threshold.
 *
 * <p>For American options the exercise boundary is read off each layer from the exercise flags:
 * <ul>
 *   <li>region touching the lowest node (put-like): the highest exercised price</li>
 *   <li>region touching the highest node (call-like): the lowest exercised price</li>
 *   <li>region strictly inside the layer: its lowest price</li>
 * </ul>
 * Layers with no exercised node contribute no point.
 */
@Component
public class LatticePricer {

    private static final Logger log = LoggerFactory.getLogger(LatticePricer.class);

    private final PricingProperties pricingProperties;

    public LatticePricer(PricingProperties pricingProperties) {
        this.pricingProperties = pricingProperties;
    }

    /**
     * @throws InvalidParameterException if the payoff is path dependent
     * @throws com.optionlab.exception.ArbitrageViolationException if the step size gives p outside (0, 1)
     */
    public PricingResult price(MarketParameters market, OptionSpec spec, LatticeConfig config) {
        if (!(spec.getPayoff() instanceof TerminalPayoff payoff)) {
            throw new InvalidParameterException(
                    "Lattice needs a terminal payoff; " + spec.getPayoffKind() + " is path dependent");
        }
        long started = System.nanoTime();

        int steps = config.getSteps();
        BinomialTree tree = BinomialTree.crr(market, steps);
        boolean american = spec.isAmerican();
        int parallelThreshold = pricingProperties.getLattice().getParallelThreshold();

        double[] next = new double[steps + 1];
        double[] current = new double[steps + 1];
        boolean[] exercised = american ? new boolean[steps + 1] : null;
        List<ExerciseBoundaryPoint> boundary = american ? new ArrayList<>() : null;

        double[] terminal = next;
        nodes(steps, parallelThreshold).forEach(i -> terminal[i] = payoff.evaluate(tree.price(steps, i)));

        double p = tree.probability();
        double discount = tree.discount();
        for (int m = steps - 1; m >= 0; m--) {
            int layer = m;
            double[] source = next;
            double[] target = current;
            nodes(layer, parallelThreshold).forEach(i -> {
                double continuation = discount * (p * source[i + 1] + (1.0 - p) * source[i]);
                if (american) {
                    double immediate = payoff.evaluate(tree.price(layer, i));
                    exercised[i] = immediate > continuation;
                    target[i] = exercised[i] ? immediate : continuation;
                } else {
                    target[i] = continuation;
                }
            });

            if (american) {
                double boundaryPrice = boundaryPrice(tree, layer, exercised);
                if (!Double.isNaN(boundaryPrice)) {
                    boundary.add(new ExerciseBoundaryPoint(tree.time(layer), boundaryPrice));
                }
            }

            current = source;
            next = target;
        }

        double value = next[0];
        long elapsed = (System.nanoTime() - started) / 1_000_000;
        if (american) {
            Collections.reverse(boundary);
        }
        log.info(
                "Lattice {} {}: value={} steps={} u={} p={} boundaryPoints={} in {}ms",
                spec.getExerciseStyle(),
                spec.getPayoffKind(),
                value,
                steps,
                tree.up(),
                p,
                american ? boundary.size() : 0,
                elapsed);

        return PricingResult.builder()
                .method(PricingMethod.LATTICE)
                .value(value)
                .steps(steps)
                .exerciseBoundary(american ? List.copyOf(boundary) : null)
                .elapsedMillis(elapsed)
                .build();
    }

    private static IntStream nodes(int layer, int parallelThreshold) {
        IntStream indices = IntStream.rangeClosed(0, layer);
        return layer + 1 >= parallelThreshold ? indices.parallel() : indices;
    }

    /** Price nearest the exercise/continue transition of {@code layer}, or NaN if nothing is exercised. */
    static double boundaryPrice(BinomialTree tree, int layer, boolean[] exercised) {
        if (exercised[0]) {
            int i = 0;
            while (i < layer && exercised[i + 1]) {
                i++;
            }
            return tree.price(layer, i);
        }
        if (exercised[layer]) {
            int i = layer;
            while (i > 0 && exercised[i - 1]) {
                i--;
            }
            return tree.price(layer, i);
        }
        for (int i = 1; i < layer; i++) {
            if (exercised[i]) {
                return tree.price(layer, i);
            }
        }
        return Double.NaN;
    }
}
