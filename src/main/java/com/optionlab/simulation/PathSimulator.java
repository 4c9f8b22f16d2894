package com.optionlab.simulation;

import com.optionlab.domain.model.MarketParameters;
import com.optionlab.domain.model.PricePath;
import com.optionlab.exception.InvalidParameterException;
import java.util.function.Supplier;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Component;

/**
 * Generates risk-neutral geometric Brownian motion price paths.
 *
 * <p>Each step applies the exact log-normal transition
 * <pre>
 * S(t + dt) = S(t) * exp((r - q - sigma^2 / 2) * dt + sigma * sqrt(dt) * Z),  Z ~ N(0, 1)
 * </pre>
 * with dt = T / steps, so there is no time-discretisation error in the marginal distribution of
 * any observed price. Randomness always comes from a caller-supplied generator; this class holds
 * no random state and is thread-safe.
 */
@Component
public class PathSimulator {

    /**
     * Lazy, restartable sequence of {@code paths} independent paths driven by sub-stream 0 of
     * {@code streams}.
     */
    public PathSequence simulate(MarketParameters market, int steps, int paths, RandomStreams streams) {
        return simulate(market, steps, paths, false, () -> streams.stream(0));
    }

    /**
     * Lazy sequence backed by {@code source}. The sequence restarts by calling {@code source}
     * again, so it is reproducible exactly when {@code source} returns identically seeded
     * generators.
     *
     * @param antithetic emit paths in pairs (Z, -Z); {@code paths} must then be even
     */
    public PathSequence simulate(
            MarketParameters market,
            int steps,
            int paths,
            boolean antithetic,
            Supplier<? extends RandomGenerator> source) {
        InvalidParameterException.require(steps >= 1, "Simulation steps must be >= 1, got " + steps);
        InvalidParameterException.require(paths >= 1, "Simulation paths must be >= 1, got " + paths);
        InvalidParameterException.require(
                !antithetic || paths % 2 == 0, "Antithetic simulation needs an even path count, got " + paths);
        return new PathSequence(this, market, steps, paths, antithetic, source);
    }

    public PricePath generatePath(MarketParameters market, int steps, RandomGenerator rng) {
        double dt = market.getTimeToExpiry() / steps;
        double drift = market.logDrift() * dt;
        double diffusion = market.getVolatility() * Math.sqrt(dt);

        double[] prices = new double[steps + 1];
        prices[0] = market.getSpot();
        for (int i = 1; i <= steps; i++) {
            prices[i] = prices[i - 1] * Math.exp(drift + diffusion * rng.nextGaussian());
        }
        return PricePath.wrap(prices, dt);
    }

    /**
     * Two paths driven by the same normal draws with opposite signs. Their payoffs are negatively
     * correlated for monotone payoffs, which is what antithetic sampling relies on.
     */
    public PricePath[] generateAntitheticPair(MarketParameters market, int steps, RandomGenerator rng) {
        double dt = market.getTimeToExpiry() / steps;
        double drift = market.logDrift() * dt;
        double diffusion = market.getVolatility() * Math.sqrt(dt);

        double[] up = new double[steps + 1];
        double[] down = new double[steps + 1];
        up[0] = market.getSpot();
        down[0] = market.getSpot();
        for (int i = 1; i <= steps; i++) {
            double shock = diffusion * rng.nextGaussian();
            up[i] = up[i - 1] * Math.exp(drift + shock);
            down[i] = down[i - 1] * Math.exp(drift - shock);
        }
        return new PricePath[] {PricePath.wrap(up, dt), PricePath.wrap(down, dt)};
    }
}
